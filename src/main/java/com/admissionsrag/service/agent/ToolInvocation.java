package com.admissionsrag.service.agent;

/**
 * One tool call made by the agent, for the response and the logs.
 */
public record ToolInvocation(int step, String tool, String arguments, boolean failed) {
}
