package com.admissionsrag.service.agent;

public enum AgentState {

    PLANNING,
    TOOL_DISPATCH,
    MERGE,
    DONE,
    FORCED_STOP;

    public boolean isTerminal() {
        return this == DONE || this == FORCED_STOP;
    }
}
