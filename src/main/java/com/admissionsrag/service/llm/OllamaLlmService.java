package com.admissionsrag.service.llm;

import com.admissionsrag.exception.GenerationException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class OllamaLlmService {

    private final ChatModel chatModel;
    private final OllamaOptions defaultOptions;

    /**
     * Generate answer with system and user messages
     */
    @CircuitBreaker(name = "ollama", fallbackMethod = "fallbackGenerate")
    @Retry(name = "ollama")
    public String generate(String systemPrompt, String userPrompt) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(systemPrompt));
        messages.add(new UserMessage(userPrompt));
        return call(new Prompt(messages, defaultOptions)).getText();
    }

    /**
     * Generate answer with only user prompt
     */
    @CircuitBreaker(name = "ollama", fallbackMethod = "fallbackGenerateSimple")
    @Retry(name = "ollama")
    public String generate(String prompt) {
        return call(new Prompt(List.of(new UserMessage(prompt)), defaultOptions)).getText();
    }

    /**
     * Generate from a full message history without offering tools.
     */
    @CircuitBreaker(name = "ollama", fallbackMethod = "fallbackGenerateWithHistory")
    @Retry(name = "ollama")
    public String generateWithHistory(List<Message> messages) {
        log.debug("Generating answer with history ({} messages)", messages.size());
        return call(new Prompt(List.copyOf(messages), defaultOptions)).getText();
    }

    /**
     * One planning turn: the model sees the history and the offered tools and
     * either answers or requests tool calls. Tool execution is left to the caller.
     */
    @CircuitBreaker(name = "ollama", fallbackMethod = "fallbackGenerateWithTools")
    @Retry(name = "ollama")
    public AssistantMessage generateWithTools(List<Message> messages, List<ToolCallback> tools) {
        log.debug("Planning turn with {} messages and {} tools", messages.size(), tools.size());

        ToolCallingChatOptions options = ToolCallingChatOptions.builder()
                .toolCallbacks(tools)
                .internalToolExecutionEnabled(false)
                .build();

        return call(new Prompt(List.copyOf(messages), options));
    }

    private AssistantMessage call(Prompt prompt) {
        try {
            ChatResponse response = chatModel.call(prompt);
            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                throw new GenerationException("Empty response from chat model");
            }
            log.debug("LLM response generated successfully");
            return response.getResult().getOutput();

        } catch (GenerationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error generating LLM response: {}", e.getMessage());
            throw new GenerationException("Failed to generate LLM response", e);
        }
    }

    private String fallbackGenerate(String systemPrompt, String userPrompt, Exception e) {
        throw unavailable(e);
    }

    private String fallbackGenerateSimple(String prompt, Exception e) {
        throw unavailable(e);
    }

    private String fallbackGenerateWithHistory(List<Message> messages, Exception e) {
        throw unavailable(e);
    }

    private AssistantMessage fallbackGenerateWithTools(List<Message> messages, List<ToolCallback> tools, Exception e) {
        throw unavailable(e);
    }

    private static GenerationException unavailable(Exception e) {
        log.warn("Chat model unavailable: {}", e.getMessage());
        if (e instanceof GenerationException generationException) {
            return generationException;
        }
        return new GenerationException("Chat model unavailable: " + e.getMessage(), e);
    }
}
