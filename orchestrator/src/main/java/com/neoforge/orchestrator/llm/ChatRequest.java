package com.neoforge.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Body of POST /chat/completions.
 */
public record ChatRequest(
        String model,
        List<ChatMessage> messages,
        List<Map<String, Object>> tools,
        @JsonProperty("tool_choice") String toolChoice,
        double temperature) {

    public ChatRequest {
        messages = List.copyOf(messages);
    }
}
