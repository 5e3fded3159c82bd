package com.neoforge.orchestrator.llm;

import java.util.List;

/**
 * The assistant message returned for one chat request.
 */
public record ChatCompletion(ChatMessage message) {

    public static ChatCompletion text(String content) {
        return new ChatCompletion(ChatMessage.assistant(content, null));
    }

    public static ChatCompletion toolCalls(ToolCall... calls) {
        return new ChatCompletion(ChatMessage.assistant(null, List.of(calls)));
    }

    public boolean hasToolCalls() {
        return message.hasToolCalls();
    }

    public List<ToolCall> toolCalls() {
        return hasToolCalls() ? message.toolCalls() : List.of();
    }

    /** Assistant text, never null. */
    public String content() {
        return message.content() == null ? "" : message.content();
    }
}
