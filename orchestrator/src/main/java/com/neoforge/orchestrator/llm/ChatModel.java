package com.neoforge.orchestrator.llm;

import com.neoforge.orchestrator.credential.Credential;

/**
 * A chat-completions endpoint with function calling.
 */
public interface ChatModel {

    /**
     * Send one request authenticated with {@code credential}.
     *
     * @throws ModelApiException when the endpoint rejects the request or cannot be reached
     */
    ChatCompletion complete(Credential credential, ChatRequest request);
}
