package com.neoforge.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neoforge.orchestrator.credential.Credential;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Client for an OpenAI-compatible chat-completions endpoint (Groq by default).
 *
 * Plain {@link HttpClient} plus Jackson: one POST per call, no SDK. The same
 * instance serves every key in the pool; the key is chosen per request by the
 * caller.
 */
@Component
public class OpenAiCompatibleClient implements ChatModel {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CompletionResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(ChatMessage message) {}
    }

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public OpenAiCompatibleClient(@Value("${neoforge.api.base-url}") String baseUrl,
                                  @Value("${neoforge.api.connect-timeout:10s}") Duration connectTimeout,
                                  @Value("${neoforge.api.request-timeout:120s}") Duration requestTimeout,
                                  ObjectMapper objectMapper) {
        this.baseUrl        = stripTrailingSlash(baseUrl);
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public ChatCompletion complete(Credential credential, ChatRequest request) {
        HttpResponse<String> response;
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/chat/completions"))
                    .timeout(requestTimeout)
                    .header("Content-Type",  "application/json")
                    .header("Authorization", "Bearer " + credential.secret())
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(request)))
                    .build();
            response = http.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelApiException(ModelApiException.Kind.FATAL, "Model API call interrupted", e);
        } catch (IOException e) {
            throw new ModelApiException(ModelApiException.Kind.FATAL, "Model API call failed: " + e.getMessage(), e);
        }

        if (response.statusCode() != 200) {
            throw ModelApiException.fromResponse(response.statusCode(), response.body());
        }
        return parse(response.body());
    }

    ChatCompletion parse(String body) {
        try {
            CompletionResponse parsed = json.readValue(body, CompletionResponse.class);
            if (parsed.choices() == null || parsed.choices().isEmpty() || parsed.choices().get(0).message() == null) {
                throw new ModelApiException(ModelApiException.Kind.FATAL, 200, "Model response has no choices: " + body);
            }
            return new ChatCompletion(parsed.choices().get(0).message());
        } catch (IOException e) {
            throw new ModelApiException(ModelApiException.Kind.FATAL, "Unreadable model response", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
