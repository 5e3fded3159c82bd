package com.neoforge.orchestrator.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neoforge.orchestrator.credential.Credential;
import com.neoforge.orchestrator.tool.ToolSchema;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the client against an in-process HTTP server bound to a random port.
 */
class OpenAiCompatibleClientTest {

    static final Credential KEY = new Credential("gsk_test_key_0123456789");

    final ObjectMapper json = new ObjectMapper();

    HttpServer server;
    OpenAiCompatibleClient client;

    final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    final AtomicReference<String> lastBody          = new AtomicReference<>();
    volatile int    status       = 200;
    volatile String responseBody = "";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/openai/v1/chat/completions", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/openai/v1/";
        client = new OpenAiCompatibleClient(baseUrl, Duration.ofSeconds(2), Duration.ofSeconds(5), json);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void complete_postsBearerKeyAndWireFieldNames() throws IOException {
        responseBody = """
                {"id":"x","choices":[{"index":0,"message":{"role":"assistant","content":"hello"},"finish_reason":"stop"}]}
                """;
        ChatRequest request = new ChatRequest("llama-3.3-70b-versatile",
                List.of(ChatMessage.system("sys"), ChatMessage.tool("call_1", "ok")),
                ToolSchema.fileTools(), "auto", 0.3);

        ChatCompletion completion = client.complete(KEY, request);

        assertThat(completion.content()).isEqualTo("hello");
        assertThat(completion.hasToolCalls()).isFalse();
        assertThat(lastAuthorization.get()).isEqualTo("Bearer gsk_test_key_0123456789");
        JsonNode sent = json.readTree(lastBody.get());
        assertThat(sent.get("tool_choice").asText()).isEqualTo("auto");
        assertThat(sent.get("messages").get(1).get("tool_call_id").asText()).isEqualTo("call_1");
        assertThat(sent.get("messages").get(0).has("tool_calls")).isFalse();
        assertThat(sent.get("tools")).hasSize(2);
    }

    @Test
    void complete_toolCallResponse_isDecoded() {
        responseBody = """
                {"choices":[{"message":{"role":"assistant","content":null,"tool_calls":[
                  {"id":"call_7","type":"function","function":{"name":"write_file","arguments":"{\\"path\\":\\"PRD.md\\"}"}}
                ]}}]}
                """;

        ChatCompletion completion = client.complete(KEY, minimalRequest());

        assertThat(completion.toolCalls()).singleElement().satisfies(call -> {
            assertThat(call.id()).isEqualTo("call_7");
            assertThat(call.functionName()).isEqualTo("write_file");
            assertThat(call.argumentsJson()).isEqualTo("{\"path\":\"PRD.md\"}");
        });
        assertThat(completion.content()).isEmpty();
    }

    @Test
    void complete_429_isRaisedAsRateLimited() {
        status       = 429;
        responseBody = "{\"error\":{\"code\":\"rate_limit_exceeded\"}}";

        assertThatThrownBy(() -> client.complete(KEY, minimalRequest()))
                .isInstanceOfSatisfying(ModelApiException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ModelApiException.Kind.RATE_LIMITED);
                    assertThat(e.statusCode()).isEqualTo(429);
                });
    }

    @Test
    void parse_noChoices_isFatal() {
        assertThatThrownBy(() -> client.parse("{\"choices\":[]}"))
                .isInstanceOfSatisfying(ModelApiException.class,
                        e -> assertThat(e.kind()).isEqualTo(ModelApiException.Kind.FATAL));
    }

    @Test
    void parse_garbage_isFatal() {
        assertThatThrownBy(() -> client.parse("<html>Bad Gateway</html>"))
                .isInstanceOfSatisfying(ModelApiException.class,
                        e -> assertThat(e.kind()).isEqualTo(ModelApiException.Kind.FATAL));
    }

    static ChatRequest minimalRequest() {
        return new ChatRequest("m", List.of(ChatMessage.user("hi")), ToolSchema.fileTools(), "auto", 0.3);
    }
}
