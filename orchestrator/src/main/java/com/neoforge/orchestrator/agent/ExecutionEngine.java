package com.neoforge.orchestrator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neoforge.orchestrator.credential.Credential;
import com.neoforge.orchestrator.credential.CredentialPool;
import com.neoforge.orchestrator.credential.RotationCursor;
import com.neoforge.orchestrator.llm.ChatCompletion;
import com.neoforge.orchestrator.llm.ChatMessage;
import com.neoforge.orchestrator.llm.ChatModel;
import com.neoforge.orchestrator.llm.ChatRequest;
import com.neoforge.orchestrator.llm.ModelApiException;
import com.neoforge.orchestrator.llm.ToolCall;
import com.neoforge.orchestrator.progress.ProgressSink;
import com.neoforge.orchestrator.tool.ToolDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The tool-calling loop for one conversation.
 *
 * For a given {@link EngineRequest}, this class:
 *   1. Sends the conversation plus tool schema to the model with the current key
 *   2. On a rate limit, rotates to the next key, backing off exponentially once
 *      every key in the pool has been rejected in a row
 *   3. On an undecodable tool call, appends a corrective message and retries
 *   4. On tool calls, runs each one through the {@link ToolDispatcher} inside the
 *      run's project root and feeds the text result back
 *   5. Stops at the first answer without tool calls
 *
 * Productive calls and rate-limit hits are budgeted separately: a rejected
 * request never uses up a productive slot.
 *
 * One run owns its conversation and its {@link RotationCursor}. Iterations of
 * a run are strictly sequential.
 */
@Component
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    static final String CORRECTION_MESSAGE =
            "Your previous tool call was malformed. "
            + "You MUST call tools using the provided JSON function schema. "
            + "Do NOT use XML-style <function=...> syntax. Please retry.";

    static final String UNPARSABLE_ARGUMENTS =
            "Error: Could not parse tool arguments. Please retry with valid JSON.";

    private static final String TOOL_CHOICE = "auto";

    private final ChatModel          chatModel;
    private final CredentialPool     credentials;
    private final ToolDispatcher     dispatcher;
    private final ProgressSink       progress;
    private final ToolArgumentParser argumentParser;
    private final EngineLimits       limits;
    private final BackoffPolicy      backoff;
    private final Sleeper            sleeper;
    private final MeterRegistry      meterRegistry;

    public ExecutionEngine(ChatModel chatModel,
                           CredentialPool credentials,
                           ToolDispatcher dispatcher,
                           ProgressSink progress,
                           ObjectMapper objectMapper,
                           EngineLimits limits,
                           BackoffPolicy backoff,
                           Sleeper sleeper,
                           MeterRegistry meterRegistry) {
        this.chatModel      = chatModel;
        this.credentials    = credentials;
        this.dispatcher     = dispatcher;
        this.progress       = progress;
        this.argumentParser = new ToolArgumentParser(objectMapper);
        this.limits         = limits;
        this.backoff        = backoff;
        this.sleeper        = sleeper;
        this.meterRegistry  = meterRegistry;
    }

    /**
     * Drive one conversation to a terminal answer or until a budget runs out.
     *
     * @throws ModelApiException for failures that are not retried: anything other
     *         than a rate limit, or a malformed tool call once its budget is spent
     */
    public RunOutcome run(EngineRequest request) {
        String agent = request.agentLabel();
        MDC.put("agent", agent);
        try {
            return loop(request, agent);
        } finally {
            MDC.remove("agent");
        }
    }

    private RunOutcome loop(EngineRequest request, String agent) {
        List<ChatMessage> conversation = new ArrayList<>();
        conversation.add(ChatMessage.system(request.systemPrompt()));
        conversation.add(ChatMessage.user(request.userMessage()));

        RotationCursor cursor = credentials.newCursor();
        int productiveCalls  = 0;
        int rateLimitHits    = 0;
        int malformedRetries = 0;

        log.info("[{}] Starting | model={} | keys={} | root={}",
                agent, request.model(), cursor.poolSize(), request.projectRoot());
        progress.update(agent, "Thinking...", "[" + agent + "] Started");

        while (productiveCalls < limits.maxProductiveCalls() && rateLimitHits < limits.maxRateLimitHits()) {
            Credential credential = cursor.current();

            // --- Call the model ---
            ChatCompletion completion;
            try {
                completion = chatModel.complete(credential, new ChatRequest(
                        request.model(), conversation, request.tools(), TOOL_CHOICE, limits.temperature()));
                productiveCalls++;
                cursor.onSuccess();
                meterRegistry.counter("neoforge.engine.calls", "agent", agent).increment();
            } catch (ModelApiException e) {
                if (e.kind() == ModelApiException.Kind.RATE_LIMITED) {
                    rateLimitHits++;
                    meterRegistry.counter("neoforge.engine.rate_limits", "agent", agent).increment();
                    rotate(agent, cursor, credential, rateLimitHits);
                    continue;
                }
                if (e.kind() == ModelApiException.Kind.MALFORMED_TOOL_CALL
                        && malformedRetries < limits.maxMalformedRetries()) {
                    malformedRetries++;
                    meterRegistry.counter("neoforge.engine.malformed", "agent", agent).increment();
                    log.warn("[{}] Malformed tool call (attempt {}/{}). Injecting correction...",
                            agent, malformedRetries, limits.maxMalformedRetries());
                    progress.update(agent, "Correcting malformed tool call...",
                            "[" + agent + "] Malformed tool call, retry " + malformedRetries);
                    conversation.add(ChatMessage.user(CORRECTION_MESSAGE));
                    continue;
                }
                log.error("[{}] Model call failed (kind={}, key={}): {}",
                        agent, e.kind(), credential.masked(), e.getMessage());
                throw e;
            }

            // --- Terminal answer ---
            if (!completion.hasToolCalls()) {
                String result = completion.content();
                log.info("[{}] Completed. Output: {} chars | calls: {} | rate hits: {}",
                        agent, result.length(), productiveCalls, rateLimitHits);
                progress.update(agent, "Done", "[" + agent + "] Completed");
                return new RunOutcome(RunOutcome.Status.COMPLETED, result,
                        productiveCalls, rateLimitHits, malformedRetries);
            }

            // --- Tool calls ---
            conversation.add(completion.message());
            for (ToolCall call : completion.toolCalls()) {
                conversation.add(ChatMessage.tool(call.id(), executeTool(agent, call, request)));
            }
        }

        if (rateLimitHits >= limits.maxRateLimitHits()) {
            log.error("[{}] Aborted: too many rate-limit hits ({}).", agent, rateLimitHits);
            progress.update(agent, "Aborted: rate limited", "[" + agent + "] Aborted after " + rateLimitHits + " rate-limit hits");
            return new RunOutcome(RunOutcome.Status.RATE_LIMITED, RunOutcome.rateLimitedSentinel(rateLimitHits),
                    productiveCalls, rateLimitHits, malformedRetries);
        }
        log.warn("[{}] Reached max tool calls ({}) without finishing.", agent, limits.maxProductiveCalls());
        progress.update(agent, "Stopped: max calls reached", "[" + agent + "] Reached max calls");
        return new RunOutcome(RunOutcome.Status.MAX_CALLS_REACHED, RunOutcome.MAX_CALLS_SENTINEL,
                productiveCalls, rateLimitHits, malformedRetries);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Move to the next key. Sleeps only when the rotation completed a full sweep.
     */
    private void rotate(String agent, RotationCursor cursor, Credential limited, int rateLimitHits) {
        int from = cursor.index();
        boolean exhausted = cursor.onRateLimited();
        int size = cursor.poolSize();

        if (!exhausted) {
            log.warn("[{}] Key [{}/{}] {} rate-limited. Rotating -> key [{}/{}] (rate hits: {}/{})",
                    agent, from + 1, size, limited.masked(), cursor.index() + 1, size,
                    rateLimitHits, limits.maxRateLimitHits());
            progress.update(agent, "Rotating -> key [" + (cursor.index() + 1) + "/" + size + "]...");
            return;
        }

        Duration wait = backoff.delayFor(cursor.exhaustionCycle());
        log.warn("[{}] All {} key(s) exhausted (cycle {}, rate hits: {}/{}). Waiting {}s...",
                agent, size, cursor.exhaustionCycle(), rateLimitHits, limits.maxRateLimitHits(),
                String.format("%.1f", wait.toMillis() / 1000.0));
        progress.update(agent, "All keys exhausted. Waiting " + wait.toSeconds() + "s...",
                "[" + agent + "] All keys exhausted, backing off " + wait.toSeconds() + "s");
        meterRegistry.summary("neoforge.engine.backoff.seconds").record(wait.toMillis() / 1000.0);
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during rate-limit backoff", e);
        }
    }

    private String executeTool(String agent, ToolCall call, EngineRequest request) {
        String name = call.functionName();
        Optional<Map<String, Object>> arguments = argumentParser.parse(call.argumentsJson());
        if (arguments.isEmpty()) {
            log.error("[{}] Malformed tool args for {}: {}", agent, name, call.argumentsJson());
            progress.update(agent, "Bad arguments for " + name, "[" + agent + "] Malformed arguments for " + name);
            return UNPARSABLE_ARGUMENTS;
        }
        log.info("[{}] Tool: {}({})", agent, name, arguments.get().keySet());
        progress.update(agent, "Using tool: " + name, "[" + agent + "] Tool: " + name + describePath(arguments.get()));
        return dispatcher.dispatch(name, arguments.get(), request.projectRoot());
    }

    private static String describePath(Map<String, Object> arguments) {
        Object path = arguments.get("path");
        return path == null ? "" : " " + path;
    }
}
