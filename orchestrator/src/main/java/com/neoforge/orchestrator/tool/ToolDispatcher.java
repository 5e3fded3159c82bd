package com.neoforge.orchestrator.tool;

import com.neoforge.orchestrator.workspace.SandboxedFileSystem;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Routes a named tool call to the sandboxed file layer and returns its text result.
 *
 * <p>Every call is timed and counted:
 * <pre>
 *   neoforge.tool.calls{tool, status="success|error|unsupported|bad_arguments"}
 *   neoforge.tool.duration{tool}
 * </pre>
 *
 * The result is always plain text. Unknown tools and bad arguments produce an
 * "Error: ..." string rather than an exception, because the model is expected
 * to read it and retry.
 */
@Component
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final SandboxedFileSystem files;
    private final MeterRegistry       meterRegistry;

    public ToolDispatcher(SandboxedFileSystem files, MeterRegistry meterRegistry) {
        this.files         = files;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Dispatch one tool call scoped to {@code root}.
     *
     * @param name      tool name as sent by the model, e.g. "write_file"
     * @param arguments parsed JSON arguments
     * @param root      the run's project root
     */
    public String dispatch(String name, Map<String, Object> arguments, Path root) {
        Optional<ToolKind> kind = ToolKind.fromName(name);
        if (kind.isEmpty()) {
            log.warn("Model requested unsupported tool '{}'", name);
            meterRegistry.counter("neoforge.tool.calls", "tool", "unknown", "status", "unsupported").increment();
            return "Error: Unsupported tool '" + name + "'. Available tools: " + availableTools() + ".";
        }

        ToolArguments typed;
        try {
            typed = ToolArguments.of(kind.get(), arguments);
        } catch (ToolArgumentException e) {
            log.warn("Bad arguments for {}: {}", name, e.getMessage());
            meterRegistry.counter("neoforge.tool.calls", "tool", name, "status", "bad_arguments").increment();
            return "Error: " + e.getMessage();
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        String result = execute(typed, root);
        sample.stop(meterRegistry.timer("neoforge.tool.duration", "tool", name));
        String status = result.startsWith("Error") ? "error" : "success";
        meterRegistry.counter("neoforge.tool.calls", "tool", name, "status", status).increment();
        return result;
    }

    private String execute(ToolArguments arguments, Path root) {
        return switch (arguments.kind()) {
            case WRITE_FILE -> {
                ToolArguments.WriteFile w = (ToolArguments.WriteFile) arguments;
                yield files.write(root, w.path(), w.content());
            }
            case READ_FILE -> files.read(root, ((ToolArguments.ReadFile) arguments).path());
            case LIST_DIR  -> files.list(root, ((ToolArguments.ListDir) arguments).path());
        };
    }

    private static String availableTools() {
        return Arrays.stream(ToolKind.values())
                .map(ToolKind::wireName)
                .collect(Collectors.joining(", "));
    }
}
