package com.neoforge.orchestrator.tool;

import java.util.Map;

/**
 * Typed arguments of a tool call, one record per {@link ToolKind}.
 */
public interface ToolArguments {

    ToolKind kind();

    record WriteFile(String path, String content) implements ToolArguments {
        @Override public ToolKind kind() { return ToolKind.WRITE_FILE; }
    }

    record ReadFile(String path) implements ToolArguments {
        @Override public ToolKind kind() { return ToolKind.READ_FILE; }
    }

    record ListDir(String path) implements ToolArguments {
        @Override public ToolKind kind() { return ToolKind.LIST_DIR; }
    }

    /**
     * Build the typed record for {@code kind} from a parsed JSON argument map.
     *
     * @throws ToolArgumentException if a required argument is absent or not a string
     */
    static ToolArguments of(ToolKind kind, Map<String, Object> raw) {
        return switch (kind) {
            case WRITE_FILE -> new WriteFile(required(kind, raw, "path"), required(kind, raw, "content"));
            case READ_FILE  -> new ReadFile(required(kind, raw, "path"));
            case LIST_DIR   -> new ListDir(optional(raw, "path", "."));
        };
    }

    private static String required(ToolKind kind, Map<String, Object> raw, String name) {
        Object value = raw.get(name);
        if (value == null) {
            throw new ToolArgumentException(
                    "Missing required argument '" + name + "' for " + kind.wireName() + ".");
        }
        if (!(value instanceof String)) {
            throw new ToolArgumentException(
                    "Argument '" + name + "' for " + kind.wireName() + " must be a string.");
        }
        return (String) value;
    }

    private static String optional(Map<String, Object> raw, String name, String fallback) {
        Object value = raw.get(name);
        return value instanceof String s && !s.isBlank() ? s : fallback;
    }
}
