package com.neoforge.orchestrator.tool;

import java.util.List;
import java.util.Map;

/**
 * The tool definitions sent with a chat request.
 */
public final class ToolSchema {

    private static final List<ToolKind> FILE_TOOLS = List.of(ToolKind.WRITE_FILE, ToolKind.READ_FILE);

    private ToolSchema() {}

    /** The fixed schema every phase runs with: write_file and read_file. */
    public static List<Map<String, Object>> fileTools() {
        return of(FILE_TOOLS);
    }

    public static List<Map<String, Object>> of(List<ToolKind> kinds) {
        return kinds.stream().map(ToolKind::toFunctionDefinition).toList();
    }
}
