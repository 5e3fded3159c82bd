package com.neoforge.orchestrator.tool;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of tools a model may call.
 *
 * Each constant carries its wire name and the parameter documentation used
 * to build the function-calling schema.
 */
public enum ToolKind {

    WRITE_FILE("write_file",
            "Write content to a file at the given path.",
            List.of(new Parameter("path", "Relative file path to write to."),
                    new Parameter("content", "Content to write into the file."))),

    READ_FILE("read_file",
            "Read the content of a file at the given path.",
            List.of(new Parameter("path", "Relative file path to read from."))),

    LIST_DIR("list_dir",
            "List the entries of a directory at the given path.",
            List.of(new Parameter("path", "Relative directory path to list.")));

    /** A required string parameter of a tool. */
    public record Parameter(String name, String description) {}

    private final String          wireName;
    private final String          description;
    private final List<Parameter> parameters;

    ToolKind(String wireName, String description, List<Parameter> parameters) {
        this.wireName    = wireName;
        this.description = description;
        this.parameters  = parameters;
    }

    public String wireName()             { return wireName; }
    public String description()          { return description; }
    public List<Parameter> parameters()  { return parameters; }

    public static Optional<ToolKind> fromName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(name))
                .findFirst();
    }

    /**
     * OpenAI function-calling definition of this tool:
     * {@code {type: function, function: {name, description, parameters}}}.
     */
    public Map<String, Object> toFunctionDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (Parameter p : parameters) {
            properties.put(p.name(), Map.of("type", "string", "description", p.description()));
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", parameters.stream().map(Parameter::name).toList());

        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", wireName);
        function.put("description", description);
        function.put("parameters", schema);

        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("type", "function");
        definition.put("function", function);
        return definition;
    }
}
