package com.neoforge.orchestrator.pipeline;

import com.neoforge.orchestrator.workspace.ProjectWorkspace;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * One gated stage of the pipeline.
 *
 * @param name                stable identifier, e.g. "task-list"
 * @param agentLabel          display name of the agent playing this stage
 * @param systemPrompt        role instructions sent as the system message
 * @param instructionTemplate user message; {@code {requirement}}, {@code {deliverable}}
 *                            and {@code {inputs}} are substituted before the run
 * @param requiredArtifact    workspace-relative path that must exist once the stage ends
 * @param artifactKind        what "exists" means for {@code requiredArtifact}
 * @param consumes            deliverables of earlier stages this one reads
 */
public record Phase(
        String       name,
        String       agentLabel,
        String       systemPrompt,
        String       instructionTemplate,
        String       requiredArtifact,
        ArtifactKind artifactKind,
        List<String> consumes) {

    public enum ArtifactKind {
        /** A regular file. */
        FILE,
        /** A directory holding at least one regular file, at any depth. */
        NON_EMPTY_DIRECTORY
    }

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(requirement|deliverable|inputs)\\}");

    public Phase {
        consumes = List.copyOf(consumes);
    }

    /** The user message for this stage. Deterministic for a given requirement. */
    public String instruction(String requirement) {
        String inputs = consumes.isEmpty() ? "(none)" : String.join(", ", consumes);
        Map<String, String> values = Map.of(
                "requirement", requirement,
                "deliverable", requiredArtifact,
                "inputs",      inputs);
        // single pass: substituted text is never scanned for placeholders again
        Matcher m = PLACEHOLDER.matcher(instructionTemplate);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(values.get(m.group(1))));
        }
        m.appendTail(out);
        return out.toString();
    }

    /** Post-condition: the required artifact is present under the workspace root. */
    public boolean isSatisfiedIn(ProjectWorkspace workspace) {
        Path artifact = workspace.resolve(requiredArtifact);
        return switch (artifactKind) {
            case FILE -> Files.isRegularFile(artifact);
            case NON_EMPTY_DIRECTORY -> Files.isDirectory(artifact) && containsFile(artifact);
        };
    }

    private static boolean containsFile(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.anyMatch(Files::isRegularFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not inspect " + dir, e);
        }
    }
}
