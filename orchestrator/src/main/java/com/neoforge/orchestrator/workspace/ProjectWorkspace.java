package com.neoforge.orchestrator.workspace;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The directory a pipeline run writes into.
 *
 * All file operations of the run are confined under {@link #root()}.
 */
public record ProjectWorkspace(Path root) {

    /** Subdirectories created before the first phase runs. */
    public static final List<String> SUBDIRECTORIES = List.of("src", "tests", "frontend", "logs");

    public ProjectWorkspace {
        root = root.toAbsolutePath().normalize();
    }

    /**
     * Create the root and every entry of {@link #SUBDIRECTORIES}. Safe to call twice.
     */
    public ProjectWorkspace prepare() {
        try {
            Files.createDirectories(root);
            for (String sub : SUBDIRECTORIES) {
                Files.createDirectories(root.resolve(sub));
            }
            return this;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not prepare workspace " + root, e);
        }
    }

    /** Absolute location of a workspace-relative path. */
    public Path resolve(String relative) {
        return root.resolve(relative).normalize();
    }
}
