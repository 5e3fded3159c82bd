package com.neoforge.orchestrator.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File operations confined to a project root.
 *
 * Every method takes the root explicitly; nothing here depends on the
 * process working directory, so two runs with different roots can share
 * one instance.
 *
 * Methods never throw. Failures come back as an "Error..." string because
 * the caller forwards the result into the model conversation, where the
 * model reads it and corrects its next tool call.
 */
@Component
public class SandboxedFileSystem {

    private static final Logger log = LoggerFactory.getLogger(SandboxedFileSystem.class);

    /**
     * Write {@code content} to {@code path}, creating parent directories as needed.
     */
    public String write(Path root, String path, String content) {
        Optional<Path> target = resolve(root, path, "write");
        if (target.isEmpty()) {
            return violation("write");
        }
        try {
            Path parent = target.get().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target.get(), content, StandardCharsets.UTF_8);
            log.info("Wrote {} chars to {}", content.length(), target.get());
            return "Successfully wrote to " + path;
        } catch (IOException | RuntimeException e) {
            log.error("Error writing to {}: {}", path, e.getMessage());
            return "Error writing file: " + e.getMessage();
        }
    }

    public String read(Path root, String path) {
        Optional<Path> target = resolve(root, path, "read");
        if (target.isEmpty()) {
            return violation("read");
        }
        if (!Files.exists(target.get())) {
            return "Error: File " + path + " does not exist.";
        }
        try {
            String content = Files.readString(target.get(), StandardCharsets.UTF_8);
            log.info("Read {} chars from {}", content.length(), target.get());
            return content;
        } catch (IOException | RuntimeException e) {
            log.error("Error reading {}: {}", path, e.getMessage());
            return "Error reading file: " + e.getMessage();
        }
    }

    /**
     * List the entries of a directory, sorted, one per line. Directories carry a trailing '/'.
     */
    public String list(Path root, String path) {
        Optional<Path> target = resolve(root, path, "list");
        if (target.isEmpty()) {
            return violation("list");
        }
        if (!Files.isDirectory(target.get())) {
            return "Error: Directory " + path + " does not exist.";
        }
        try (Stream<Path> entries = Files.list(target.get())) {
            List<String> names = entries
                    .map(p -> p.getFileName().toString() + (Files.isDirectory(p) ? "/" : ""))
                    .sorted()
                    .collect(Collectors.toList());
            return names.isEmpty() ? "(empty directory)" : String.join("\n", names);
        } catch (IOException | RuntimeException e) {
            log.error("Error listing {}: {}", path, e.getMessage());
            return "Error listing directory: " + e.getMessage();
        }
    }

    // ------------------------------------------------------------------
    // Containment
    // ------------------------------------------------------------------

    /**
     * Resolve {@code path} against the normalised root and keep it only if the
     * result is the root or a descendant of it.
     *
     * The comparison is element-wise ({@link Path#startsWith(Path)}), so
     * "/projects/app_evil" is not accepted under "/projects/app", and an
     * absolute path or a different filesystem root never is.
     */
    private Optional<Path> resolve(Path root, String path, String action) {
        Optional<Path> resolved = resolveQuietly(root, path);
        if (resolved.isEmpty()) {
            log.error("Security alert: path traversal attempt on {}: {} (root={})", action, path, root);
        }
        return resolved;
    }

    private static Optional<Path> resolveQuietly(Path root, String path) {
        if (path == null) {
            return Optional.empty();
        }
        try {
            Path base   = root.toAbsolutePath().normalize();
            Path target = base.resolve(path).normalize();
            return target.startsWith(base) ? Optional.of(target) : Optional.empty();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    private static String violation(String action) {
        return "Error: Security violation. Cannot " + action + " outside project root.";
    }
}
