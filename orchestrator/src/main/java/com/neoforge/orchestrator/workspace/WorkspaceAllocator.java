package com.neoforge.orchestrator.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Derives a project directory from the requirement text.
 *
 * "Build a snake game" becomes {@code <projectsDir>/build_a_snake_game}. When
 * that directory already exists a timestamp suffix is appended instead of
 * reusing it, so an earlier build is never overwritten.
 */
public class WorkspaceAllocator {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceAllocator.class);

    private static final int MAX_SLUG_LENGTH = 80;
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path  projectsDir;
    private final Clock clock;

    public WorkspaceAllocator(Path projectsDir, Clock clock) {
        this.projectsDir = projectsDir.toAbsolutePath().normalize();
        this.clock       = clock;
    }

    /**
     * Pick a free directory for {@code requirement} and create it with its subdirectories.
     */
    public ProjectWorkspace allocate(String requirement) {
        String slug = slugify(requirement);
        if (slug.isEmpty()) {
            slug = "project";
        }
        Path dir = projectsDir.resolve(slug);
        if (Files.exists(dir)) {
            dir = projectsDir.resolve(slug + "_" + LocalDateTime.now(clock).format(STAMP));
            log.info("Project folder already exists, using timestamped path {}", dir);
        }
        return new ProjectWorkspace(dir).prepare();
    }

    /**
     * Lower-case, strip punctuation, collapse whitespace and hyphens into '_', cap the length.
     */
    public static String slugify(String text) {
        String slug = text.strip().toLowerCase(Locale.ROOT)
                .replaceAll("[^\\w\\s-]", "")
                .replaceAll("[\\s\\-]+", "_")
                .replaceAll("_+", "_");
        slug = stripUnderscores(slug);
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH);
        }
        return slug;
    }

    private static String stripUnderscores(String s) {
        int start = 0;
        int end   = s.length();
        while (start < end && s.charAt(start) == '_') start++;
        while (end > start && s.charAt(end - 1) == '_') end--;
        return s.substring(start, end);
    }
}
