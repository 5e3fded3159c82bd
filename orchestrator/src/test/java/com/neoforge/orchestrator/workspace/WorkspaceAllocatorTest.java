package com.neoforge.orchestrator.workspace;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class WorkspaceAllocatorTest {

    @TempDir Path projects;

    Clock fixed = Clock.fixed(Instant.parse("2026-03-14T09:26:53Z"), ZoneOffset.UTC);

    @Test
    void slugify_stripsPunctuationAndCollapsesSeparators() {
        assertThat(WorkspaceAllocator.slugify("  Build a Snake-game!!  in   Python ")).isEqualTo("build_a_snake_game_in_python");
    }

    @Test
    void slugify_capsLengthAt80() {
        assertThat(WorkspaceAllocator.slugify("x".repeat(200))).hasSize(80);
    }

    @Test
    void allocate_freshName_createsRootAndSubdirectories() {
        ProjectWorkspace ws = new WorkspaceAllocator(projects, fixed).allocate("Build a counter CLI");

        assertThat(ws.root()).isEqualTo(projects.resolve("build_a_counter_cli").toAbsolutePath().normalize());
        for (String sub : ProjectWorkspace.SUBDIRECTORIES) {
            assertThat(ws.root().resolve(sub)).isDirectory();
        }
    }

    @Test
    void allocate_existingName_appendsTimestampInsteadOfReusing() throws IOException {
        Path existing = Files.createDirectories(projects.resolve("build_a_counter_cli"));
        Files.writeString(existing.resolve("PRD.md"), "old build");

        ProjectWorkspace ws = new WorkspaceAllocator(projects, fixed).allocate("Build a counter CLI");

        assertThat(ws.root().getFileName().toString()).isEqualTo("build_a_counter_cli_20260314_092653");
        assertThat(existing.resolve("PRD.md")).hasContent("old build");
    }

    @Test
    void allocate_requirementWithoutWordCharacters_fallsBackToDefaultName() {
        ProjectWorkspace ws = new WorkspaceAllocator(projects, fixed).allocate("!!!");

        assertThat(ws.root().getFileName().toString()).isEqualTo("project");
    }
}
