package com.neoforge.orchestrator.pipeline;

import java.util.List;

/**
 * The stages of the generation pipeline and the prompts that drive them.
 *
 * Each stage asks for exactly one deliverable. Small models follow a single
 * "read these, write that, stop" instruction far more reliably than a
 * multi-output brief.
 */
public final class PhaseCatalog {

    private PhaseCatalog() {}

    public static final String PRD          = "PRD.md";
    public static final String ARCHITECTURE = "ARCHITECTURE.md";
    public static final String TASK_LIST    = "TASK_LIST.json";
    public static final String SOURCES      = "src";
    public static final String VALIDATION   = "VALIDATION_REPORT.md";
    public static final String TESTS        = "tests/test_main.py";

    /** The six stages, in execution order. */
    public static List<Phase> standard() {
        return List.of(
                new Phase("prd", "Project Manager", PRD_PROMPT,
                        "Write a PRD for this project: {requirement}",
                        PRD, Phase.ArtifactKind.FILE, List.of()),
                new Phase("architecture", "Architect", ARCHITECTURE_PROMPT,
                        "Project: {requirement}\nRead {inputs}, then write {deliverable} with the folder layout and file list.",
                        ARCHITECTURE, Phase.ArtifactKind.FILE, List.of(PRD)),
                new Phase("task-list", "Team Lead", TASK_LIST_PROMPT,
                        "Project: {requirement}\nRead {inputs}, then write {deliverable}.",
                        TASK_LIST, Phase.ArtifactKind.FILE, List.of(PRD, ARCHITECTURE)),
                new Phase("implementation", "Developer", DEVELOPER_PROMPT,
                        "Project: {requirement}\nRead {inputs}. Implement every source file listed.",
                        SOURCES, Phase.ArtifactKind.NON_EMPTY_DIRECTORY, List.of(ARCHITECTURE, TASK_LIST)),
                new Phase("validation", "Backend Logic Validator", VALIDATOR_PROMPT,
                        "Project: {requirement}\nRead {inputs}, read each source file, write {deliverable}.",
                        VALIDATION, Phase.ArtifactKind.FILE, List.of(TASK_LIST)),
                new Phase("tests", "QA Tester", TESTER_PROMPT,
                        "Project: {requirement}\nRead {inputs}, read each source file once, write {deliverable}.",
                        TESTS, Phase.ArtifactKind.FILE, List.of(TASK_LIST))
        );
    }

    // ------------------------------------------------------------------
    // Stage prompts
    // ------------------------------------------------------------------

    private static final String PRD_PROMPT = """
            You are a Project Manager. Write a detailed Product Requirements Document for the given project.
            Call write_file ONCE with path='PRD.md' containing a thorough PRD. Then stop.
            """;

    private static final String ARCHITECTURE_PROMPT = """
            You are a Project Manager and System Architect.
            First, call read_file with path='PRD.md' to read the requirements.
            Then call write_file ONCE with path='ARCHITECTURE.md'.

            The ARCHITECTURE.md must describe:
            1. Technology stack choices
            2. Folder layout:
               - src/      : main source code files (list each file with its purpose)
               - tests/    : unit test files
               - frontend/ : HTML/CSS/JS files (if applicable)
               - logs/     : runtime log files
            3. Every source file explicitly, one per line, with its purpose.
            """;

    private static final String TASK_LIST_PROMPT = """
            You are a Team Lead. Break the project into development tasks.
            First, call read_file with path='PRD.md'.
            Then, call read_file with path='ARCHITECTURE.md'.
            Then, call write_file ONCE with path='TASK_LIST.json'.

            The JSON must be an array of task objects, each with: id, name, description, files.
            The 'files' key must list REAL source file paths that match ARCHITECTURE.md,
            e.g. ["src/main.py", "src/model.py"].

            Rules:
            - Do NOT use names like 'file1.txt'.
            - Use paths from the architecture (src/, frontend/, tests/).
            - Stop after writing TASK_LIST.json.
            """;

    private static final String DEVELOPER_PROMPT = """
            You are a senior Developer. Implement ALL project source files listed in TASK_LIST.json.

            Steps:
            1. Call read_file with path='ARCHITECTURE.md'
            2. Call read_file with path='TASK_LIST.json'
            3. For EVERY file in the 'files' array of every task, call write_file with COMPLETE working code.
               - Use the exact path from the task list (e.g. 'src/main.py').
               - Write real runnable code: no placeholders, no pseudocode.
               - Include all imports, classes, functions, and a working entry point.

            Write every file. Stop only after ALL files are written.
            """;

    private static final String VALIDATOR_PROMPT = """
            You are a Code Reviewer. Validate the generated source files.
            1. Call read_file with path='TASK_LIST.json' to get the file list.
            2. Call read_file for each source file.
            3. Call write_file ONCE with path='VALIDATION_REPORT.md', a real report with
               CRITICAL / ADVISORY / NITPICK findings.
            Stop after writing the report.
            """;

    private static final String TESTER_PROMPT = """
            You are a QA Engineer. Write unit tests for the project.
            1. Call read_file with path='TASK_LIST.json' to get the file list.
            2. Call read_file for each source file (once each).
            3. Call write_file ONCE with path='tests/test_main.py' using pytest.
               Include happy path, edge case, and error condition tests.
            Stop immediately after writing. Do NOT re-read or rewrite the test file.
            """;
}
