package com.neoforge.orchestrator.cli;

import com.neoforge.orchestrator.agent.RunOutcome;
import com.neoforge.orchestrator.config.ForgeProperties;
import com.neoforge.orchestrator.pipeline.PhaseFailedException;
import com.neoforge.orchestrator.pipeline.PhasePipeline;
import com.neoforge.orchestrator.pipeline.PipelineReport;
import com.neoforge.orchestrator.workspace.ProjectWorkspace;
import com.neoforge.orchestrator.workspace.WorkspaceAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Optional;

/**
 * Process entry: one free-text requirement in, one generated project directory out.
 *
 * Usage:
 *   java -jar orchestrator.jar "Create a Snake game in Python"
 *
 * Exit codes: 0 on success, 1 when the pipeline fails, 2 on bad input.
 */
@Component
public class ForgeCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ForgeCommandLineRunner.class);

    static final int EXIT_OK          = 0;
    static final int EXIT_FAILED      = 1;
    static final int EXIT_BAD_REQUEST = 2;

    private final PhasePipeline        pipeline;
    private final WorkspaceAllocator   allocator;
    private final RequirementValidator validator;
    private final PrintStream          out;

    private volatile int exitCode = EXIT_OK;

    @Autowired
    public ForgeCommandLineRunner(PhasePipeline pipeline,
                                  WorkspaceAllocator allocator,
                                  ForgeProperties properties) {
        this(pipeline, allocator, new RequirementValidator(properties.requirement().maxLength()), System.out);
    }

    ForgeCommandLineRunner(PhasePipeline pipeline,
                           WorkspaceAllocator allocator,
                           RequirementValidator validator,
                           PrintStream out) {
        this.pipeline  = pipeline;
        this.allocator = allocator;
        this.validator = validator;
        this.out       = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.getNonOptionArgs().isEmpty()) {
            out.println("Usage: orchestrator <project_requirement>");
            out.println("Example: orchestrator \"Create a Snake game in Python\"");
            exitCode = EXIT_BAD_REQUEST;
            return;
        }

        String requirement = String.join(" ", args.getNonOptionArgs()).strip();
        Optional<String> problem = validator.problem(requirement);
        if (problem.isPresent()) {
            out.println("Error: " + problem.get());
            exitCode = EXIT_BAD_REQUEST;
            return;
        }

        ProjectWorkspace workspace = allocator.allocate(requirement);
        out.println("Project folder: " + workspace.root());
        log.info("Project directory: {}", workspace.root());

        try {
            PipelineReport report = pipeline.run(requirement, workspace);
            out.println("*** NEOFORGE EXECUTION COMPLETE ***");
            out.println("Project output: " + workspace.root());
            out.println(report.summary());
            exitCode = EXIT_OK;
        } catch (PhaseFailedException e) {
            log.error("Execution failed: {}", e.getMessage(), e);
            out.println("Execution failed: " + e.getMessage());
            RunOutcome outcome = e.outcome();
            if (outcome != null) {
                out.println("Phase '%s' engine run: %s after %d call(s), %d rate-limit hit(s), %d malformed retr%s."
                        .formatted(e.phaseName(), outcome.status(), outcome.productiveCalls(),
                                outcome.rateLimitHits(), outcome.malformedRetries(),
                                outcome.malformedRetries() == 1 ? "y" : "ies"));
            }
            exitCode = EXIT_FAILED;
        } catch (RuntimeException e) {
            log.error("Execution failed: {}", e.getMessage(), e);
            out.println("Execution failed: " + e.getMessage());
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
