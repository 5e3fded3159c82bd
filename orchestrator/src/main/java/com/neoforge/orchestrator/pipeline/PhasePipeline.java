package com.neoforge.orchestrator.pipeline;

import com.neoforge.orchestrator.agent.EngineRequest;
import com.neoforge.orchestrator.agent.ExecutionEngine;
import com.neoforge.orchestrator.agent.RunOutcome;
import com.neoforge.orchestrator.progress.ProgressSink;
import com.neoforge.orchestrator.tool.ToolSchema;
import com.neoforge.orchestrator.workspace.ProjectWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the stages of {@link PhaseCatalog} one after another.
 *
 * Each stage is one {@link ExecutionEngine} run scoped to the workspace root.
 * After the run returns, whatever its outcome, the stage's required artifact
 * must exist on disk. If it does not, the run stops with a
 * {@link PhaseFailedException} and no later stage starts: every later stage's
 * instructions assume the earlier deliverable is there.
 *
 * Only existence is checked. Whether the content is any good is the
 * validation stage's job.
 */
public class PhasePipeline {

    private static final Logger log = LoggerFactory.getLogger(PhasePipeline.class);

    private static final String SYSTEM = "System";

    private final ExecutionEngine engine;
    private final ProgressSink    progress;
    private final List<Phase>     phases;
    private final String          model;

    public PhasePipeline(ExecutionEngine engine, ProgressSink progress, List<Phase> phases, String model) {
        if (phases.isEmpty()) {
            throw new IllegalArgumentException("Pipeline needs at least one phase");
        }
        this.engine   = engine;
        this.progress = progress;
        this.phases   = List.copyOf(phases);
        this.model    = model;
    }

    /**
     * Run every stage against {@code workspace}.
     *
     * @throws PhaseFailedException on the first stage whose artifact is missing
     */
    public PipelineReport run(String requirement, ProjectWorkspace workspace) {
        log.info("Starting orchestration for: {}", requirement);
        log.info("Output directory: {}", workspace.root());
        progress.update(SYSTEM, "Starting pipeline", "Pipeline started in " + workspace.root());

        List<PipelineReport.PhaseResult> results = new ArrayList<>();
        for (int i = 0; i < phases.size(); i++) {
            Phase phase = phases.get(i);
            log.info("Phase {}/{}: {} ({})", i + 1, phases.size(), phase.name(), phase.agentLabel());
            results.add(runPhase(phase, requirement, workspace));
        }

        progress.update(SYSTEM, "Orchestration Complete", "Pipeline complete: " + phases.size() + " phases");
        log.info("Orchestration complete.");
        return new PipelineReport(workspace.root(), results);
    }

    /**
     * Run a single stage and check its post-condition.
     *
     * @throws PhaseFailedException if the required artifact is missing afterwards
     */
    public PipelineReport.PhaseResult runPhase(Phase phase, String requirement, ProjectWorkspace workspace) {
        MDC.put("phase", phase.name());
        try {
            String instruction = phase.instruction(requirement);
            progress.update(phase.agentLabel(), abbreviate(instruction, 60),
                    "Phase '" + phase.name() + "' started (" + phase.agentLabel() + ")");

            RunOutcome outcome = engine.run(new EngineRequest(
                    phase.agentLabel(),
                    phase.systemPrompt(),
                    instruction,
                    model,
                    workspace.root(),
                    ToolSchema.fileTools()));

            if (!phase.isSatisfiedIn(workspace)) {
                log.error("{} failed to create {} (engine status {}). Aborting.",
                        phase.agentLabel(), phase.requiredArtifact(), outcome.status());
                progress.update(phase.agentLabel(), "Failed: " + phase.requiredArtifact() + " missing",
                        "Phase '" + phase.name() + "' failed: " + phase.requiredArtifact() + " not created");
                throw new PhaseFailedException(phase, outcome);
            }

            if (!outcome.completed()) {
                log.warn("Phase '{}' ended with {} but produced {}; continuing",
                        phase.name(), outcome.status(), phase.requiredArtifact());
            }
            progress.update(phase.agentLabel(), "Produced " + phase.requiredArtifact(),
                    "Phase '" + phase.name() + "' produced " + phase.requiredArtifact());
            return new PipelineReport.PhaseResult(phase.name(), phase.requiredArtifact(), outcome);
        } finally {
            MDC.remove("phase");
        }
    }

    public List<Phase> phases() {
        return phases;
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
