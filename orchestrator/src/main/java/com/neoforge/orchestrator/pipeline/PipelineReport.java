package com.neoforge.orchestrator.pipeline;

import com.neoforge.orchestrator.agent.RunOutcome;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a successful pipeline run, one entry per stage in execution order.
 */
public record PipelineReport(Path projectRoot, List<PhaseResult> phases) {

    public record PhaseResult(String phase, String artifact, RunOutcome outcome) {}

    public PipelineReport {
        phases = List.copyOf(phases);
    }

    public String summary() {
        return "NeoForge pipeline completed. Output in: " + projectRoot;
    }
}
