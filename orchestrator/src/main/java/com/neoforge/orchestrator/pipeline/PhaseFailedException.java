package com.neoforge.orchestrator.pipeline;

import com.neoforge.orchestrator.agent.RunOutcome;

/**
 * A stage finished without producing its required artifact. Aborts the whole run.
 */
public class PhaseFailedException extends RuntimeException {

    private final String     phaseName;
    private final String     artifact;
    private final RunOutcome outcome;

    public PhaseFailedException(Phase phase, RunOutcome outcome) {
        super("%s not created by %s agent (phase '%s', engine status %s: %s)".formatted(
                phase.requiredArtifact(), phase.agentLabel(), phase.name(),
                outcome == null ? "n/a" : outcome.status(),
                outcome == null ? "" : abbreviate(outcome.text())));
        this.phaseName = phase.name();
        this.artifact  = phase.requiredArtifact();
        this.outcome   = outcome;
    }

    public String phaseName()    { return phaseName; }
    public String artifact()     { return artifact; }
    public RunOutcome outcome()  { return outcome; }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() <= 120 ? text : text.substring(0, 117) + "...";
    }
}
