package com.neoforge.orchestrator.progress;

import java.util.List;

/**
 * Immutable copy of the progress record at one instant.
 */
public record ProgressSnapshot(String agent, String task, List<String> logs) {

    public ProgressSnapshot {
        logs = List.copyOf(logs);
    }
}
