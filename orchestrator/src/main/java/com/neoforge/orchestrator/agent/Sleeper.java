package com.neoforge.orchestrator.agent;

import java.time.Duration;

/**
 * Blocks the calling thread. Tests substitute a recorder.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
