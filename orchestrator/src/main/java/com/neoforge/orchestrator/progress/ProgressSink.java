package com.neoforge.orchestrator.progress;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared status of the running pipeline: active agent, current task, and the
 * most recent log lines.
 *
 * Written by the pipeline thread, read by any number of observers. Every read
 * and write goes through one lock. The log keeps at most {@link #capacity()}
 * lines and drops the oldest first.
 */
@Component
public class ProgressSink {

    public static final int DEFAULT_CAPACITY = 50;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<String> logs;
    private final int           capacity;

    private String agent = "Idle";
    private String task  = "Waiting...";

    public ProgressSink() {
        this(DEFAULT_CAPACITY);
    }

    public ProgressSink(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.logs     = new ArrayDeque<>(capacity);
    }

    public void update(String agentLabel, String taskText) {
        update(agentLabel, taskText, null);
    }

    /**
     * Set the current agent and task; append {@code logLine} when it is non-blank.
     */
    public void update(String agentLabel, String taskText, String logLine) {
        lock.lock();
        try {
            this.agent = agentLabel;
            this.task  = taskText;
            if (logLine != null && !logLine.isBlank()) {
                if (logs.size() == capacity) {
                    logs.removeFirst();
                }
                logs.addLast(logLine);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Current status with the whole retained log. */
    public ProgressSnapshot snapshot() {
        return snapshot(capacity);
    }

    /** Current status with at most the last {@code lastLines} log lines. */
    public ProgressSnapshot snapshot(int lastLines) {
        lock.lock();
        try {
            List<String> all = new ArrayList<>(logs);
            int from = Math.max(0, all.size() - Math.max(0, lastLines));
            return new ProgressSnapshot(agent, task, all.subList(from, all.size()));
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
