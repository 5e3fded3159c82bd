package com.neoforge.orchestrator.progress;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Read-only view of pipeline progress.
 *
 * GET /api/progress            : agent, task and the whole retained log
 * GET /api/progress?lines=5    : the same with only the last 5 log lines
 */
@RestController
@RequestMapping("/api/progress")
public class ProgressController {

    private final ProgressSink progress;

    public ProgressController(ProgressSink progress) {
        this.progress = progress;
    }

    @GetMapping
    public ProgressSnapshot snapshot(@RequestParam(name = "lines", required = false) Integer lines) {
        if (lines == null) {
            return progress.snapshot();
        }
        if (lines < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "lines must not be negative: " + lines);
        }
        return progress.snapshot(lines);
    }
}
