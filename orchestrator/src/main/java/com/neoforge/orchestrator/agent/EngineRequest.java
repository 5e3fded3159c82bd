package com.neoforge.orchestrator.agent;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything one engine run needs.
 *
 * @param agentLabel   display name used in logs and progress, e.g. "Team Lead"
 * @param projectRoot  root every tool call of the run is confined to
 * @param tools        function definitions advertised to the model
 */
public record EngineRequest(
        String agentLabel,
        String systemPrompt,
        String userMessage,
        String model,
        Path projectRoot,
        List<Map<String, Object>> tools) {}
