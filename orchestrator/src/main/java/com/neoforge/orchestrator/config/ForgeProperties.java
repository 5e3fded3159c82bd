package com.neoforge.orchestrator.config;

import com.neoforge.orchestrator.agent.EngineLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Settings under the {@code neoforge.*} prefix. Defaults live in application.yml.
 *
 * Values are checked when bound, so a bad setting stops startup with the
 * offending property named in the error.
 */
@ConfigurationProperties(prefix = "neoforge")
public record ForgeProperties(
        String      model,
        String      projectsDir,
        Credentials credentials,
        Engine      engine,
        Requirement requirement,
        Progress    progress) {

    private static final String PROVIDER_PREFIX = "groq/";

    public ForgeProperties {
        require(model != null && !model.isBlank(), "neoforge.model must not be blank");
        require(projectsDir != null && !projectsDir.isBlank(), "neoforge.projects-dir must not be blank");
        require(credentials != null, "neoforge.credentials is required");
        require(engine != null, "neoforge.engine is required");
        require(requirement != null, "neoforge.requirement is required");
        require(progress != null, "neoforge.progress is required");
    }

    /** Environment variables scanned for API keys, in pool order. */
    public record Credentials(List<String> variables) {
        public Credentials {
            require(variables != null && !variables.isEmpty(), "neoforge.credentials.variables must not be empty");
            variables = List.copyOf(variables);
        }
    }

    public record Engine(
            int      maxProductiveCalls,
            int      maxRateLimitHits,
            int      maxMalformedRetries,
            Duration backoffBase,
            Duration maxJitter,
            double   temperature) {

        public Engine {
            require(backoffBase != null && maxJitter != null, "neoforge.engine backoff settings are required");
            require(temperature >= 0.0 && temperature <= 2.0, "neoforge.engine.temperature must be within [0, 2]");
        }

        /** Budgets are range-checked by {@link EngineLimits} itself. */
        public EngineLimits toLimits() {
            return new EngineLimits(maxProductiveCalls, maxRateLimitHits, maxMalformedRetries,
                    backoffBase, maxJitter, temperature);
        }
    }

    public record Requirement(int maxLength) {
        public Requirement {
            require(maxLength >= 1, "neoforge.requirement.max-length must be positive");
        }
    }

    public record Progress(long broadcastIntervalMs, int pushedLogLines) {
        public Progress {
            require(broadcastIntervalMs >= 50, "neoforge.progress.broadcast-interval-ms must be at least 50");
            require(pushedLogLines >= 1, "neoforge.progress.pushed-log-lines must be positive");
        }
    }

    /** Model id as the endpoint expects it; a "groq/" routing prefix is dropped. */
    public String modelId() {
        return model.startsWith(PROVIDER_PREFIX) ? model.substring(PROVIDER_PREFIX.length()) : model;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
