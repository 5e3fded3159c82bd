package com.neoforge.orchestrator.config;

import com.neoforge.orchestrator.agent.EngineLimits;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Binding of the {@code neoforge.*} tree as it appears in application.yml.
 */
class ForgePropertiesTest {

    @Test
    void bind_relaxedNames_mapOntoEngineLimits() {
        ForgeProperties properties = bind(Map.of());

        EngineLimits limits = properties.engine().toLimits();
        assertThat(limits).isEqualTo(EngineLimits.defaults());
        assertThat(properties.credentials().variables()).containsExactly("GROQ_API_KEY", "GROQ_API_KEY_2");
        assertThat(properties.progress().pushedLogLines()).isEqualTo(5);
    }

    @Test
    void modelId_dropsRoutingPrefix() {
        assertThat(bind(Map.of()).modelId()).isEqualTo("llama-3.3-70b-versatile");
        assertThat(bind(Map.of("neoforge.model", "mixtral-8x7b")).modelId()).isEqualTo("mixtral-8x7b");
    }

    @Test
    void bind_overriddenBackoff_isParsedAsDuration() {
        ForgeProperties properties = bind(Map.of("neoforge.engine.backoff-base", "1m"));

        assertThat(properties.engine().backoffBase()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void bind_tooShortBroadcastInterval_failsNamingTheProperty() {
        assertThatThrownBy(() -> bind(Map.of("neoforge.progress.broadcast-interval-ms", "10")))
                .isInstanceOf(BindException.class)
                .hasRootCauseMessage("neoforge.progress.broadcast-interval-ms must be at least 50");
    }

    static ForgeProperties bind(Map<String, String> overrides) {
        Map<String, String> source = new HashMap<>();
        source.put("neoforge.model", "groq/llama-3.3-70b-versatile");
        source.put("neoforge.projects-dir", "projects");
        source.put("neoforge.credentials.variables[0]", "GROQ_API_KEY");
        source.put("neoforge.credentials.variables[1]", "GROQ_API_KEY_2");
        source.put("neoforge.engine.max-productive-calls", "25");
        source.put("neoforge.engine.max-rate-limit-hits", "30");
        source.put("neoforge.engine.max-malformed-retries", "2");
        source.put("neoforge.engine.backoff-base", "20s");
        source.put("neoforge.engine.max-jitter", "5s");
        source.put("neoforge.engine.temperature", "0.3");
        source.put("neoforge.requirement.max-length", "2000");
        source.put("neoforge.progress.broadcast-interval-ms", "500");
        source.put("neoforge.progress.pushed-log-lines", "5");
        source.putAll(overrides);
        return new Binder(new MapConfigurationPropertySource(source))
                .bind("neoforge", ForgeProperties.class)
                .get();
    }
}
