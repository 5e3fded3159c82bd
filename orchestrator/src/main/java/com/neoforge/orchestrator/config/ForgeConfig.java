package com.neoforge.orchestrator.config;

import com.neoforge.orchestrator.agent.BackoffPolicy;
import com.neoforge.orchestrator.agent.EngineLimits;
import com.neoforge.orchestrator.agent.ExecutionEngine;
import com.neoforge.orchestrator.agent.Sleeper;
import com.neoforge.orchestrator.credential.CredentialPool;
import com.neoforge.orchestrator.pipeline.PhaseCatalog;
import com.neoforge.orchestrator.pipeline.PhasePipeline;
import com.neoforge.orchestrator.progress.ProgressSink;
import com.neoforge.orchestrator.workspace.WorkspaceAllocator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Wiring for the pieces that are plain classes rather than components.
 *
 * The credential pool is built here, so a missing key fails application
 * startup before any phase can run.
 */
@Configuration
@EnableConfigurationProperties(ForgeProperties.class)
public class ForgeConfig {

    @Bean
    CredentialPool credentialPool(Environment environment, ForgeProperties properties) {
        return CredentialPool.build(environment::getProperty, properties.credentials().variables());
    }

    @Bean
    EngineLimits engineLimits(ForgeProperties properties) {
        return properties.engine().toLimits();
    }

    @Bean
    BackoffPolicy backoffPolicy(EngineLimits limits) {
        return new BackoffPolicy(limits.backoffBase(), limits.maxJitter(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    PhasePipeline phasePipeline(ExecutionEngine engine, ProgressSink progress, ForgeProperties properties) {
        return new PhasePipeline(engine, progress, PhaseCatalog.standard(), properties.modelId());
    }

    @Bean
    WorkspaceAllocator workspaceAllocator(ForgeProperties properties, Clock clock) {
        return new WorkspaceAllocator(Path.of(properties.projectsDir()), clock);
    }
}
