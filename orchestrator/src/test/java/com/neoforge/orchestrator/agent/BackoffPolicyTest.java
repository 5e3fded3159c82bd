package com.neoforge.orchestrator.agent;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    static final Duration BASE   = Duration.ofSeconds(20);
    static final Duration JITTER = Duration.ofSeconds(5);

    @Test
    void delayFor_doublesPerCycleOnTopOfJitter() {
        BackoffPolicy policy = new BackoffPolicy(BASE, JITTER, () -> 0.0);

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(20));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(40));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(80));
    }

    @Test
    void delayFor_jitterStaysBelowItsBound() {
        BackoffPolicy policy = new BackoffPolicy(BASE, JITTER, () -> 0.999_999);

        assertThat(policy.delayFor(1)).isLessThan(BASE.plus(JITTER));
    }

    @Test
    void delayFor_isStrictlyIncreasingEvenWithWorstCaseJitter() {
        // highest jitter on cycle n against no jitter on cycle n+1
        BackoffPolicy high = new BackoffPolicy(BASE, JITTER, () -> 0.999_999);
        BackoffPolicy low  = new BackoffPolicy(BASE, JITTER, () -> 0.0);

        for (int cycle = 1; cycle < 8; cycle++) {
            assertThat(low.delayFor(cycle + 1)).isGreaterThan(high.delayFor(cycle));
        }
    }

    @Test
    void delayFor_growsUntilCapThenHoldsAtCap() {
        BackoffPolicy policy = new BackoffPolicy(BASE, JITTER, () -> 0.999_999);

        assertThat(policy.delayFor(8)).isLessThan(BackoffPolicy.MAX_DELAY);
        assertThat(policy.delayFor(9)).isEqualTo(BackoffPolicy.MAX_DELAY);
        // a single-key pool reaches cycle 30 within the default rate-limit budget
        assertThat(policy.delayFor(30)).isEqualTo(BackoffPolicy.MAX_DELAY);
        assertThat(policy.delayFor(Integer.MAX_VALUE)).isEqualTo(BackoffPolicy.MAX_DELAY);
    }

    @Test
    void delayFor_neverDecreasesAcrossAllCycles() {
        BackoffPolicy policy = new BackoffPolicy(BASE, JITTER, () -> 0.5);

        for (int cycle = 1; cycle < 40; cycle++) {
            assertThat(policy.delayFor(cycle + 1)).isGreaterThanOrEqualTo(policy.delayFor(cycle));
        }
    }

    @Test
    void constructor_rejectsBaseBeyondCap() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofHours(2), JITTER, () -> 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void delayFor_rejectsCycleZero() {
        BackoffPolicy policy = new BackoffPolicy(BASE, JITTER, () -> 0.0);

        assertThatThrownBy(() -> policy.delayFor(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void engineLimits_rejectJitterAsLargeAsBase() {
        assertThatThrownBy(() -> new EngineLimits(25, 30, 2, BASE, BASE, 0.3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxJitter");
    }
}
