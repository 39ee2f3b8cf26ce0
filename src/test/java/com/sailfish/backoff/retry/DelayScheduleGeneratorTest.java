package com.sailfish.backoff.retry;

import com.sailfish.backoff.model.BackoffStrategy;
import com.sailfish.backoff.model.ScheduledDelay;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DelayScheduleGeneratorTest {

    private final DelayScheduleGenerator generator = new DelayScheduleGenerator();

    @Test
    @DisplayName("Exponential schedule doubles from the initial delay")
    void exponentialScheduleGrowsByFactor() {
        // Given
        BackoffConfig config = BackoffConfig.builder()
                .maxAttempts(4)
                .initialDelayMillis(10)
                .delayFactor(2)
                .jitter(0)
                .build();

        // When
        DelaySchedule schedule = generator.generate(config);

        // Then
        assertThat(schedule.getDelays()).containsExactly(
                Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40));
    }

    @Test
    @DisplayName("Linear schedule repeats the initial delay and ignores the factor")
    void linearScheduleIsConstant() {
        BackoffConfig config = BackoffConfig.builder()
                .maxAttempts(3)
                .initialDelayMillis(10)
                .delayFactor(7)
                .strategy(BackoffStrategy.LINEAR)
                .build();

        assertThat(generator.generate(config).getDelays())
                .containsExactly(Duration.ofMillis(10), Duration.ofMillis(10));
    }

    @Test
    @DisplayName("Defaults produce five delays growing by four from 20ms")
    void defaultScheduleMatchesDocumentedDefaults() {
        assertThat(generator.generate(BackoffConfig.defaults()).getDelays()).containsExactly(
                Duration.ofMillis(20), Duration.ofMillis(80), Duration.ofMillis(320),
                Duration.ofMillis(1280), Duration.ofMillis(5120));
    }

    @Test
    @DisplayName("A single attempt needs no delay")
    void singleAttemptHasEmptySchedule() {
        BackoffConfig config = BackoffConfig.builder().maxAttempts(1).build();

        assertThat(generator.generate(config).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Degenerate attempt counts yield an empty schedule instead of failing")
    void zeroOrNegativeAttemptsYieldEmptySchedule() {
        assertThat(generator.generate(0, Duration.ofMillis(10), 2, 0, BackoffStrategy.EXPONENTIAL, null).size()).isZero();
        assertThat(generator.generate(-3, Duration.ofMillis(10), 2, 0, BackoffStrategy.LINEAR, null).size()).isZero();
    }

    @Test
    @DisplayName("Jitter adds raw * jitter * U to every entry")
    void jitterIsAddedProportionally() {
        // Given
        DelayScheduleGenerator fixedRandom = new DelayScheduleGenerator(() -> 0.5);
        BackoffConfig config = BackoffConfig.builder()
                .maxAttempts(3)
                .initialDelayMillis(100)
                .delayFactor(2)
                .jitter(0.2)
                .build();

        // When
        DelaySchedule schedule = fixedRandom.generate(config);

        // Then: 100 + 100*0.2*0.5 and 200 + 200*0.2*0.5
        assertThat(schedule.getDelays()).containsExactly(Duration.ofMillis(110), Duration.ofMillis(220));
    }

    @Test
    @DisplayName("Random jitter never shortens a delay and keeps the schedule length")
    void randomJitterOnlyLengthensDelays() {
        BackoffConfig base = BackoffConfig.builder().maxAttempts(6).initialDelayMillis(10).delayFactor(3).build();
        BackoffConfig jittered = base.toBuilder().jitter(1.0).build();

        List<Duration> baseDelays = generator.generate(base).getDelays();
        for (int run = 0; run < 20; run++) {
            List<Duration> jitteredDelays = generator.generate(jittered).getDelays();
            assertThat(jitteredDelays).hasSameSizeAs(baseDelays);
            for (int i = 0; i < baseDelays.size(); i++) {
                assertThat(jitteredDelays.get(i))
                        .isGreaterThanOrEqualTo(baseDelays.get(i))
                        .isLessThanOrEqualTo(baseDelays.get(i).multipliedBy(2));
            }
        }
    }

    @Test
    @DisplayName("Without jitter the schedule is deterministic")
    void scheduleIsIdempotentWithoutJitter() {
        BackoffConfig config = BackoffConfig.builder().maxAttempts(5).initialDelayMillis(15).delayFactor(1.5).build();

        assertThat(generator.generate(config).getEntries()).isEqualTo(generator.generate(config).getEntries());
    }

    @Test
    @DisplayName("A reference instant adds absolute deadlines but keeps relative delays")
    void referenceInstantProducesDeadlines() {
        // Given
        Instant reference = Instant.parse("2024-01-01T00:00:00Z");
        BackoffConfig config = BackoffConfig.builder()
                .maxAttempts(3)
                .initialDelay(Duration.ofSeconds(1))
                .strategy(BackoffStrategy.LINEAR)
                .referenceInstant(reference)
                .build();

        // When
        DelaySchedule schedule = generator.generate(config);

        // Then
        assertThat(schedule.get(0)).isEqualTo(new ScheduledDelay(Duration.ofSeconds(1), reference.plusSeconds(1)));
        assertThat(schedule.get(1).getDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(schedule.get(1).getDeadline()).contains(reference.plusSeconds(1));
    }

    @Test
    @DisplayName("Entries without a reference instant carry no deadline")
    void relativeScheduleHasNoDeadlines() {
        DelaySchedule schedule = generator.generate(BackoffConfig.builder().maxAttempts(3).build());

        assertThat(schedule.getEntries()).allSatisfy(entry -> assertThat(entry.getDeadline()).isEmpty());
    }

    @Test
    @DisplayName("Huge exponential delays saturate instead of overflowing")
    void hugeDelaysSaturate() {
        DelaySchedule schedule = generator.generate(60, Duration.ofSeconds(1), 10, 0, BackoffStrategy.EXPONENTIAL,
                Instant.parse("2024-01-01T00:00:00Z"));

        assertThat(schedule.size()).isEqualTo(59);
        assertThat(schedule.get(58).getDelay()).isEqualTo(Duration.ofNanos(Long.MAX_VALUE));
        assertThat(schedule.get(58).getDeadline()).isPresent();
    }

    @Test
    @DisplayName("Zero factor keeps only the first delay")
    void zeroFactorCollapsesLaterDelays() {
        BackoffConfig config = BackoffConfig.builder().maxAttempts(4).initialDelayMillis(10).delayFactor(0).build();

        assertThat(generator.generate(config).getDelays())
                .containsExactly(Duration.ofMillis(10), Duration.ZERO, Duration.ZERO);
    }

    @Test
    @DisplayName("Each consumer gets its own queue over the schedule")
    void queuesAreIndependent() {
        DelaySchedule schedule = generator.generate(BackoffConfig.builder().maxAttempts(3).initialDelayMillis(5).build());

        var first = schedule.toQueue();
        first.poll();

        assertThat(first).hasSize(1);
        assertThat(schedule.toQueue()).hasSize(2);
        assertThat(schedule.size()).isEqualTo(2);
    }
}
