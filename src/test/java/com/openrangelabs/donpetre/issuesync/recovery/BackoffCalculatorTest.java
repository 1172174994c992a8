package com.openrangelabs.donpetre.issuesync.recovery;

import com.openrangelabs.donpetre.issuesync.config.SyncProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffCalculatorTest {

    private final BackoffCalculator calculator = new BackoffCalculator();

    @Test
    void delay_WithoutJitter_DoublesUntilCap() {
        assertThat(calculator.delay(1, 1000, 30000, false)).isEqualTo(1000);
        assertThat(calculator.delay(2, 1000, 30000, false)).isEqualTo(2000);
        assertThat(calculator.delay(3, 1000, 30000, false)).isEqualTo(4000);
        assertThat(calculator.delay(5, 1000, 30000, false)).isEqualTo(16000);
        assertThat(calculator.delay(6, 1000, 30000, false)).isEqualTo(30000);
        assertThat(calculator.delay(12, 1000, 30000, false)).isEqualTo(30000);
    }

    @Test
    void delay_WithoutJitter_IsMonotonicAndDeterministic() {
        long previous = 0;
        for (int attempt = 1; attempt <= 80; attempt++) {
            long delay = calculator.delay(attempt, 250, 60000, false);
            assertThat(delay).isGreaterThanOrEqualTo(previous);
            assertThat(calculator.delay(attempt, 250, 60000, false)).isEqualTo(delay);
            previous = delay;
        }
    }

    @Test
    void delay_AttemptBelowOne_TreatedAsFirstAttempt() {
        assertThat(calculator.delay(0, 1000, 30000, false)).isEqualTo(1000);
        assertThat(calculator.delay(-3, 1000, 30000, false)).isEqualTo(1000);
    }

    @Test
    void delay_LargeAttempts_SaturateInsteadOfOverflowing() {
        assertThat(calculator.delay(Integer.MAX_VALUE, 1000, 30000, false)).isEqualTo(30000);
        assertThat(calculator.delay(64, 1000, 30000, false)).isEqualTo(30000);
        assertThat(calculator.delay(5, Long.MAX_VALUE / 4, Long.MAX_VALUE, false)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void delay_NonPositiveBase_IsZero() {
        assertThat(calculator.delay(3, 0, 30000, false)).isZero();
        assertThat(calculator.delay(3, 0, 30000, true)).isZero();
    }

    @Test
    void delay_WithJitter_StaysWithinZeroAndComputed() {
        BackoffCalculator seeded = new BackoffCalculator(new Random(42));

        for (int attempt = 1; attempt <= 8; attempt++) {
            long computed = calculator.delay(attempt, 1000, 30000, false);
            for (int i = 0; i < 200; i++) {
                assertThat(seeded.delay(attempt, 1000, 30000, true)).isBetween(0L, computed);
            }
        }
    }

    @Test
    void delay_WithJitter_ReachesBothBounds() {
        BackoffCalculator lowest = new BackoffCalculator(fixedRandom(0.0));
        BackoffCalculator highest = new BackoffCalculator(fixedRandom(0.9999999999));

        assertThat(lowest.delay(3, 1000, 30000, true)).isZero();
        assertThat(highest.delay(3, 1000, 30000, true)).isEqualTo(4000);
    }

    @Test
    void delay_FromProperties_UsesConfiguredBounds() {
        SyncProperties.Backoff backoff = new SyncProperties.Backoff();
        backoff.setBaseDelay(Duration.ofMillis(500));
        backoff.setMaxDelay(Duration.ofSeconds(3));
        backoff.setJitter(false);

        assertThat(calculator.delay(1, backoff)).isEqualTo(500);
        assertThat(calculator.delay(3, backoff)).isEqualTo(2000);
        assertThat(calculator.delay(4, backoff)).isEqualTo(3000);
    }

    private static Random fixedRandom(double value) {
        return new Random() {
            @Override
            public double nextDouble() {
                return value;
            }
        };
    }
}
