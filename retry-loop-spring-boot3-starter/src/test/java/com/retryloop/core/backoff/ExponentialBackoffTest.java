package com.retryloop.core.backoff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExponentialBackoffTest {

    @Test
    @DisplayName("Should draw each wait within current +/- randomization factor")
    void shouldStayWithinJitterBounds() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60),
                0.5, 1.5, new Random(42));

        Duration first = backoff.next();
        assertThat(first).isBetween(Duration.ofMillis(500), Duration.ofMillis(1500));
        assertThat(backoff.getInterval()).isEqualTo(first);
        assertThat(backoff.getCurrent()).isEqualTo(Duration.ofMillis(1500));

        Duration second = backoff.next();
        assertThat(second).isBetween(Duration.ofMillis(750), Duration.ofMillis(2250));
        assertThat(backoff.getCurrent()).isEqualTo(Duration.ofMillis(2250));
    }

    @Test
    @DisplayName("Without jitter the waits should grow by the multiplier")
    void shouldGrowGeometrically() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(200), Duration.ofSeconds(60),
                0, 1.5, new Random(1));

        assertThat(backoff.next()).isEqualTo(Duration.ofMillis(200));
        assertThat(backoff.next()).isEqualTo(Duration.ofMillis(300));
        assertThat(backoff.next()).isEqualTo(Duration.ofMillis(450));
    }

    @Test
    @DisplayName("Current interval should be capped at max")
    void shouldCapAtMax() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(2),
                0, 10, new Random(1));

        backoff.next();
        assertThat(backoff.getCurrent()).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.next()).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.getCurrent()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Current interval should never drop below 100ms after the first draw")
    void shouldApplyFloor() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(10), Duration.ofSeconds(60),
                0.5, 1.5, new Random(3));

        assertThat(backoff.next()).isBetween(Duration.ofMillis(5), Duration.ofMillis(15));
        assertThat(backoff.getCurrent()).isEqualTo(ExponentialBackoff.MIN_CURRENT);
    }

    @Test
    @DisplayName("Reset should restore the initial interval")
    void shouldReset() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(200), Duration.ofSeconds(60),
                0, 2, new Random(1));
        backoff.next();
        backoff.next();

        backoff.reset();

        assertThat(backoff.getCurrent()).isEqualTo(Duration.ofMillis(200));
        assertThat(backoff.next()).isEqualTo(Duration.ofMillis(200));
    }

    @Test
    @DisplayName("Same seed should yield the same sequence")
    void shouldBeDeterministicWithSeed() {
        ExponentialBackoff a = Backoffs.exponential(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.5, 1.5, 7);
        ExponentialBackoff b = Backoffs.exponential(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.5, 1.5, 7);

        for (int i = 0; i < 5; i++) {
            assertThat(a.next()).isEqualTo(b.next());
        }
    }

    @Test
    @DisplayName("Should reject invalid parameters")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofSeconds(1), Duration.ZERO, 0.5, 1.5, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60), 1.5, 1.5, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.5, 0, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
