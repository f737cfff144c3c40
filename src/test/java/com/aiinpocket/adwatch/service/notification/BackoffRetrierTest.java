package com.aiinpocket.adwatch.service.notification;

import com.aiinpocket.adwatch.exception.DeliveryException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffRetrierTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final BackoffRetrier retrier = new BackoffRetrier(sleeps::add);

    @Test
    void shouldGrowDelayExponentiallyWithBoundedJitter() {
        Duration base = Duration.ofSeconds(1);

        assertThat(BackoffRetrier.backoffDelay(base, 0, 0.0)).isEqualTo(Duration.ofMillis(900));
        assertThat(BackoffRetrier.backoffDelay(base, 0, 1.0)).isEqualTo(Duration.ofMillis(1100));
        assertThat(BackoffRetrier.backoffDelay(base, 1, 0.5)).isEqualTo(Duration.ofMillis(1500));
        assertThat(BackoffRetrier.backoffDelay(base, 2, 0.5)).isEqualTo(Duration.ofMillis(2250));
    }

    @Test
    void shouldReturnAfterFirstSuccess() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();

        retrier.execute(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new DeliveryException("HTTP 429");
            }
        }, 3, Duration.ofSeconds(1), "test");

        assertThat(calls).hasValue(2);
        assertThat(sleeps).hasSize(1);
        assertThat(sleeps.get(0)).isBetween(Duration.ofMillis(900), Duration.ofMillis(1100));
    }

    @Test
    void shouldThrowLastErrorAfterMaxRetries() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retrier.execute(() -> {
            throw new DeliveryException("attempt " + calls.incrementAndGet());
        }, 3, Duration.ofSeconds(1), "test"))
                .isInstanceOf(DeliveryException.class)
                .hasMessage("attempt 3");

        assertThat(calls).hasValue(3);
        assertThat(sleeps).hasSize(2);
        assertThat(sleeps.get(1)).isBetween(Duration.ofMillis(1350), Duration.ofMillis(1650));
    }

    @Test
    void shouldWrapUnexpectedExceptions() {
        assertThatThrownBy(() -> retrier.execute(() -> {
            throw new IllegalStateException("socket closed");
        }, 1, Duration.ofSeconds(1), "test"))
                .isInstanceOf(DeliveryException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldAttemptAtLeastOnce() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retrier.execute(() -> {
            calls.incrementAndGet();
            throw new DeliveryException("down");
        }, 0, Duration.ofSeconds(1), "test")).isInstanceOf(DeliveryException.class);

        assertThat(calls).hasValue(1);
    }
}
