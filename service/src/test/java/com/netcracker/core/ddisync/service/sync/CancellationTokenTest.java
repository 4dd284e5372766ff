package com.netcracker.core.ddisync.service.sync;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    void cancelShouldStopToken() {
        CancellationToken token = CancellationToken.create();
        assertThat(token.shouldStop()).isFalse();
        assertThat(token.stopReason()).isEmpty();

        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.shouldStop()).isTrue();
        assertThat(token.stopReason()).contains("Cancelled on request");
    }

    @Test
    void deadlineShouldExpireWithClock() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMinutes(5), clock);

        assertThat(token.deadline()).contains(Instant.parse("2024-01-01T00:05:00Z"));
        assertThat(token.isExpired()).isFalse();

        clock.advance(Duration.ofMinutes(5));

        assertThat(token.isExpired()).isTrue();
        assertThat(token.isCancelled()).isFalse();
        assertThat(token.stopReason()).hasValueSatisfying(reason -> assertThat(reason).startsWith("Deadline"));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(@NotNull ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
