package com.netcracker.core.ddisync.client.ddi;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TokenBucketTest {
    private final AtomicLong now = new AtomicLong(1_000_000L);

    @Test
    void reserveShouldAdmitBurstUpToCapacity() {
        TokenBucket bucket = new TokenBucket(3, now::get);

        assertThat(bucket.reserve()).isZero();
        assertThat(bucket.reserve()).isZero();
        assertThat(bucket.reserve()).isZero();
        assertThat(bucket.reserve()).isPositive();
    }

    @Test
    void reserveShouldQueueWaitersInOrder() {
        TokenBucket bucket = new TokenBucket(2, now::get);
        bucket.reserve();
        bucket.reserve();

        long first = bucket.reserve();
        long second = bucket.reserve();

        assertThat(first).isCloseTo(TimeUnit.MILLISECONDS.toNanos(500), within(1_000L));
        assertThat(second).isCloseTo(TimeUnit.MILLISECONDS.toNanos(1000), within(1_000L));
    }

    @Test
    void refillShouldNotExceedCapacity() {
        TokenBucket bucket = new TokenBucket(5, now::get);
        bucket.reserve();

        now.addAndGet(TimeUnit.SECONDS.toNanos(10));

        assertThat(bucket.availableTokens()).isEqualTo(5.0);
    }

    @Test
    void refillShouldRepayBorrowedTokens() {
        TokenBucket bucket = new TokenBucket(10, now::get);
        for (int i = 0; i < 15; i++) {
            bucket.reserve();
        }
        assertThat(bucket.availableTokens()).isCloseTo(-5.0, within(1e-6));

        now.addAndGet(TimeUnit.MILLISECONDS.toNanos(500));

        assertThat(bucket.availableTokens()).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void acquireShouldNotSleepWhileTokensRemain() throws Exception {
        TokenBucket bucket = new TokenBucket(100);
        long start = System.nanoTime();

        bucket.acquire();

        assertThat(System.nanoTime() - start).isLessThan(TimeUnit.MILLISECONDS.toNanos(200));
    }

    @Test
    void constructorShouldRejectNonPositiveRate() {
        assertThatThrownBy(() -> new TokenBucket(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
