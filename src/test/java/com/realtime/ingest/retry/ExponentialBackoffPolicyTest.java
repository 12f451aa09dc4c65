package com.realtime.ingest.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ExponentialBackoffPolicyTest {

    private final ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy();

    @Test
    void testDelayDoublesPerRetry() {
        assertThat(policy.delay(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delay(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delay(3)).isEqualTo(Duration.ofSeconds(8));
        assertThat(policy.delay(0)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void testCustomUnit() {
        ExponentialBackoffPolicy fast = new ExponentialBackoffPolicy(Duration.ofMillis(10));
        assertThat(fast.delay(2)).isEqualTo(Duration.ofMillis(40));
    }

    @Test
    void testWorstCaseStallForDefaultRetries() {
        // maxRetries=3: 等待2秒和4秒后进入死信
        assertThat(policy.worstCaseStall(3)).isEqualTo(Duration.ofSeconds(6));
        assertThat(policy.worstCaseStall(1)).isEqualTo(Duration.ZERO);
    }

    @Test
    void testRejectsOutOfRangeRetryCount() {
        assertThatThrownBy(() -> policy.delay(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policy.delay(ExponentialBackoffPolicy.MAX_EXPONENT + 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testRejectsNegativeUnit() {
        assertThatThrownBy(() -> new ExponentialBackoffPolicy(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
