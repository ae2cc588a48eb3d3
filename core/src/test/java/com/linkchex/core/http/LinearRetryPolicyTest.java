package com.linkchex.core.http;

import com.linkchex.core.model.FailureKind;
import com.linkchex.core.model.ProbeFailure;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LinearRetryPolicyTest {

    @Test
    void max_attempts_is_retries_plus_one() {
        assertEquals(1, new LinearRetryPolicy(0, Duration.ofSeconds(1)).maxAttempts());
        assertEquals(4, new LinearRetryPolicy(3, Duration.ofSeconds(1)).maxAttempts());
        assertEquals(1, new LinearRetryPolicy(-2, Duration.ofSeconds(1)).maxAttempts());
    }

    @Test
    void retries_only_transport_failures_until_budget() {
        var p = new LinearRetryPolicy(2, Duration.ofSeconds(1));
        ProbeFailure timeout = ProbeFailure.of(FailureKind.TIMEOUT, "timed out");

        assertTrue(p.shouldRetry(timeout, 1));
        assertTrue(p.shouldRetry(timeout, 2));
        assertFalse(p.shouldRetry(timeout, 3), "must stop at maxAttempts");

        for (FailureKind k : new FailureKind[]{FailureKind.REDIRECT_LIMIT, FailureKind.INVALID_URL, FailureKind.CANCELLED}) {
            assertFalse(p.shouldRetry(ProbeFailure.of(k, "x"), 1), "must not retry " + k);
        }
        assertFalse(p.shouldRetry(null, 1));
    }

    @Test
    void delay_grows_linearly() {
        var p = new LinearRetryPolicy(3, Duration.ofMillis(500));
        assertEquals(Duration.ofMillis(500), p.nextDelay(1));
        assertEquals(Duration.ofMillis(1000), p.nextDelay(2));
        assertEquals(Duration.ofMillis(1500), p.nextDelay(3));
        assertEquals(Duration.ZERO, new LinearRetryPolicy(1, null).nextDelay(1));
    }
}
