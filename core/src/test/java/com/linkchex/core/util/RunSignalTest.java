package com.linkchex.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RunSignalTest {

    @Test
    void deadline_expires() throws Exception {
        RunSignal sig = RunSignal.withTimeout(Duration.ofMillis(30));
        assertThat(sig.isCancelled()).isFalse();
        Thread.sleep(60);
        assertThat(sig.isCancelled()).isTrue();
        assertThat(sig.remaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    void child_follows_parent_cancel_but_not_vice_versa() {
        RunSignal parent = RunSignal.create();
        RunSignal child = parent.child(null);
        child.cancel();
        assertThat(parent.isCancelled()).isFalse();

        RunSignal other = parent.child(Duration.ofMinutes(1));
        parent.cancel();
        assertThat(other.isCancelled()).isTrue();
    }

    @Test
    void cap_uses_shorter_of_request_timeout_and_remaining() {
        RunSignal none = RunSignal.create();
        assertThat(none.remaining()).isNull();
        assertThat(none.cap(Duration.ofSeconds(10))).isEqualTo(Duration.ofSeconds(10));

        RunSignal soon = RunSignal.withTimeout(Duration.ofMillis(500));
        assertThat(soon.cap(Duration.ofSeconds(10))).isLessThanOrEqualTo(Duration.ofMillis(500));
        assertThat(soon.cap(Duration.ofMillis(100))).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void sleep_returns_false_when_cancelled() throws Exception {
        RunSignal sig = RunSignal.create();
        sig.cancel();
        assertThat(sig.sleep(Duration.ofSeconds(5))).isFalse();
        assertThat(RunSignal.create().sleep(Duration.ofMillis(10))).isTrue();
    }
}
