package com.linkchex.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClassificationTest {

    @Test
    void status_boundaries() {
        assertThat(Classification.of(200, null)).isEqualTo(Classification.SUCCESS);
        assertThat(Classification.of(299, null)).isEqualTo(Classification.SUCCESS);
        assertThat(Classification.of(300, null)).isEqualTo(Classification.WARNING);
        assertThat(Classification.of(399, null)).isEqualTo(Classification.WARNING);
        assertThat(Classification.of(400, null)).isEqualTo(Classification.BROKEN);
        assertThat(Classification.of(404, null)).isEqualTo(Classification.BROKEN);
        assertThat(Classification.of(503, null)).isEqualTo(Classification.BROKEN);
    }

    @Test
    void transport_errors_are_broken_and_cancel_is_cancelled() {
        assertThat(Classification.of(0, ProbeFailure.of(FailureKind.DNS, "no such host")))
                .isEqualTo(Classification.BROKEN);
        assertThat(Classification.of(0, ProbeFailure.of(FailureKind.REDIRECT_LIMIT, "stopped after 10 redirects")))
                .isEqualTo(Classification.BROKEN);
        assertThat(Classification.of(0, ProbeFailure.cancelled())).isEqualTo(Classification.CANCELLED);
    }

    @Test
    void only_transport_failures_are_retryable() {
        assertThat(FailureKind.TIMEOUT.retryable()).isTrue();
        assertThat(FailureKind.CONNECT.retryable()).isTrue();
        assertThat(FailureKind.REDIRECT_LIMIT.retryable()).isFalse();
        assertThat(FailureKind.INVALID_URL.retryable()).isFalse();
        assertThat(FailureKind.CANCELLED.retryable()).isFalse();
    }

    @Test
    void failure_messages_compose() {
        ProbeFailure f = ProbeFailure.of(FailureKind.TIMEOUT, "request timed out");
        assertThat(f.wrapAttempts(2).getMessage()).isEqualTo("failed after 2 attempts: request timed out");
        assertThat(f.withPrefix("failed to fetch page").getMessage())
                .isEqualTo("failed to fetch page: request timed out");
        assertThat(f.withPrefix("x").getKind()).isEqualTo(FailureKind.TIMEOUT);
    }

    @Test
    void reference_kind_from_tag() {
        assertThat(ReferenceKind.fromTag("A")).isEqualTo(ReferenceKind.ANCHOR);
        assertThat(ReferenceKind.fromTag("stylesheet")).isEqualTo(ReferenceKind.STYLESHEET);
        assertThat(ReferenceKind.SCRIPT.tag()).isEqualTo("script");
    }
}
