package com.grantvet.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GrantVetException Tests")
class GrantVetExceptionTest {

    @Test
    @DisplayName("Should prefix message with error code and expose user message")
    void shouldPrefixMessageWithCode() {
        InvalidArgumentException ex = new InvalidArgumentException("threshold must be within [0, 1]");

        assertThat(ex.getMessage()).isEqualTo("[VAL_001] threshold must be within [0, 1]");
        assertThat(ex.getUserMessage()).isEqualTo("threshold must be within [0, 1]");
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_ARGUMENT);
        assertThat(ex.getErrorId()).isNotBlank();
        assertThat(ex.getTimestamp()).isNotNull();
    }

    @Test
    @DisplayName("Should fall back to default message when none given")
    void shouldUseDefaultMessage() {
        GrantVetException ex = new GrantVetException(ErrorCode.UPSTREAM_UNAVAILABLE, null);

        assertThat(ex.getUserMessage()).isEqualTo(ErrorCode.UPSTREAM_UNAVAILABLE.getDefaultMessage());
    }

    @Test
    @DisplayName("Should collect metadata fluently and ignore nulls")
    void shouldCollectMetadata() {
        GrantVetException ex = new NotFoundException("Organization", "123456789")
                .withMetadata("ein", "123456789")
                .withMetadata("ignored", null);

        assertThat(ex.getMessage()).contains("Organization not found: 123456789");
        assertThat(ex.getMetadata()).containsOnlyKeys("ein");
        assertThatThrownBy(() -> ex.getMetadata().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should keep upstream service name and cause")
    void shouldKeepServiceName() {
        IllegalStateException cause = new IllegalStateException("connection refused");
        UpstreamUnavailableException ex =
                new UpstreamUnavailableException("revocation-list", "Revocation list unavailable", cause);

        assertThat(ex.getServiceName()).isEqualTo("revocation-list");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getErrorCode().isClientError()).isFalse();
        assertThat(ErrorCode.NOT_FOUND.isClientError()).isTrue();
    }
}
