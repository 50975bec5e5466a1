package com.grantvet.common.exception;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base exception for all GrantVet business failures.
 *
 * Carries a typed {@link ErrorCode}, a unique error id for log correlation,
 * the time the failure was raised and free-form metadata that callers can
 * enrich while the exception travels up the stack.
 *
 * Usage:
 * <pre>
 * throw new UpstreamUnavailableException("revocation-list", "Revocation list not loaded")
 *     .withMetadata("ein", ein);
 * </pre>
 */
@Getter
public class GrantVetException extends RuntimeException {

    private final String errorId;
    private final ErrorCode errorCode;
    private final Instant timestamp;
    private final Map<String, Object> metadata;

    public GrantVetException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public GrantVetException(ErrorCode errorCode, String message, Throwable cause) {
        super(buildMessage(errorCode, message), cause);
        this.errorCode = errorCode != null ? errorCode : ErrorCode.INTERNAL_ERROR;
        this.errorId = UUID.randomUUID().toString();
        this.timestamp = Instant.now();
        this.metadata = new HashMap<>();
    }

    /**
     * Add a metadata entry (fluent). Null keys or values are ignored.
     */
    public GrantVetException withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * Message without the error-code prefix, suitable for end users.
     */
    public String getUserMessage() {
        String message = getMessage();
        String prefix = "[" + errorCode.getCode() + "] ";
        return message != null && message.startsWith(prefix) ? message.substring(prefix.length()) : message;
    }

    private static String buildMessage(ErrorCode errorCode, String message) {
        ErrorCode code = errorCode != null ? errorCode : ErrorCode.INTERNAL_ERROR;
        String text = message != null && !message.isBlank() ? message : code.getDefaultMessage();
        return "[" + code.getCode() + "] " + text;
    }
}
