package com.grantvet.common.exception;

/**
 * Error codes shared by GrantVet services.
 * Format: CATEGORY_NNN
 */
public enum ErrorCode {

    INVALID_ARGUMENT("VAL_001", "Invalid argument"),
    CONFIGURATION_INVALID("VAL_002", "Invalid configuration"),
    NOT_FOUND("RES_001", "Requested resource not found"),
    UPSTREAM_UNAVAILABLE("EXT_001", "A required upstream data source is unavailable"),
    INTERNAL_ERROR("SYS_001", "Internal error");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Client-side errors are caused by the request itself and are not worth retrying.
     */
    public boolean isClientError() {
        return this == INVALID_ARGUMENT || this == NOT_FOUND;
    }
}
