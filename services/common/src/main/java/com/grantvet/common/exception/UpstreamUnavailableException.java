package com.grantvet.common.exception;

import lombok.Getter;

/**
 * Exception thrown when a collaborator the caller depends on (revocation
 * list, sanctions list, profile store, court records) cannot be reached.
 */
@Getter
public class UpstreamUnavailableException extends GrantVetException {

    private final String serviceName;

    public UpstreamUnavailableException(String serviceName, String message) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message);
        this.serviceName = serviceName;
    }

    public UpstreamUnavailableException(String serviceName, String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message, cause);
        this.serviceName = serviceName;
    }
}
