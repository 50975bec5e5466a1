package com.grantvet.common.exception;

/**
 * Exception thrown when a requested resource cannot be found.
 */
public class NotFoundException extends GrantVetException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public NotFoundException(String resourceType, String resourceId) {
        super(ErrorCode.NOT_FOUND, String.format("%s not found: %s", resourceType, resourceId));
    }
}
