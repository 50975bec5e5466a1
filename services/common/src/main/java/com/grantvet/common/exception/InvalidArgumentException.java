package com.grantvet.common.exception;

/**
 * Thrown when a pure function receives input it cannot work with: a malformed
 * identifier, a threshold outside its range, an inconsistent configuration.
 * Always raised before any I/O takes place.
 */
public class InvalidArgumentException extends GrantVetException {

    public InvalidArgumentException(String message) {
        super(ErrorCode.INVALID_ARGUMENT, message);
    }

    public InvalidArgumentException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
