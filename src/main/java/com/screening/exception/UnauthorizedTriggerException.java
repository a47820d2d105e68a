package com.screening.exception;

/**
 * The internal rescreen trigger was called without a valid shared secret.
 */
public class UnauthorizedTriggerException extends RuntimeException {

    public UnauthorizedTriggerException(String message) {
        super(message);
    }
}
