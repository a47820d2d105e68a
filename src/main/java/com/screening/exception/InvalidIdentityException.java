package com.screening.exception;

/**
 * Raised when an identity carries neither a usable name nor a tax identifier.
 * Screening never starts for such an identity.
 */
public class InvalidIdentityException extends RuntimeException {

    public InvalidIdentityException(String message) {
        super(message);
    }
}
