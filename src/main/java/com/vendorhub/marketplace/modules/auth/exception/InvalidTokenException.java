package com.vendorhub.marketplace.modules.auth.exception;

/**
 * Thrown when a bearer token is malformed, badly signed, expired or lacks the
 * expected claims.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
