package com.metascan.explorer.modules.identity;

/**
 * A bearer token that failed verification. Never leaves {@link IdentityGate}.
 */
class InvalidTokenException extends Exception {

    InvalidTokenException(String message) {
        super(message);
    }

    InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
