package com.metascan.explorer.modules.chain;

/**
 * The chain node did not answer, or answered with an error.
 */
public class UpstreamUnavailableException extends Exception {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
