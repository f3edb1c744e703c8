package com.metascan.explorer.exception;

/**
 * A detail lookup whose key is malformed or matches nothing.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, String id) {
        super("No " + resource + " with id " + id);
    }
}
