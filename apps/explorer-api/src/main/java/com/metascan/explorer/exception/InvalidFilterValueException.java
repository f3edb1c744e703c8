package com.metascan.explorer.exception;

/**
 * A filter value that cannot be turned into a query predicate.
 */
public class InvalidFilterValueException extends RuntimeException {

    private final String filter;

    public InvalidFilterValueException(String filter, String message) {
        super(message);
        this.filter = filter;
    }

    public String getFilter() {
        return filter;
    }
}
