package com.metascan.explorer.exception;

public class ParameterRequiredException extends RuntimeException {

    private final String parameter;

    public ParameterRequiredException(String parameter) {
        super("Required parameter: " + parameter);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
