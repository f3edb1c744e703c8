package com.metascan.explorer.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metascan.explorer.exception.InvalidFilterValueException;
import com.metascan.explorer.exception.ParameterRequiredException;
import com.metascan.explorer.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to {@code {"errors": [{status, title, detail}]}}.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class ExplorerExceptionHandler {

    private final ObjectMapper objectMapper;

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ObjectNode> handleNotFound(ResourceNotFoundException ex) {
        ObjectNode body = errorBody(HttpStatus.NOT_FOUND, ex.getMessage());
        body.putNull("data");
        return respond(HttpStatus.NOT_FOUND, body);
    }

    @ExceptionHandler(InvalidFilterValueException.class)
    public ResponseEntity<ObjectNode> handleInvalidFilter(InvalidFilterValueException ex) {
        return respond(HttpStatus.BAD_REQUEST,
                errorBody(HttpStatus.BAD_REQUEST, "filter[" + ex.getFilter() + "]: " + ex.getMessage()));
    }

    @ExceptionHandler(ParameterRequiredException.class)
    public ResponseEntity<ObjectNode> handleParameterRequired(ParameterRequiredException ex) {
        log.debug("Rejected request without {}", ex.getParameter());
        ObjectNode body = errorBody(HttpStatus.BAD_REQUEST, ex.getMessage());
        body.putArray("data");
        return respond(HttpStatus.BAD_REQUEST, body);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ObjectNode> handleStoreError(DataAccessException ex) {
        log.error("Store query failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "Store query failed"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ObjectNode> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"));
    }

    private ObjectNode errorBody(HttpStatus status, String detail) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode error = body.putArray("errors").addObject();
        error.put("status", String.valueOf(status.value()));
        error.put("title", status.getReasonPhrase());
        error.put("detail", detail);
        return body;
    }

    private static ResponseEntity<ObjectNode> respond(HttpStatus status, ObjectNode body) {
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }
}
