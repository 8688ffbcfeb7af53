package com.example.careaccess.common.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a request is malformed or misses required fields. Never retried.
 */
@Getter
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super("Request validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String error) {
        this(List.of(error));
    }
}
