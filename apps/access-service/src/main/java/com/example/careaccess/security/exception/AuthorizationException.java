package com.example.careaccess.security.exception;

import lombok.Getter;

/**
 * The caller is authenticated but not allowed to invoke the operation.
 */
@Getter
public class AuthorizationException extends RuntimeException {

    private final String userId;

    public AuthorizationException(String userId, String message) {
        super(message);
        this.userId = userId;
    }
}
