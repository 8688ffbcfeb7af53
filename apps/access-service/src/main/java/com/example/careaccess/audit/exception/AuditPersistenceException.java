package com.example.careaccess.audit.exception;

/**
 * The audit sink refused or failed to persist an entry. Surfaces as a server error; never swallowed.
 */
public class AuditPersistenceException extends RuntimeException {

    public AuditPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
