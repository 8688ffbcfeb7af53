package com.example.careaccess.common.exception;

import lombok.Getter;

/**
 * A collaborator (consent store, care-assignment directory) could not be reached or answered
 * with an error. Access decisions translate this into a denial.
 */
@Getter
public class BackendUnavailableException extends RuntimeException {

    private final String serviceName;

    public BackendUnavailableException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public BackendUnavailableException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }
}
