package com.kabadi.common.exception;

/**
 * Exception thrown when a referenced resource does not exist
 * HTTP Status: 404 Not Found (set in GlobalExceptionHandler)
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
