package com.kabadi.pickupservice.exception;

/**
 * Exception thrown when a conditional pickup transition matched no row:
 * the offer expired, another vendor holds it, or the pickup was decided elsewhere.
 * Nothing was written. Callers should re-read the pickup instead of retrying.
 * HTTP Status: 409 Conflict
 */
public class AssignmentConflictException extends RuntimeException {

    public AssignmentConflictException(String message) {
        super(message);
    }
}
