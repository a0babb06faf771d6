package com.kabadi.pickupservice.exception;

/**
 * Exception thrown when the requested action is not allowed from the pickup's
 * current status, e.g. cancelling a COMPLETED pickup.
 * HTTP Status: 422 Unprocessable Entity
 */
public class InvalidPickupStateException extends RuntimeException {

    public InvalidPickupStateException(String message) {
        super(message);
    }
}
