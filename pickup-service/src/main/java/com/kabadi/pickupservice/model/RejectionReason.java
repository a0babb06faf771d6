package com.kabadi.pickupservice.model;

public enum RejectionReason {
    EXPLICIT_REJECT, // Vendor called /reject
    TIMEOUT,         // Offer window elapsed without an answer
    SEND_FAILURE     // Offer could not be delivered (transport error or non-2xx)
}
