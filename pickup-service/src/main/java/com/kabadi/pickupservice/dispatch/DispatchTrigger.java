package com.kabadi.pickupservice.dispatch;

// Why a background dispatch task was started; only used for logging
public enum DispatchTrigger {
    CREATED,
    CUSTOMER_RETRY,
    OFFER_TIMEOUT,
    SWEEP
}
