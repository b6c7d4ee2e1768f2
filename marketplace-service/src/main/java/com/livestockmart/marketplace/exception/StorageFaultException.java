package com.livestockmart.marketplace.exception;

/**
 * Exception thrown when the database rejects or cannot complete a write after
 * listings were already reserved. The reservation has been released by the time
 * this reaches the caller, so the request can simply be retried.
 * HTTP Status: 503 Service Unavailable
 */
public class StorageFaultException extends RuntimeException {

    public StorageFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
