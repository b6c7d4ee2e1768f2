package com.livestockmart.marketplace.exception;

/**
 * Exception thrown when an order state transition is not allowed
 * For example: the buyer cancelling an order that has already shipped
 * HTTP Status: 422 Unprocessable Entity
 */
public class InvalidOrderStateException extends RuntimeException {

    public InvalidOrderStateException(String message) {
        super(message);
    }
}
