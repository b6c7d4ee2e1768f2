package com.livestockmart.common.exception;

/**
 * Exception thrown when an order, listing, proof or notification does not exist
 * HTTP Status: 404 Not Found
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
