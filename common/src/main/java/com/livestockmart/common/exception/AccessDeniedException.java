package com.livestockmart.common.exception;

/**
 * Thrown when an authenticated caller addresses an order, payment proof or
 * inbox entry that belongs to another user.
 * Mapped to 403 Forbidden.
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
