package com.livestockmart.marketplace.exception;

/**
 * Exception thrown when an uploaded payment proof is empty, too large or not an image/PDF
 * HTTP Status: 400 Bad Request
 */
public class InvalidPaymentProofException extends RuntimeException {

    public InvalidPaymentProofException(String message) {
        super(message);
    }
}
