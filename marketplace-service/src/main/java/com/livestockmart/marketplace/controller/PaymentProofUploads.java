package com.livestockmart.marketplace.controller;

import com.livestockmart.marketplace.dto.PaymentProofContent;
import com.livestockmart.marketplace.dto.PaymentProofUpload;
import com.livestockmart.marketplace.exception.InvalidPaymentProofException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Conversions between multipart files and proof payloads, shared by the
 * buyer and staff controllers.
 */
final class PaymentProofUploads {

    private PaymentProofUploads() {
    }

    static PaymentProofUpload fromMultipart(MultipartFile file) {
        try {
            return PaymentProofUpload.builder()
                    .contentType(file.getContentType())
                    .content(file.getBytes())
                    .build();
        } catch (IOException e) {
            throw new InvalidPaymentProofException("Could not read uploaded payment proof: " + e.getMessage());
        }
    }

    static ResponseEntity<byte[]> toResponse(PaymentProofContent proof) {
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(proof.getContentType()))
                .contentLength(proof.getContent().length)
                .body(proof.getContent());
    }
}
