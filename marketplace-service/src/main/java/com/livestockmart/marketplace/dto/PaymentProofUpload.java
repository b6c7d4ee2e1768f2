package com.livestockmart.marketplace.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Raw proof upload as received at the boundary, before validation.
 */
@Data
@Builder
public class PaymentProofUpload {
    private String contentType;
    private byte[] content;
}
