package com.livestockmart.marketplace.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class PaymentProofContent {
    private String contentType;
    private byte[] content;
    private Instant uploadedAt;
}
