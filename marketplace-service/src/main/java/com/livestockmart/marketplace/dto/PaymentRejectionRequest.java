package com.livestockmart.marketplace.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class PaymentRejectionRequest {
    // blank falls back to the default rejection reason
    @Size(max = 300, message = "Reason must be at most 300 characters")
    private String reason;
}
