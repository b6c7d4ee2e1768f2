package com.livestockmart.marketplace.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
@Embeddable
public class Address {

    @NotBlank(message = "Recipient name is required")
    @Column(name = "ship_name")
    private String name;

    @NotBlank(message = "Phone is required")
    @Column(name = "ship_phone")
    private String phone;

    @NotBlank(message = "Address line 1 is required")
    @Column(name = "ship_line1")
    private String line1;

    @Column(name = "ship_line2")
    private String line2;

    @NotBlank(message = "City is required")
    @Column(name = "ship_city")
    private String city;

    @NotBlank(message = "State is required")
    @Column(name = "ship_state")
    private String state;

    @NotBlank(message = "Pincode is required")
    @Pattern(regexp = "\\d{4,10}", message = "Pincode must be numeric")
    @Column(name = "ship_pincode")
    private String pincode;
}
