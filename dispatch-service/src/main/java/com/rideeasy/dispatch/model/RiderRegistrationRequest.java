package com.rideeasy.dispatch.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RiderRegistrationRequest {

    @NotBlank
    private String riderId;

    @NotBlank
    private String name;

    private String phone;

    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double defaultLat;

    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double defaultLng;

    private String defaultAddress = "";
}
