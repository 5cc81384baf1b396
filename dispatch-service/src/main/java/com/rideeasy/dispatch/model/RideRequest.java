package com.rideeasy.dispatch.model;

import com.rideeasy.shared.enums.RideMode;
import com.rideeasy.shared.enums.VehicleClass;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RideRequest {

    @NotBlank
    private String riderId;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double pickupLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double pickupLng;

    private String pickupAddress = "";

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double dropoffLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double dropoffLng;

    private String dropoffAddress = "";

    @NotNull
    private VehicleClass vehicleClass;

    @NotNull
    private RideMode mode = RideMode.SOLO;
}
