package com.rideeasy.dispatch.model;

import com.rideeasy.shared.enums.VehicleClass;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DriverRegistrationRequest {

    @NotBlank
    private String driverId;

    @NotBlank
    private String name;

    private String phone;

    @NotBlank
    private String vehicleId;

    private String model;

    @NotBlank
    private String licensePlate;

    @NotNull
    private VehicleClass vehicleClass;

    @Min(1)
    private int capacity = 1;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double latitude;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double longitude;

    private String address = "";
}
