package com.rideeasy.dispatch.model;

import com.rideeasy.shared.enums.DriverStatus;
import com.rideeasy.shared.enums.VehicleClass;
import com.rideeasy.shared.model.Location;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DriverResponse {
    private String driverId;
    private String name;
    private String phone;
    private String vehicleId;
    private String model;
    private String licensePlate;
    private VehicleClass vehicleClass;
    private int capacity;
    private Location location;
    private DriverStatus status;
    private double rating;
    private int carpoolOccupancy;
}
