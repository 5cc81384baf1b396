package com.rideeasy.dispatch.entity;

import com.rideeasy.shared.enums.VehicleClass;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Vehicle {

    String vehicleId;
    String model;
    String licensePlate;
    VehicleClass vehicleClass;

    /** Seats available to riders; bounds carpool occupancy. */
    int capacity;
}
