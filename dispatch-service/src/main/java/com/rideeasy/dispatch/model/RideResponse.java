package com.rideeasy.dispatch.model;

import com.rideeasy.shared.enums.RideMode;
import com.rideeasy.shared.enums.RideStatus;
import com.rideeasy.shared.enums.VehicleClass;
import com.rideeasy.shared.model.Location;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read-only snapshot of a ride. {@code driverId} is null for an admitted but unserved
 * request; {@code fare} is null until the ride is completed.
 */
@Data
@Builder
public class RideResponse {
    private String rideId;
    private String riderId;
    private String driverId;
    private String driverName;
    private RideStatus status;
    private RideMode mode;
    private VehicleClass vehicleClass;
    private Location pickup;
    private Location dropoff;
    private double distance;
    private BigDecimal fare;
    private Instant requestedAt;
    private Instant startedAt;
    private Instant endedAt;
}
