package com.rideeasy.dispatch.entity;

import com.rideeasy.shared.enums.RideMode;
import com.rideeasy.shared.enums.RideStatus;
import com.rideeasy.shared.enums.VehicleClass;
import com.rideeasy.shared.model.Location;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One trip from request to completion or cancellation.
 *
 * Post-construction mutations are limited to driver assignment, status transitions
 * and a single settlement that fixes {@code distance} and {@code fare}.
 */
@Getter
@EqualsAndHashCode(of = "id")
@ToString(of = {"id", "status", "mode", "vehicleClass"})
public class Ride {

    private final String id;
    private final Rider rider;
    private final Location pickup;
    private final Location dropoff;
    private final VehicleClass vehicleClass;
    private final RideMode mode;
    private final Instant requestedAt;

    private Driver driver;
    private RideStatus status = RideStatus.REQUESTED;
    private double distance;
    private BigDecimal fare;
    private Instant startedAt;
    private Instant endedAt;

    @Builder
    public Ride(String id, Rider rider, Location pickup, Location dropoff,
                VehicleClass vehicleClass, RideMode mode, Instant requestedAt) {
        this.id = id;
        this.rider = rider;
        this.pickup = pickup;
        this.dropoff = dropoff;
        this.vehicleClass = vehicleClass;
        this.mode = mode;
        this.requestedAt = requestedAt;
    }

    public void assignDriver(Driver assigned) {
        if (status != RideStatus.REQUESTED || driver != null) {
            throw new IllegalStateException("Ride " + id + " cannot take a driver in state " + status);
        }
        this.driver = assigned;
        this.status = RideStatus.DRIVER_ASSIGNED;
    }

    public void transitionTo(RideStatus next, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Ride " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        if (next == RideStatus.IN_PROGRESS) {
            this.startedAt = at;
        } else if (next == RideStatus.COMPLETED) {
            this.endedAt = at;
        }
    }

    public void settle(double settledDistance, BigDecimal settledFare) {
        if (status != RideStatus.COMPLETED) {
            throw new IllegalStateException("Ride " + id + " must be COMPLETED before settlement, is " + status);
        }
        if (isSettled()) {
            throw new IllegalStateException("Ride " + id + " is already settled");
        }
        this.distance = settledDistance;
        this.fare = settledFare;
    }

    public boolean isSettled() {
        return fare != null;
    }

    public boolean isShared() {
        return mode == RideMode.SHARED;
    }

    public boolean hasDriver() {
        return driver != null;
    }
}
