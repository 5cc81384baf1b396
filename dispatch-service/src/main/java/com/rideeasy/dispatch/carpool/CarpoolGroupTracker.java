package com.rideeasy.dispatch.carpool;

import com.rideeasy.dispatch.entity.Driver;
import com.rideeasy.shared.enums.DriverStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Occupancy of shared rides per driver.
 *
 * Invariant: a driver's group never holds more ride ids than the vehicle has seats.
 * Groups are created on the first join and dropped when the last member leaves, at
 * which point the driver is AVAILABLE again.
 *
 * Not thread-safe; callers serialize access (the coordinator holds its lock).
 */
@Slf4j
public class CarpoolGroupTracker {

    private final Map<String, List<String>> groups = new LinkedHashMap<>();

    /**
     * AVAILABLE drivers with a free seat, or ON_TRIP drivers already running a
     * carpool group with a free seat. An ON_TRIP driver without a group is on a
     * solo ride and never accepts pool riders.
     */
    public boolean canAccept(Driver driver) {
        int occupancy = occupancy(driver);
        if (driver.getStatus() == DriverStatus.AVAILABLE) {
            return occupancy < driver.getSeatCapacity();
        }
        if (driver.getStatus() == DriverStatus.ON_TRIP) {
            return occupancy > 0 && occupancy < driver.getSeatCapacity();
        }
        return false;
    }

    public void join(Driver driver, String rideId) {
        List<String> group = groups.computeIfAbsent(driver.getId(), id -> new ArrayList<>());
        if (group.size() >= driver.getSeatCapacity()) {
            throw new IllegalStateException("Driver " + driver.getId() + " carpool is full ("
                    + group.size() + "/" + driver.getSeatCapacity() + ")");
        }
        group.add(rideId);
        if (driver.getStatus() == DriverStatus.AVAILABLE) {
            driver.setStatus(DriverStatus.ON_TRIP);
        }
        log.debug("Ride {} joined carpool of driver {} ({}/{})",
                rideId, driver.getId(), group.size(), driver.getSeatCapacity());
    }

    public void leave(Driver driver, String rideId) {
        List<String> group = groups.get(driver.getId());
        if (group == null || !group.remove(rideId)) {
            log.debug("Ride {} was not in a carpool of driver {}", rideId, driver.getId());
            return;
        }
        if (group.isEmpty()) {
            groups.remove(driver.getId());
            driver.setStatus(DriverStatus.AVAILABLE);
            log.debug("Carpool of driver {} emptied; driver available", driver.getId());
        }
    }

    public int occupancy(Driver driver) {
        List<String> group = groups.get(driver.getId());
        return group != null ? group.size() : 0;
    }

    /** Ride ids in join order; empty when the driver has no group. */
    public List<String> members(Driver driver) {
        List<String> group = groups.get(driver.getId());
        return group != null ? Collections.unmodifiableList(new ArrayList<>(group)) : List.of();
    }

    public int activeGroupCount() {
        return groups.size();
    }
}
