package com.rideeasy.dispatch.matching;

import com.rideeasy.dispatch.entity.Driver;
import com.rideeasy.shared.enums.VehicleClass;
import com.rideeasy.shared.model.Location;

import java.util.List;
import java.util.Optional;

/**
 * Picks one driver out of an already filtered candidate set.
 *
 * Implementations must not mutate the list or the drivers, and must only return a
 * driver whose vehicle class equals {@code requestedClass}. Ties resolve to the
 * lowest driver id so results never depend on registry iteration order.
 */
public interface MatchingPolicy {

    Optional<Driver> selectDriver(List<Driver> candidates, Location pickup, VehicleClass requestedClass);

    default boolean matchesClass(Driver driver, VehicleClass requestedClass) {
        return driver.getVehicle() != null && driver.getVehicle().getVehicleClass() == requestedClass;
    }
}
