package com.rideeasy.dispatch.matching;

import com.rideeasy.dispatch.entity.Driver;
import com.rideeasy.shared.enums.VehicleClass;
import com.rideeasy.shared.model.Location;
import com.rideeasy.shared.util.GeoUtil;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Minimum straight-line distance from the driver's current location to pickup.
 */
public class NearestDriverPolicy implements MatchingPolicy {

    @Override
    public Optional<Driver> selectDriver(List<Driver> candidates, Location pickup, VehicleClass requestedClass) {
        Comparator<Driver> byDistance = Comparator
                .comparingDouble((Driver d) -> GeoUtil.planarDistance(d.getCurrentLocation(), pickup))
                .thenComparing(Driver::getId);

        return candidates.stream()
                .filter(d -> matchesClass(d, requestedClass))
                .filter(d -> d.getCurrentLocation() != null)
                .min(byDistance);
    }

    @Override
    public String toString() {
        return "nearest";
    }
}
