package com.rideeasy.dispatch.matching;

import com.rideeasy.dispatch.entity.Driver;
import com.rideeasy.shared.enums.VehicleClass;
import com.rideeasy.shared.model.Location;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Maximum driver rating; pickup location is ignored.
 */
public class HighestRatedDriverPolicy implements MatchingPolicy {

    @Override
    public Optional<Driver> selectDriver(List<Driver> candidates, Location pickup, VehicleClass requestedClass) {
        Comparator<Driver> byRatingDesc = Comparator
                .comparingDouble(Driver::getRating).reversed()
                .thenComparing(Driver::getId);

        return candidates.stream()
                .filter(d -> matchesClass(d, requestedClass))
                .min(byRatingDesc);
    }

    @Override
    public String toString() {
        return "highest-rated";
    }
}
