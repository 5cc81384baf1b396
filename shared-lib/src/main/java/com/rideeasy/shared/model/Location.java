package com.rideeasy.shared.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Immutable point on the flat-plane map plus a free-text label.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class Location {

    double latitude;
    double longitude;
    String address;

    public static Location of(double latitude, double longitude) {
        return new Location(latitude, longitude, "");
    }

    /** Same coordinates, labels ignored. */
    public boolean sameCoordinatesAs(Location other) {
        return other != null
                && Double.compare(latitude, other.latitude) == 0
                && Double.compare(longitude, other.longitude) == 0;
    }
}
