package com.rideeasy.dispatch.entity;

import com.rideeasy.shared.enums.DriverStatus;
import com.rideeasy.shared.model.Location;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Driver profile and live state. The coordinator registers a copy, so changes to the
 * instance passed in at registration never reach the registry; location and status of
 * a registered driver change only through
 * {@link com.rideeasy.dispatch.service.DispatchCoordinator}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Driver {

    private String id;
    private String name;
    private String phone;
    private Vehicle vehicle;
    private Location currentLocation;

    @Builder.Default
    private DriverStatus status = DriverStatus.AVAILABLE;

    @Builder.Default
    private double rating = 5.0;

    public int getSeatCapacity() {
        return vehicle != null ? vehicle.getCapacity() : 0;
    }
}
