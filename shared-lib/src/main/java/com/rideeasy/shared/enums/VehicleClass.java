package com.rideeasy.shared.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.rideeasy.shared.exception.DispatchErrorCode;
import com.rideeasy.shared.exception.DispatchException;

import java.math.BigDecimal;

/**
 * Vehicle class catalog. Fare constants are fixed at build time.
 *
 *   class           display         base   per distance-unit
 *   TWO_WHEELER     Bike            15     6
 *   SEDAN           Sedan           40     10
 *   SUV             SUV             60     12
 *   AUTO_RICKSHAW   Auto-Rickshaw   25     8
 */
public enum VehicleClass {

    TWO_WHEELER("Bike", "15", "6"),
    SEDAN("Sedan", "40", "10"),
    SUV("SUV", "60", "12"),
    AUTO_RICKSHAW("Auto-Rickshaw", "25", "8");

    private final String displayName;
    private final BigDecimal baseFare;
    private final BigDecimal perDistanceRate;

    VehicleClass(String displayName, String baseFare, String perDistanceRate) {
        this.displayName = displayName;
        this.baseFare = new BigDecimal(baseFare);
        this.perDistanceRate = new BigDecimal(perDistanceRate);
    }

    public String getDisplayName() {
        return displayName;
    }

    public BigDecimal getBaseFare() {
        return baseFare;
    }

    public BigDecimal getPerDistanceRate() {
        return perDistanceRate;
    }

    /**
     * Resolves either the enum constant name ("SEDAN") or the display name ("Sedan"),
     * case-insensitively. Also used when binding JSON request bodies.
     */
    @JsonCreator
    public static VehicleClass fromDisplayName(String name) {
        if (name != null) {
            for (VehicleClass vc : values()) {
                if (vc.displayName.equalsIgnoreCase(name) || vc.name().equalsIgnoreCase(name)) {
                    return vc;
                }
            }
        }
        throw new DispatchException(DispatchErrorCode.INVALID_INPUT, "Unknown vehicle class: " + name);
    }
}
