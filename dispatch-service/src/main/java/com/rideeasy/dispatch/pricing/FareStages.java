package com.rideeasy.dispatch.pricing;

import com.rideeasy.shared.exception.DispatchException;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Factory functions for the built-in fare stages.
 *
 * Parameters are validated here, when the stage is built, never when a fare is computed:
 *   surge     0 < multiplier <= 5
 *   discount  0 <= pct <= 100, result floored at half the class base fare
 *   toll      surcharge >= 0
 */
public final class FareStages {

    public static final double MAX_SURGE_MULTIPLIER = 5.0;

    private static final BigDecimal HALF = new BigDecimal("0.5");

    private FareStages() {}

    /** {@code max(baseFare + distance * perDistanceRate, baseFare)}. */
    public static FareStage base() {
        return (distance, vehicleClass) -> {
            if (distance < 0 || Double.isNaN(distance)) {
                throw DispatchException.invalidInput("Distance must be non-negative, got " + distance);
            }
            BigDecimal baseFare = vehicleClass.getBaseFare();
            BigDecimal fare = baseFare.add(BigDecimal.valueOf(distance).multiply(vehicleClass.getPerDistanceRate()));
            return fare.max(baseFare);
        };
    }

    public static FareStage surge(FareStage inner, double multiplier) {
        Objects.requireNonNull(inner, "inner stage");
        if (!(multiplier > 0 && multiplier <= MAX_SURGE_MULTIPLIER)) {
            throw DispatchException.invalidConfig(
                    "Surge multiplier must be in (0, " + MAX_SURGE_MULTIPLIER + "], got " + multiplier);
        }
        BigDecimal factor = BigDecimal.valueOf(multiplier);
        return (distance, vehicleClass) -> inner.computeFare(distance, vehicleClass).multiply(factor);
    }

    public static FareStage discount(FareStage inner, double percent) {
        Objects.requireNonNull(inner, "inner stage");
        if (!(percent >= 0 && percent <= 100)) {
            throw DispatchException.invalidConfig("Discount percent must be in [0, 100], got " + percent);
        }
        BigDecimal factor = BigDecimal.ONE.subtract(BigDecimal.valueOf(percent).movePointLeft(2));
        return (distance, vehicleClass) -> {
            BigDecimal discounted = inner.computeFare(distance, vehicleClass).multiply(factor);
            BigDecimal floor = vehicleClass.getBaseFare().multiply(HALF);
            return discounted.max(floor);
        };
    }

    public static FareStage toll(FareStage inner, double surcharge) {
        Objects.requireNonNull(inner, "inner stage");
        if (!(surcharge >= 0)) {
            throw DispatchException.invalidConfig("Toll surcharge must be non-negative, got " + surcharge);
        }
        BigDecimal amount = BigDecimal.valueOf(surcharge);
        return (distance, vehicleClass) -> inner.computeFare(distance, vehicleClass).add(amount);
    }
}
