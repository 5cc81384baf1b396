package com.rideeasy.dispatch.pricing;

import com.rideeasy.shared.enums.VehicleClass;

import java.math.BigDecimal;

/**
 * One unit of fare computation. Wrapping stages call their inner stage first and
 * adjust its result; see {@link FareStages} and {@link FarePipeline}.
 */
@FunctionalInterface
public interface FareStage {

    BigDecimal computeFare(double distance, VehicleClass vehicleClass);
}
