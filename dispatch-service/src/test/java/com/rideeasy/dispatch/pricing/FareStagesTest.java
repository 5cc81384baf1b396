package com.rideeasy.dispatch.pricing;

import com.rideeasy.shared.enums.VehicleClass;
import com.rideeasy.shared.exception.DispatchErrorCode;
import com.rideeasy.shared.exception.DispatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FareStagesTest {

    private final FareStage base = FareStages.base();

    @Test
    @DisplayName("Base stage: sedan 10 units = 40 + 10*10 = 140")
    void baseFare() {
        assertThat(base.computeFare(10.0, VehicleClass.SEDAN)).isEqualByComparingTo("140");
    }

    @ParameterizedTest
    @EnumSource(VehicleClass.class)
    @DisplayName("Base stage never drops below the class base fare")
    void baseNeverBelowBaseFare(VehicleClass vehicleClass) {
        assertThat(base.computeFare(0.0, vehicleClass)).isEqualByComparingTo(vehicleClass.getBaseFare());
        assertThat(base.computeFare(3.7, vehicleClass)).isGreaterThanOrEqualTo(vehicleClass.getBaseFare());
    }

    @Test
    @DisplayName("Negative distance is INVALID_INPUT")
    void negativeDistanceRejected() {
        assertThatThrownBy(() -> base.computeFare(-1.0, VehicleClass.SEDAN))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getCode())
                .isEqualTo(DispatchErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("Surge 2.0 over base, sedan, distance 10 -> (40 + 100) * 2 = 280")
    void surgeDoublesBase() {
        FareStage surged = FareStages.surge(base, 2.0);
        assertThat(surged.computeFare(10.0, VehicleClass.SEDAN)).isEqualByComparingTo("280");
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -1.0, 5.01, 10.0})
    @DisplayName("Surge multiplier outside (0, 5] is INVALID_CONFIG at construction")
    void surgeOutOfRange(double multiplier) {
        assertThatThrownBy(() -> FareStages.surge(base, multiplier))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getCode())
                .isEqualTo(DispatchErrorCode.INVALID_CONFIG);
    }

    @Test
    @DisplayName("Surge at the 5.0 cap is accepted")
    void surgeAtCap() {
        assertThat(FareStages.surge(base, 5.0).computeFare(0.0, VehicleClass.TWO_WHEELER))
                .isEqualByComparingTo("75");
    }

    @Test
    @DisplayName("Discount 10% on sedan 10 units -> 126")
    void discountApplied() {
        FareStage discounted = FareStages.discount(base, 10);
        assertThat(discounted.computeFare(10.0, VehicleClass.SEDAN)).isEqualByComparingTo("126");
    }

    @ParameterizedTest
    @EnumSource(VehicleClass.class)
    @DisplayName("Discount output is floored at half the class base fare")
    void discountFloor(VehicleClass vehicleClass) {
        FareStage full = FareStages.discount(base, 100);
        BigDecimal half = vehicleClass.getBaseFare().multiply(new BigDecimal("0.5"));
        assertThat(full.computeFare(25.0, vehicleClass)).isEqualByComparingTo(half);
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 100.5, 250})
    @DisplayName("Discount percent outside [0, 100] is INVALID_CONFIG")
    void discountOutOfRange(double pct) {
        assertThatThrownBy(() -> FareStages.discount(base, pct))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getCode())
                .isEqualTo(DispatchErrorCode.INVALID_CONFIG);
    }

    @Test
    @DisplayName("Toll adds a flat surcharge; negative surcharge is INVALID_CONFIG")
    void toll() {
        assertThat(FareStages.toll(base, 25).computeFare(10.0, VehicleClass.SEDAN)).isEqualByComparingTo("165");
        assertThatThrownBy(() -> FareStages.toll(base, -5))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getCode())
                .isEqualTo(DispatchErrorCode.INVALID_CONFIG);
    }
}
