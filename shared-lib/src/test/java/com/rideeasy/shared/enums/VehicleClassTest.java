package com.rideeasy.shared.enums;

import com.rideeasy.shared.exception.DispatchErrorCode;
import com.rideeasy.shared.exception.DispatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VehicleClassTest {

    @Test
    @DisplayName("Catalog carries the fixed base fares and per-distance rates")
    void catalogConstants() {
        assertThat(VehicleClass.TWO_WHEELER.getBaseFare()).isEqualByComparingTo("15");
        assertThat(VehicleClass.TWO_WHEELER.getPerDistanceRate()).isEqualByComparingTo("6");
        assertThat(VehicleClass.SEDAN.getBaseFare()).isEqualByComparingTo("40");
        assertThat(VehicleClass.SEDAN.getPerDistanceRate()).isEqualByComparingTo(BigDecimal.TEN);
        assertThat(VehicleClass.SUV.getBaseFare()).isEqualByComparingTo("60");
        assertThat(VehicleClass.SUV.getPerDistanceRate()).isEqualByComparingTo("12");
        assertThat(VehicleClass.AUTO_RICKSHAW.getBaseFare()).isEqualByComparingTo("25");
        assertThat(VehicleClass.AUTO_RICKSHAW.getPerDistanceRate()).isEqualByComparingTo("8");
    }

    @Test
    @DisplayName("Display name and constant name both resolve, case-insensitively")
    void resolvesByDisplayOrConstantName() {
        assertThat(VehicleClass.fromDisplayName("Auto-Rickshaw")).isEqualTo(VehicleClass.AUTO_RICKSHAW);
        assertThat(VehicleClass.fromDisplayName("bike")).isEqualTo(VehicleClass.TWO_WHEELER);
        assertThat(VehicleClass.fromDisplayName("suv")).isEqualTo(VehicleClass.SUV);
        assertThat(VehicleClass.fromDisplayName("two_wheeler")).isEqualTo(VehicleClass.TWO_WHEELER);
    }

    @Test
    @DisplayName("Unknown vehicle class name is rejected as INVALID_INPUT")
    void unknownNameRejected() {
        assertThatThrownBy(() -> VehicleClass.fromDisplayName("Helicopter"))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getCode())
                .isEqualTo(DispatchErrorCode.INVALID_INPUT);
    }
}
