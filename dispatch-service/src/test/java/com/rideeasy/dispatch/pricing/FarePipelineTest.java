package com.rideeasy.dispatch.pricing;

import com.rideeasy.shared.enums.VehicleClass;
import com.rideeasy.shared.exception.DispatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FarePipelineTest {

    @Test
    @DisplayName("Standard pipeline is the base stage alone")
    void standardIsBase() {
        FarePipeline pipeline = FarePipeline.standard();
        assertThat(pipeline.getStages()).containsExactly("base");
        assertThat(pipeline.computeFare(5.0, VehicleClass.SUV)).isEqualByComparingTo("120");
    }

    @Test
    @DisplayName("Stages wrap inner-to-outer in builder order")
    void stagesApplyInOrder() {
        // toll(discount(surge(base))): ((40 + 100) * 2 * 0.9) + 25 = 277
        FarePipeline pipeline = FarePipeline.builder().surge(2.0).discount(10).toll(25).build();

        assertThat(pipeline.computeFare(10.0, VehicleClass.SEDAN)).isEqualByComparingTo("277");
        assertThat(pipeline.getStages()).hasSize(4).startsWith("base");
    }

    @Test
    @DisplayName("Reordering stages changes the fare")
    void orderMatters() {
        FarePipeline tollThenSurge = FarePipeline.builder().toll(20).surge(2.0).build();
        FarePipeline surgeThenToll = FarePipeline.builder().surge(2.0).toll(20).build();

        assertThat(tollThenSurge.computeFare(10.0, VehicleClass.SEDAN)).isEqualByComparingTo("320");
        assertThat(surgeThenToll.computeFare(10.0, VehicleClass.SEDAN)).isEqualByComparingTo("300");
    }

    @Test
    @DisplayName("Custom stages plug in through then()")
    void customStage() {
        FarePipeline pipeline = FarePipeline.builder()
                .then(inner -> (d, vc) -> inner.computeFare(d, vc).add(BigDecimal.ONE), "rounding-fee")
                .build();

        assertThat(pipeline.computeFare(0.0, VehicleClass.TWO_WHEELER)).isEqualByComparingTo("16");
        assertThat(pipeline).hasToString("base -> rounding-fee");
    }

    @Test
    @DisplayName("Invalid stage parameters fail while building, not while pricing")
    void invalidParametersFailAtBuild() {
        assertThatThrownBy(() -> FarePipeline.builder().surge(6.0))
                .isInstanceOf(DispatchException.class);
    }
}
