package com.rideeasy.dispatch.pricing;

import com.rideeasy.shared.enums.VehicleClass;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Ordered composition of fare stages, applied inner-to-outer starting at the base stage.
 *
 * <pre>
 *   FarePipeline.builder().surge(2.0).discount(10).build()   // discount(surge(base))
 *   FarePipeline.builder().discount(10).surge(2.0).build()   // surge(discount(base))
 * </pre>
 *
 * The two orders are both legal and generally give different fares.
 */
@Slf4j
public final class FarePipeline implements FareStage {

    private final FareStage composed;
    private final List<String> stages;

    private FarePipeline(FareStage composed, List<String> stages) {
        this.composed = composed;
        this.stages = Collections.unmodifiableList(stages);
    }

    /** Base stage only. */
    public static FarePipeline standard() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public BigDecimal computeFare(double distance, VehicleClass vehicleClass) {
        BigDecimal fare = composed.computeFare(distance, vehicleClass);
        log.debug("Fare calc: dist={} class={} stages={} -> {}", distance, vehicleClass, stages, fare);
        return fare;
    }

    /** Stage descriptions, innermost first. */
    public List<String> getStages() {
        return stages;
    }

    @Override
    public String toString() {
        return String.join(" -> ", stages);
    }

    public static final class Builder {

        private FareStage current = FareStages.base();
        private final List<String> stages = new ArrayList<>(List.of("base"));

        private Builder() {}

        public Builder surge(double multiplier) {
            return wrap(inner -> FareStages.surge(inner, multiplier), "surge x" + multiplier);
        }

        public Builder discount(double percent) {
            return wrap(inner -> FareStages.discount(inner, percent), "discount " + percent + "%");
        }

        public Builder toll(double surcharge) {
            return wrap(inner -> FareStages.toll(inner, surcharge), "toll +" + surcharge);
        }

        /** Wraps the pipeline built so far in a custom stage. */
        public Builder then(UnaryOperator<FareStage> wrapper, String description) {
            return wrap(wrapper, description);
        }

        public FarePipeline build() {
            return new FarePipeline(current, new ArrayList<>(stages));
        }

        private Builder wrap(UnaryOperator<FareStage> wrapper, String description) {
            current = wrapper.apply(current);
            stages.add(description);
            return this;
        }
    }
}
