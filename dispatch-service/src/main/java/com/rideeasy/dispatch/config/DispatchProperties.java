package com.rideeasy.dispatch.config;

import com.rideeasy.dispatch.matching.MatchingPolicyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables under the {@code dispatch.*} prefix. Defaults: nearest-driver matching,
 * three assignment attempts at 0.85 / 0.75 / 0.65 acceptance probability,
 * base-fare-only pricing and a 20% carpool reduction.
 */
@Data
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private Matching matching = new Matching();
    private Assignment assignment = new Assignment();
    private Pricing pricing = new Pricing();

    @Data
    public static class Matching {
        private MatchingPolicyType policy = MatchingPolicyType.NEAREST;
    }

    @Data
    public static class Assignment {
        private int maxAttempts = 3;
        private double initialAcceptanceProbability = 0.85;
        private double acceptanceDecay = 0.10;

        /** Seed for the acceptance simulation; unseeded when null. */
        private Long randomSeed;
    }

    @Data
    public static class Pricing {
        /** 1.0 leaves the surge stage out. */
        private double surgeMultiplier = 1.0;
        /** 0 leaves the discount stage out. */
        private double discountPercent = 0.0;
        /** 0 leaves the toll stage out. */
        private double tollSurcharge = 0.0;
        private double carpoolDiscountPercent = 20.0;
    }
}
