package com.rideeasy.dispatch.matching;

import java.util.function.Supplier;

/** Configurable names for the built-in policies. */
public enum MatchingPolicyType {
    NEAREST(NearestDriverPolicy::new),
    HIGHEST_RATED(HighestRatedDriverPolicy::new);

    private final Supplier<MatchingPolicy> factory;

    MatchingPolicyType(Supplier<MatchingPolicy> factory) {
        this.factory = factory;
    }

    public MatchingPolicy create() {
        return factory.get();
    }
}
