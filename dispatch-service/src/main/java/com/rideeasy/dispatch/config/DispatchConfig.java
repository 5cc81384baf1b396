package com.rideeasy.dispatch.config;

import com.rideeasy.dispatch.carpool.CarpoolGroupTracker;
import com.rideeasy.dispatch.event.RideEventPublisher;
import com.rideeasy.dispatch.metrics.DispatchMetrics;
import com.rideeasy.dispatch.pricing.FarePipeline;
import com.rideeasy.dispatch.service.DispatchCoordinator;
import com.rideeasy.shared.events.RideEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Random;

/**
 * Wires one {@link DispatchCoordinator} per application context. Tests build their own
 * coordinators directly instead of going through a global instance.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(DispatchProperties.class)
public class DispatchConfig {

    @Bean
    public Clock dispatchClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random acceptanceRandom(DispatchProperties properties) {
        Long seed = properties.getAssignment().getRandomSeed();
        return seed != null ? new Random(seed) : new Random();
    }

    @Bean
    public RideEventPublisher rideEventPublisher(List<RideEventListener> listeners) {
        RideEventPublisher publisher = new RideEventPublisher();
        listeners.forEach(publisher::subscribe);
        log.info("Ride event publisher started with {} listener(s)", listeners.size());
        return publisher;
    }

    @Bean
    public CarpoolGroupTracker carpoolGroupTracker() {
        return new CarpoolGroupTracker();
    }

    @Bean
    public FarePipeline farePipeline(DispatchProperties properties) {
        return buildPipeline(properties.getPricing());
    }

    @Bean
    public DispatchCoordinator dispatchCoordinator(DispatchProperties properties,
                                                   FarePipeline farePipeline,
                                                   CarpoolGroupTracker carpoolGroupTracker,
                                                   RideEventPublisher rideEventPublisher,
                                                   DispatchMetrics dispatchMetrics,
                                                   Random acceptanceRandom,
                                                   Clock dispatchClock) {
        return new DispatchCoordinator(
                properties,
                properties.getMatching().getPolicy().create(),
                farePipeline,
                carpoolGroupTracker,
                rideEventPublisher,
                dispatchMetrics,
                acceptanceRandom,
                dispatchClock);
    }

    /**
     * Stages at neutral values are left out; the rest nest as toll(discount(surge(base))).
     * Out-of-range values fail here with INVALID_CONFIG and abort startup.
     */
    static FarePipeline buildPipeline(DispatchProperties.Pricing pricing) {
        FarePipeline.Builder builder = FarePipeline.builder();
        if (pricing.getSurgeMultiplier() != 1.0) {
            builder.surge(pricing.getSurgeMultiplier());
        }
        if (pricing.getDiscountPercent() != 0.0) {
            builder.discount(pricing.getDiscountPercent());
        }
        if (pricing.getTollSurcharge() != 0.0) {
            builder.toll(pricing.getTollSurcharge());
        }
        FarePipeline pipeline = builder.build();
        log.info("Fare pipeline configured: {}", pipeline);
        return pipeline;
    }
}
