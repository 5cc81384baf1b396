package com.rideeasy.dispatch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Micrometer metrics for the dispatch engine, exposed at /actuator/prometheus:
 *
 *   dispatch_ride_requests_total{status="created|rejected"}
 *   dispatch_offer_response_total{outcome="accepted|declined"}
 *   dispatch_no_driver_found_total
 *   dispatch_rides_completed_total
 *   dispatch_rides_cancelled_total
 *   dispatch_fare                                          settled fare amounts
 */
@Component
public class DispatchMetrics {

    private final Counter rideCreatedCounter;
    private final Counter rideRejectedCounter;
    private final Counter offerAcceptedCounter;
    private final Counter offerDeclinedCounter;
    private final Counter noDriverFoundCounter;
    private final Counter rideCompletedCounter;
    private final Counter rideCancelledCounter;
    private final DistributionSummary fareSummary;

    public DispatchMetrics(MeterRegistry registry) {
        this.rideCreatedCounter = Counter.builder("dispatch.ride.requests")
                .tag("status", "created")
                .description("Ride requests admitted")
                .register(registry);

        this.rideRejectedCounter = Counter.builder("dispatch.ride.requests")
                .tag("status", "rejected")
                .description("Ride requests rejected (unknown rider, invalid input)")
                .register(registry);

        this.offerAcceptedCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "accepted")
                .description("Driver offers accepted")
                .register(registry);

        this.offerDeclinedCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "declined")
                .description("Driver offers declined")
                .register(registry);

        this.noDriverFoundCounter = Counter.builder("dispatch.no_driver_found")
                .description("Requests admitted without a driver (none available or all declined)")
                .register(registry);

        this.rideCompletedCounter = Counter.builder("dispatch.rides.completed")
                .description("Rides settled")
                .register(registry);

        this.rideCancelledCounter = Counter.builder("dispatch.rides.cancelled")
                .description("Rides cancelled")
                .register(registry);

        this.fareSummary = DistributionSummary.builder("dispatch.fare")
                .description("Settled fare per ride")
                .register(registry);
    }

    public void recordRideCreated()      { rideCreatedCounter.increment(); }
    public void recordRideRejected()     { rideRejectedCounter.increment(); }
    public void recordOfferAccepted()    { offerAcceptedCounter.increment(); }
    public void recordOfferDeclined()    { offerDeclinedCounter.increment(); }
    public void recordNoDriverFound()    { noDriverFoundCounter.increment(); }
    public void recordRideCancelled()    { rideCancelledCounter.increment(); }

    public void recordRideCompleted(BigDecimal fare) {
        rideCompletedCounter.increment();
        fareSummary.record(fare.doubleValue());
    }
}
