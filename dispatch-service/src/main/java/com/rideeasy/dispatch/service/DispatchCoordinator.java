package com.rideeasy.dispatch.service;

import com.rideeasy.dispatch.carpool.CarpoolGroupTracker;
import com.rideeasy.dispatch.config.DispatchProperties;
import com.rideeasy.dispatch.entity.Driver;
import com.rideeasy.dispatch.entity.Ride;
import com.rideeasy.dispatch.entity.Rider;
import com.rideeasy.dispatch.event.RideEventPublisher;
import com.rideeasy.dispatch.matching.MatchingPolicy;
import com.rideeasy.dispatch.metrics.DispatchMetrics;
import com.rideeasy.dispatch.model.DriverResponse;
import com.rideeasy.dispatch.model.RideResponse;
import com.rideeasy.dispatch.model.SystemStatusResponse;
import com.rideeasy.dispatch.pricing.FareStage;
import com.rideeasy.shared.enums.DriverStatus;
import com.rideeasy.shared.enums.RideMode;
import com.rideeasy.shared.enums.RideStatus;
import com.rideeasy.shared.enums.VehicleClass;
import com.rideeasy.shared.events.RideEvent;
import com.rideeasy.shared.events.RideEventListener;
import com.rideeasy.shared.events.RideEventType;
import com.rideeasy.shared.exception.DispatchException;
import com.rideeasy.shared.model.Location;
import com.rideeasy.shared.util.GeoUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Owns the driver, rider and ride registries and drives every ride through its lifecycle.
 *
 * Request flow:
 *  1. Validate rider and route, create the ride in REQUESTED, emit RideRequested
 *  2. Filter candidates: strictly AVAILABLE drivers for SOLO, carpool-capable drivers for SHARED
 *  3. No candidates: emit NoDriverAvailable and return the unserved ride id
 *  4. Otherwise offer to the policy's best candidate up to {@code maxAttempts} times,
 *     with acceptance probability 0.85, 0.75, 0.65 ... drawn from the injected Random;
 *     a decline drops that driver from the pool
 *  5. Exhausted: emit NoDriverAssigned; the ride stays REQUESTED without a driver
 *
 * Settlement on COMPLETED: distance = planar degrees * 111, fare from the active pipeline,
 * shared rides get the carpool reduction, the fare is rounded to 2 places, and the driver
 * is released.
 *
 * Every public operation holds one lock, so concurrent requests cannot push a driver past
 * its seat capacity and updates to the same ride are strictly ordered. Listeners run
 * synchronously under that lock and may call back into the coordinator, so each assignment
 * attempt re-checks the ride and its candidate pool after events are delivered.
 *
 * Registered drivers and riders are copies of the caller's objects; their status, location
 * and rating change only through this class.
 */
@Slf4j
public class DispatchCoordinator {

    private static final String RIDE_ID_PREFIX = "RIDE_";
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Map<String, Driver> drivers = new LinkedHashMap<>();
    private final Map<String, Rider> riders = new LinkedHashMap<>();
    private final Map<String, Ride> rides = new LinkedHashMap<>();
    private final AtomicLong rideCounter = new AtomicLong();
    private final ReentrantLock lock = new ReentrantLock();

    private final DispatchProperties.Assignment assignment;
    private final BigDecimal carpoolFactor;
    private final CarpoolGroupTracker carpoolTracker;
    private final RideEventPublisher eventPublisher;
    private final DispatchMetrics metrics;
    private final Random random;
    private final Clock clock;

    private MatchingPolicy matchingPolicy;
    private FareStage farePipeline;

    public DispatchCoordinator(DispatchProperties properties,
                               MatchingPolicy matchingPolicy,
                               FareStage farePipeline,
                               CarpoolGroupTracker carpoolTracker,
                               RideEventPublisher eventPublisher,
                               DispatchMetrics metrics,
                               Random random,
                               Clock clock) {
        this.assignment = properties.getAssignment();
        if (assignment.getMaxAttempts() < 1) {
            throw DispatchException.invalidConfig("dispatch.assignment.max-attempts must be >= 1, got "
                    + assignment.getMaxAttempts());
        }
        double carpoolPercent = properties.getPricing().getCarpoolDiscountPercent();
        if (!(carpoolPercent >= 0 && carpoolPercent <= 100)) {
            throw DispatchException.invalidConfig("Carpool discount percent must be in [0, 100], got " + carpoolPercent);
        }
        this.carpoolFactor = BigDecimal.ONE.subtract(BigDecimal.valueOf(carpoolPercent).divide(HUNDRED));
        this.matchingPolicy = requireConfig(matchingPolicy, "matching policy");
        this.farePipeline = requireConfig(farePipeline, "fare pipeline");
        this.carpoolTracker = carpoolTracker;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.random = random;
        this.clock = clock;
    }

    // --- registration ---

    public void registerRider(Rider rider) {
        runLocked(() -> {
            if (rider == null) {
                throw DispatchException.invalidInput("Rider must not be null");
            }
            requireNewId(rider.getId(), riders, "Rider");
            riders.put(rider.getId(), rider.toBuilder().build());
            log.info("Registered rider {} ({})", rider.getId(), rider.getName());
            publish(RideEvent.builder()
                    .type(RideEventType.USER_REGISTERED)
                    .riderId(rider.getId())
                    .message("Rider " + rider.getName() + " registered"));
        });
    }

    public void registerDriver(Driver registration) {
        runLocked(() -> {
            if (registration == null) {
                throw DispatchException.invalidInput("Driver must not be null");
            }
            Driver driver = registration.toBuilder().build();
            requireNewId(driver.getId(), drivers, "Driver");
            if (driver.getVehicle() == null || driver.getVehicle().getVehicleClass() == null) {
                throw DispatchException.invalidInput("Driver " + driver.getId() + " has no vehicle class");
            }
            if (driver.getVehicle().getCapacity() < 1) {
                throw DispatchException.invalidInput("Driver " + driver.getId() + " vehicle capacity must be >= 1");
            }
            if (driver.getCurrentLocation() == null) {
                throw DispatchException.invalidInput("Driver " + driver.getId() + " has no location");
            }
            if (driver.getStatus() == null || driver.getStatus() == DriverStatus.ON_TRIP) {
                driver.setStatus(DriverStatus.AVAILABLE);
            }
            drivers.put(driver.getId(), driver);
            log.info("Registered driver {} ({}, {}, {} seats)", driver.getId(), driver.getName(),
                    driver.getVehicle().getVehicleClass().getDisplayName(), driver.getSeatCapacity());
            publish(RideEvent.builder()
                    .type(RideEventType.USER_REGISTERED)
                    .driverId(driver.getId())
                    .message("Driver " + driver.getName() + " registered with "
                            + driver.getVehicle().getVehicleClass().getDisplayName()));
        });
    }

    // --- ride lifecycle ---

    public String requestRide(String riderId, Location pickup, Location dropoff,
                              RideMode mode, VehicleClass vehicleClass) {
        return withLock(() -> {
            Rider rider = riders.get(riderId);
            if (rider == null) {
                metrics.recordRideRejected();
                throw DispatchException.notFound("Rider " + riderId + " not found");
            }
            if (pickup == null || dropoff == null || mode == null || vehicleClass == null) {
                metrics.recordRideRejected();
                throw DispatchException.invalidInput("Pickup, dropoff, mode and vehicle class are required");
            }
            if (pickup.sameCoordinatesAs(dropoff)) {
                metrics.recordRideRejected();
                throw DispatchException.invalidInput("Pickup and dropoff must differ");
            }

            String rideId = RIDE_ID_PREFIX + rideCounter.incrementAndGet();
            Ride ride = Ride.builder()
                    .id(rideId)
                    .rider(rider)
                    .pickup(pickup)
                    .dropoff(dropoff)
                    .mode(mode)
                    .vehicleClass(vehicleClass)
                    .requestedAt(clock.instant())
                    .build();
            rides.put(rideId, ride);
            metrics.recordRideCreated();

            publish(rideEvent(ride, RideEventType.RIDE_REQUESTED)
                    .message(vehicleClass.getDisplayName() + " " + mode + " ride " + rideId
                            + " requested from " + pickup.getAddress() + " to " + dropoff.getAddress()));

            List<Driver> candidates = findCandidates(mode);
            log.debug("Found {} {} candidates for ride {}", candidates.size(), mode, rideId);

            if (candidates.isEmpty()) {
                metrics.recordNoDriverFound();
                log.warn("No driver available for ride {}", rideId);
                publish(rideEvent(ride, RideEventType.NO_DRIVER_AVAILABLE)
                        .message("No driver available for ride " + rideId));
                return rideId;
            }

            assignWithFallback(ride, candidates);
            return rideId;
        });
    }

    public RideResponse updateRideStatus(String rideId, RideStatus newStatus) {
        return withLock(() -> {
            Ride ride = getRideOrThrow(rideId);
            if (newStatus == null) {
                throw DispatchException.invalidInput("Status is required");
            }
            if (newStatus == RideStatus.DRIVER_ASSIGNED) {
                throw DispatchException.invalidInput("Drivers are assigned by dispatch, not by status update");
            }
            if (!ride.getStatus().canTransitionTo(newStatus)) {
                throw DispatchException.invalidInput(
                        "Cannot move ride " + rideId + " from " + ride.getStatus() + " to " + newStatus);
            }
            if (newStatus.requiresDriver() && !ride.hasDriver()) {
                throw DispatchException.invalidInput(
                        "Ride " + rideId + " has no assigned driver; cannot move to " + newStatus);
            }

            if (newStatus == RideStatus.COMPLETED) {
                settle(ride);
            } else {
                ride.transitionTo(newStatus, clock.instant());
                if (newStatus == RideStatus.CANCELLED) {
                    releaseDriver(ride);
                    metrics.recordRideCancelled();
                }
            }

            log.info("Ride {} -> {}", rideId, newStatus);
            publish(rideEvent(ride, RideEventType.RIDE_STATUS_UPDATE)
                    .status(newStatus)
                    .message(statusMessage(newStatus)));
            return toResponse(ride);
        });
    }

    // --- driver-side updates ---

    public void updateDriverLocation(String driverId, Location location) {
        runLocked(() -> {
            Driver driver = getDriverOrThrow(driverId);
            if (location == null) {
                throw DispatchException.invalidInput("Location is required");
            }
            driver.setCurrentLocation(location);
            log.debug("Driver {} moved to ({}, {})", driverId, location.getLatitude(), location.getLongitude());
        });
    }

    /**
     * OFFLINE to AVAILABLE and back. A driver with an active ride cannot go offline.
     */
    public DriverResponse setDriverOnline(String driverId, boolean online) {
        return withLock(() -> {
            Driver driver = getDriverOrThrow(driverId);
            if (online) {
                if (driver.getStatus() == DriverStatus.OFFLINE) {
                    driver.setStatus(DriverStatus.AVAILABLE);
                }
            } else {
                if (driver.getStatus() == DriverStatus.ON_TRIP || carpoolTracker.occupancy(driver) > 0) {
                    throw DispatchException.invalidInput("Driver " + driverId + " has an active ride");
                }
                driver.setStatus(DriverStatus.OFFLINE);
            }
            log.info("Driver {} is now {}", driverId, driver.getStatus());
            return toResponse(driver);
        });
    }

    public void updateDriverRating(String driverId, double rating) {
        runLocked(() -> {
            Driver driver = getDriverOrThrow(driverId);
            driver.setRating(requireRating(rating));
        });
    }

    public void updateRiderRating(String riderId, double rating) {
        runLocked(() -> {
            Rider rider = riders.get(riderId);
            if (rider == null) {
                throw DispatchException.notFound("Rider " + riderId + " not found");
            }
            rider.setRating(requireRating(rating));
        });
    }

    // --- reads ---

    public Optional<RideResponse> getRide(String rideId) {
        return withLock(() -> Optional.ofNullable(rides.get(rideId)).map(this::toResponse));
    }

    public List<RideResponse> getRidesForRider(String riderId) {
        return withLock(() -> rides.values().stream()
                .filter(r -> r.getRider().getId().equals(riderId))
                .map(this::toResponse)
                .collect(Collectors.toList()));
    }

    public Optional<DriverResponse> getDriver(String driverId) {
        return withLock(() -> Optional.ofNullable(drivers.get(driverId)).map(this::toResponse));
    }

    public List<DriverResponse> getAvailableDrivers() {
        return withLock(() -> drivers.values().stream()
                .filter(d -> d.getStatus() == DriverStatus.AVAILABLE)
                .map(this::toResponse)
                .collect(Collectors.toList()));
    }

    public SystemStatusResponse getSystemStatus() {
        return withLock(() -> SystemStatusResponse.builder()
                .totalDrivers(drivers.size())
                .availableDrivers(countDrivers(DriverStatus.AVAILABLE))
                .onTripDrivers(countDrivers(DriverStatus.ON_TRIP))
                .offlineDrivers(countDrivers(DriverStatus.OFFLINE))
                .totalRiders(riders.size())
                .totalRides(rides.size())
                .activeRides((int) rides.values().stream().filter(r -> !r.getStatus().isTerminal()).count())
                .activeCarpoolGroups(carpoolTracker.activeGroupCount())
                .matchingPolicy(matchingPolicy.toString())
                .farePipeline(farePipeline.toString())
                .build());
    }

    // --- hot swaps ---

    public void setMatchingPolicy(MatchingPolicy policy) {
        runLocked(() -> {
            this.matchingPolicy = requireConfig(policy, "matching policy");
            log.info("Matching policy switched to {}", policy);
        });
    }

    public void setFarePipeline(FareStage pipeline) {
        runLocked(() -> {
            this.farePipeline = requireConfig(pipeline, "fare pipeline");
            log.info("Fare pipeline switched to {}", pipeline);
        });
    }

    public void subscribe(RideEventListener listener) {
        eventPublisher.subscribe(listener);
    }

    public boolean unsubscribe(RideEventListener listener) {
        return eventPublisher.unsubscribe(listener);
    }

    // --- assignment ---

    private List<Driver> findCandidates(RideMode mode) {
        return drivers.values().stream()
                .filter(d -> canServe(d, mode))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private boolean canServe(Driver driver, RideMode mode) {
        return mode == RideMode.SHARED
                ? carpoolTracker.canAccept(driver)
                : driver.getStatus() == DriverStatus.AVAILABLE;
    }

    private void assignWithFallback(Ride ride, List<Driver> candidates) {
        List<Driver> pool = new ArrayList<>(candidates);
        int maxAttempts = assignment.getMaxAttempts();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            // a listener on the previous decline may have cancelled the ride or taken a pooled driver
            if (ride.getStatus() != RideStatus.REQUESTED || ride.hasDriver()) {
                log.info("Ride {} left REQUESTED during dispatch ({}); stopping", ride.getId(), ride.getStatus());
                return;
            }
            pool.removeIf(d -> !canServe(d, ride.getMode()));

            Optional<Driver> best = matchingPolicy.selectDriver(
                    Collections.unmodifiableList(pool), ride.getPickup(), ride.getVehicleClass());
            if (best.isEmpty()) {
                log.debug("No {} candidate left for ride {} on attempt {}",
                        ride.getVehicleClass(), ride.getId(), attempt);
                break;
            }

            Driver driver = best.get();
            double probability = acceptanceProbability(attempt);
            if (random.nextDouble() < probability) {
                assignDriver(ride, driver);
                log.info("Ride {} assigned to driver {} (attempt {}/{})", ride.getId(), driver.getId(), attempt, maxAttempts);
                return;
            }

            pool.remove(driver);
            metrics.recordOfferDeclined();
            log.info("Driver {} declined ride {} (attempt {}/{})", driver.getId(), ride.getId(), attempt, maxAttempts);
            publish(rideEvent(ride, RideEventType.DRIVER_REJECTED)
                    .driverId(driver.getId())
                    .message("Driver " + driver.getName() + " declined ride " + ride.getId()));
        }

        metrics.recordNoDriverFound();
        log.warn("No driver assigned to ride {}", ride.getId());
        publish(rideEvent(ride, RideEventType.NO_DRIVER_ASSIGNED)
                .message("No driver could be assigned to ride " + ride.getId()));
    }

    /** 0.85, 0.75, 0.65 ... for attempts 1, 2, 3 with the default settings; never negative. */
    double acceptanceProbability(int attempt) {
        double p = assignment.getInitialAcceptanceProbability() - assignment.getAcceptanceDecay() * (attempt - 1);
        return Math.max(0.0, p);
    }

    private void assignDriver(Ride ride, Driver driver) {
        if (ride.isShared()) {
            carpoolTracker.join(driver, ride.getId());
        } else {
            driver.setStatus(DriverStatus.ON_TRIP);
        }
        ride.assignDriver(driver);
        metrics.recordOfferAccepted();
        publish(rideEvent(ride, RideEventType.DRIVER_ASSIGNED)
                .message("Driver " + driver.getName() + " assigned to ride " + ride.getId()));
    }

    // --- settlement ---

    private void settle(Ride ride) {
        double distance = GeoUtil.tripDistance(ride.getPickup(), ride.getDropoff());
        BigDecimal fare = farePipeline.computeFare(distance, ride.getVehicleClass());
        if (ride.isShared()) {
            fare = fare.multiply(carpoolFactor);
        }
        fare = fare.setScale(2, RoundingMode.HALF_UP);

        ride.transitionTo(RideStatus.COMPLETED, clock.instant());
        ride.settle(distance, fare);
        releaseDriver(ride);
        metrics.recordRideCompleted(fare);

        log.info("Ride {} settled: dist={} fare={} mode={}", ride.getId(), distance, fare, ride.getMode());
        publish(rideEvent(ride, RideEventType.PAYMENT_COMPLETED)
                .fareAmount(fare)
                .message("Payment of Rs." + fare.toPlainString() + " completed for ride " + ride.getId()));
    }

    private void releaseDriver(Ride ride) {
        Driver driver = ride.getDriver();
        if (driver == null) {
            return;
        }
        if (ride.isShared()) {
            carpoolTracker.leave(driver, ride.getId());
        } else {
            driver.setStatus(DriverStatus.AVAILABLE);
        }
    }

    // --- helpers ---

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    private Ride getRideOrThrow(String rideId) {
        Ride ride = rides.get(rideId);
        if (ride == null) {
            throw DispatchException.notFound("Ride " + rideId + " not found");
        }
        return ride;
    }

    private Driver getDriverOrThrow(String driverId) {
        Driver driver = drivers.get(driverId);
        if (driver == null) {
            throw DispatchException.notFound("Driver " + driverId + " not found");
        }
        return driver;
    }

    private static void requireNewId(String id, Map<String, ?> registry, String kind) {
        if (id == null || id.isBlank()) {
            throw DispatchException.invalidInput(kind + " id must not be blank");
        }
        if (registry.containsKey(id)) {
            throw DispatchException.invalidInput(kind + " " + id + " is already registered");
        }
    }

    private static double requireRating(double rating) {
        if (!(rating >= 0.0 && rating <= 5.0)) {
            throw DispatchException.invalidInput("Rating must be in [0, 5], got " + rating);
        }
        return rating;
    }

    private static <T> T requireConfig(T value, String what) {
        if (value == null) {
            throw DispatchException.invalidConfig("A " + what + " is required");
        }
        return value;
    }

    private int countDrivers(DriverStatus status) {
        return (int) drivers.values().stream().filter(d -> d.getStatus() == status).count();
    }

    private RideEvent.RideEventBuilder rideEvent(Ride ride, RideEventType type) {
        return RideEvent.builder()
                .type(type)
                .rideId(ride.getId())
                .riderId(ride.getRider().getId())
                .driverId(ride.hasDriver() ? ride.getDriver().getId() : null);
    }

    private void publish(RideEvent.RideEventBuilder builder) {
        eventPublisher.publish(builder.occurredAt(clock.instant()).build());
    }

    private static String statusMessage(RideStatus status) {
        switch (status) {
            case DRIVER_ENROUTE:
                return "Driver is on the way to pickup location";
            case IN_PROGRESS:
                return "Ride has started";
            case COMPLETED:
                return "Ride completed successfully";
            case CANCELLED:
                return "Ride has been cancelled";
            default:
                return "Ride status updated to " + status;
        }
    }

    private RideResponse toResponse(Ride r) {
        return RideResponse.builder()
                .rideId(r.getId())
                .riderId(r.getRider().getId())
                .driverId(r.hasDriver() ? r.getDriver().getId() : null)
                .driverName(r.hasDriver() ? r.getDriver().getName() : null)
                .status(r.getStatus())
                .mode(r.getMode())
                .vehicleClass(r.getVehicleClass())
                .pickup(r.getPickup())
                .dropoff(r.getDropoff())
                .distance(r.getDistance())
                .fare(r.getFare())
                .requestedAt(r.getRequestedAt())
                .startedAt(r.getStartedAt())
                .endedAt(r.getEndedAt())
                .build();
    }

    private DriverResponse toResponse(Driver d) {
        return DriverResponse.builder()
                .driverId(d.getId())
                .name(d.getName())
                .phone(d.getPhone())
                .vehicleId(d.getVehicle().getVehicleId())
                .model(d.getVehicle().getModel())
                .licensePlate(d.getVehicle().getLicensePlate())
                .vehicleClass(d.getVehicle().getVehicleClass())
                .capacity(d.getSeatCapacity())
                .location(d.getCurrentLocation())
                .status(d.getStatus())
                .rating(d.getRating())
                .carpoolOccupancy(carpoolTracker.occupancy(d))
                .build();
    }
}
