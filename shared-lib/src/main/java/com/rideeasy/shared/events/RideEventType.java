package com.rideeasy.shared.events;

/**
 * Domain event kinds emitted by the dispatch coordinator. {@link #getEventName()}
 * is the stable name listeners and downstream notification layers key on.
 */
public enum RideEventType {
    USER_REGISTERED("UserRegistered"),
    RIDE_REQUESTED("RideRequested"),
    DRIVER_ASSIGNED("DriverAssigned"),
    DRIVER_REJECTED("DriverRejected"),
    NO_DRIVER_ASSIGNED("NoDriverAssigned"),
    NO_DRIVER_AVAILABLE("NoDriverAvailable"),
    RIDE_STATUS_UPDATE("RideStatusUpdate"),
    PAYMENT_COMPLETED("PaymentCompleted");

    private final String eventName;

    RideEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
