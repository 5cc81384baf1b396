package com.rideeasy.dispatch.notification;

import com.rideeasy.shared.events.RideEvent;
import com.rideeasy.shared.events.RideEventListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes dispatch events to rider and driver push notifications.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RideNotificationListener implements RideEventListener {

    private final NotificationDispatcher dispatcher;

    @Override
    public void onEvent(RideEvent event) {
        switch (event.getType()) {
            case USER_REGISTERED -> {
                // registration events name either a rider or a driver
                dispatcher.notifyRider(event, "Welcome to RideEasy", event.getMessage());
                dispatcher.notifyDriver(event, "Welcome to RideEasy", event.getMessage());
            }
            case RIDE_REQUESTED -> dispatcher.notifyRider(event,
                    "Ride requested", "Looking for a driver for ride " + event.getRideId());
            case DRIVER_ASSIGNED -> {
                dispatcher.notifyRider(event, "Driver assigned", event.getMessage());
                dispatcher.notifyDriver(event, "New ride", "You have been assigned ride " + event.getRideId());
            }
            case NO_DRIVER_ASSIGNED, NO_DRIVER_AVAILABLE -> dispatcher.notifyRider(event,
                    "No drivers available", "Sorry, no drivers found. Please try again.");
            case RIDE_STATUS_UPDATE -> {
                dispatcher.notifyRider(event, "Ride update", event.getMessage());
                dispatcher.notifyDriver(event, "Ride update", event.getMessage());
            }
            case PAYMENT_COMPLETED -> dispatcher.notifyRider(event,
                    "Trip completed", "Your trip is complete. Total fare: Rs." + event.getFareAmount());
            default -> log.debug("No notification for {}", event.getEventName());
        }
    }
}
