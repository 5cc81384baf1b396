package com.rideeasy.dispatch.notification;

import com.rideeasy.shared.events.RideEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Push sink addressed by the parties of a ride event. Each push is logged against the
 * ride it concerns; an event that does not name the party sends nothing.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    public void notifyRider(RideEvent event, String title, String body) {
        push("rider", event.getRiderId(), event, title, body);
    }

    public void notifyDriver(RideEvent event, String title, String body) {
        push("driver", event.getDriverId(), event, title, body);
    }

    private void push(String role, String recipientId, RideEvent event, String title, String body) {
        if (recipientId == null) {
            log.debug("{} has no {}; push '{}' skipped", event.getEventName(), role, title);
            return;
        }
        log.info("[PUSH] {}={} ride={} title='{}' body='{}'", role, recipientId, event.getRideId(), title, body);
    }
}
