package com.rideeasy.dispatch.event;

import com.rideeasy.shared.events.RideEvent;
import com.rideeasy.shared.events.RideEventListener;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process fan-out of dispatch events.
 *
 * Delivery is synchronous and follows subscription order. A listener that throws is
 * logged and skipped; the remaining listeners still receive the event and the
 * exception never reaches the publishing call.
 */
@Slf4j
public class RideEventPublisher {

    private final List<RideEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(RideEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean unsubscribe(RideEventListener listener) {
        return listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void publish(RideEvent event) {
        log.debug("Publishing {} ride={} : {}", event.getEventName(), event.getRideId(), event.getMessage());
        for (RideEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {} for ride {}: {}",
                        listener.getClass().getSimpleName(), event.getEventName(), event.getRideId(),
                        e.getMessage(), e);
            }
        }
    }
}
