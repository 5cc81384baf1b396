package com.rideeasy.shared.events;

/**
 * Receives dispatch events synchronously, in emission order. Implementations
 * should return quickly; a thrown exception is logged by the publisher and
 * does not reach the emitting operation.
 */
@FunctionalInterface
public interface RideEventListener {

    void onEvent(RideEvent event);
}
