package com.rideeasy.shared.enums;

public enum RideStatus {
    REQUESTED,
    DRIVER_ASSIGNED,
    DRIVER_ENROUTE,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Forward-only lifecycle: any non-terminal state may move to a later state
     * (skips allowed) or to CANCELLED. Terminal states never move.
     */
    public boolean canTransitionTo(RideStatus next) {
        if (isTerminal() || next == null || next == REQUESTED) {
            return false;
        }
        if (next == CANCELLED) {
            return true;
        }
        return next.ordinal() > ordinal();
    }

    /** Whether a driver is expected to be attached to a ride in this state. */
    public boolean requiresDriver() {
        return this == DRIVER_ASSIGNED || this == DRIVER_ENROUTE || this == IN_PROGRESS || this == COMPLETED;
    }
}
