package com.rideeasy.shared.enums;

public enum DriverStatus {
    AVAILABLE,
    ON_TRIP,
    OFFLINE
}
