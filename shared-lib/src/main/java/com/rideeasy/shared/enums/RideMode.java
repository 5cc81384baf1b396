package com.rideeasy.shared.enums;

/** SOLO rides hold the driver exclusively; SHARED rides pool riders up to seat capacity. */
public enum RideMode {
    SOLO,
    SHARED
}
