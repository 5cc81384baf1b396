package com.rideeasy.shared.exception;

public enum DispatchErrorCode {
    /** Unknown rider, driver or ride id. */
    NOT_FOUND,
    /** Malformed request: null registration, identical pickup/dropoff, negative distance, illegal transition. */
    INVALID_INPUT,
    /** Out-of-bounds pricing parameters, rejected when the stage is built. */
    INVALID_CONFIG
}
