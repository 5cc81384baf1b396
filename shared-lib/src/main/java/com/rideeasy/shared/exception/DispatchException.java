package com.rideeasy.shared.exception;

public class DispatchException extends RuntimeException {

    private final DispatchErrorCode code;

    public DispatchException(DispatchErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public DispatchErrorCode getCode() {
        return code;
    }

    public static DispatchException notFound(String message) {
        return new DispatchException(DispatchErrorCode.NOT_FOUND, message);
    }

    public static DispatchException invalidInput(String message) {
        return new DispatchException(DispatchErrorCode.INVALID_INPUT, message);
    }

    public static DispatchException invalidConfig(String message) {
        return new DispatchException(DispatchErrorCode.INVALID_CONFIG, message);
    }
}
