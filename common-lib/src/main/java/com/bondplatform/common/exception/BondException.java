package com.bondplatform.common.exception;

/**
 * Raised by every domain component when an operation is rejected. The operation
 * has left no state behind when this is thrown.
 */
public class BondException extends RuntimeException {
    private final String component;
    private final ErrorCode code;

    public BondException(String component, ErrorCode code, String message) {
        super("[" + component + "] " + code.name() + ": " + message);
        this.component = component;
        this.code = code;
    }

    public BondException(String component, ErrorCode code, String message, Throwable cause) {
        super("[" + component + "] " + code.name() + ": " + message, cause);
        this.component = component;
        this.code = code;
    }

    public String getComponent() {
        return component;
    }

    public ErrorCode getCode() {
        return code;
    }
}
