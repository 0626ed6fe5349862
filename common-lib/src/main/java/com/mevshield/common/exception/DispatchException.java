package com.mevshield.common.exception;

/** Alert delivery failed. Logged and counted; never retried within the same cycle. */
public class DispatchException extends MevShieldException {

    public DispatchException(String component, String message) {
        super(component, message);
    }

    public DispatchException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
