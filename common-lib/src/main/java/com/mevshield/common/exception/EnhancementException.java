package com.mevshield.common.exception;

/** Score enhancement failed. Recoverable by passing the unmodified candidate through. */
public class EnhancementException extends MevShieldException {

    public EnhancementException(String component, String message) {
        super(component, message);
    }

    public EnhancementException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
