package com.mevshield.common.exception;

/**
 * Root of the engine's unchecked error taxonomy. Carries the name of the
 * component that raised it so log lines read {@code [SnapshotService] ...}.
 */
public class MevShieldException extends RuntimeException {
    private final String component;

    public MevShieldException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public MevShieldException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
