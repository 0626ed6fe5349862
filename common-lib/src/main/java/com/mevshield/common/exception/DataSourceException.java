package com.mevshield.common.exception;

/** Snapshot fetch failed. Recoverable through the snapshot cache. */
public class DataSourceException extends MevShieldException {

    public DataSourceException(String component, String message) {
        super(component, message);
    }

    public DataSourceException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
