package com.mevshield.common.exception;

/** Invalid policy values at startup. Fatal: the application context must not come up. */
public class ConfigurationException extends MevShieldException {

    public ConfigurationException(String component, String message) {
        super(component, message);
    }
}
