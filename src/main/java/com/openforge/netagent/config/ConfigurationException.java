package com.openforge.netagent.config;

/**
 * Missing or invalid settings. Fatal when raised during assembly.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
