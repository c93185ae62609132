package com.sandboxgate.shared.config;

/** Invalid or unreadable configuration. Only raised at startup. */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
