package io.smellscan.config;

import java.io.IOException;

/**
 * A configuration file is unreadable or structurally invalid.
 */
public class ConfigurationException extends IOException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
