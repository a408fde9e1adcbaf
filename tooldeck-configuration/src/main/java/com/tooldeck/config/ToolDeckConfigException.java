package com.tooldeck.config;

/**
 * Thrown when the configuration file named by {@code TOOLDECK_CONFIG_FILE} cannot be read or parsed.
 */
public final class ToolDeckConfigException extends RuntimeException {

    public ToolDeckConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
