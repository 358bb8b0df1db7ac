package com.chessdiagrams;

/**
 * Raised when the configuration cannot be used. This is the only error that stops a run.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
