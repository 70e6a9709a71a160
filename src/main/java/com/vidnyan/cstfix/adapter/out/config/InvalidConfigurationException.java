package com.vidnyan.cstfix.adapter.out.config;

/**
 * Raised when analyzer configuration names an unknown option, rule or value.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
