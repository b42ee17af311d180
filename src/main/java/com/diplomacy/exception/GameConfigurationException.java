package com.diplomacy.exception;

/**
 * Fatal problem with the map or rules description, raised while the application starts.
 */
public class GameConfigurationException extends RuntimeException {

    public GameConfigurationException(String message) {
        super(message);
    }

    public GameConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
