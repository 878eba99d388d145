package io.friendlyclp.core;

/**
 * Thrown while a command set is being registered. It signals a mistake in the command set
 * itself, never bad user input.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
