package io.friendlyclp.core.argument;

import io.friendlyclp.core.Aliases;
import io.friendlyclp.core.ConfigurationException;

public record ArgumentSpec(
    int position,
    String name,
    String description,
    boolean optional,
    boolean multisegmented,
    String defaultValue
) {

    public ArgumentSpec {
        if (!Aliases.isValid(name)) {
            throw new ConfigurationException("Invalid argument name: \"" + name + "\".");
        }
        if (position < 0) {
            throw new ConfigurationException("\"" + name + "\" argument position is invalid (negative).");
        }
        if (description == null || description.isBlank()) {
            throw new ConfigurationException("\"" + name + "\" argument description is invalid (empty).");
        }
        if (defaultValue != null && !optional) {
            throw new ConfigurationException("\"" + name + "\" argument has a default value but is not optional.");
        }
    }

    public static ArgumentSpec of(int position, String name, String description) {
        return new ArgumentSpec(position, name, description, false, false, null);
    }

    public ArgumentSpec asOptional() {
        return new ArgumentSpec(position, name, description, true, multisegmented, defaultValue);
    }

    public ArgumentSpec asOptional(String defaultValue) {
        return new ArgumentSpec(position, name, description, true, multisegmented, defaultValue);
    }

    public ArgumentSpec asMultisegmented() {
        return new ArgumentSpec(position, name, description, optional, true, defaultValue);
    }

    /**
     * Optional and multisegmented arguments may only sit at the last position of a command.
     */
    public boolean special() {
        return optional || multisegmented;
    }
}
