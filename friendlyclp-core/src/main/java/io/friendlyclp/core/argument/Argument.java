package io.friendlyclp.core.argument;

import io.friendlyclp.core.ConfigurationException;
import java.util.Objects;

/**
 * Declares one argument of a command: its metadata plus the type that converts it.
 * Commands keep their arguments in constants and read parsed values back with
 * {@link ParsedArguments#get(Argument)}.
 */
public final class Argument<T> {
    private final ArgumentSpec spec;
    private final ArgumentType<T> type;

    private Argument(ArgumentSpec spec, ArgumentType<T> type) {
        this.spec = spec;
        this.type = type;
    }

    public static <T> Argument<T> of(ArgumentSpec spec, ArgumentType<T> type) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (type.multisegmentedOnly() && !spec.multisegmented()) {
            throw new ConfigurationException(
                "Argument \"" + spec.name() + "\" of type " + type.name() + " should always be multisegmented."
            );
        }
        return new Argument<>(spec, type);
    }

    public ArgumentSpec spec() {
        return spec;
    }

    public ArgumentType<T> type() {
        return type;
    }

    public String name() {
        return spec.name();
    }

    public int position() {
        return spec.position();
    }

    @Override
    public String toString() {
        return "Argument[" + spec.name() + ": " + type.name() + "]";
    }
}
