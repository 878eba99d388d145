package io.friendlyclp.core.argument;

/**
 * Result of parsing one argument for one invocation. {@code value} is null when an optional
 * argument was omitted and declares no default.
 */
public record ArgumentValue(ArgumentSpec spec, Object value, boolean omitted) {

    public static ArgumentValue supplied(ArgumentSpec spec, Object value) {
        return new ArgumentValue(spec, value, false);
    }

    public static ArgumentValue omitted(ArgumentSpec spec, Object defaultValue) {
        return new ArgumentValue(spec, defaultValue, true);
    }
}
