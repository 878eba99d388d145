package io.friendlyclp.core.argument;

/**
 * Thrown by a converter that wants to report a more specific detail than its type's default one.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String detail) {
        super(detail);
    }
}
