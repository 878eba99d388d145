package io.friendlyclp.core.argument;

// Carries the user-facing message of the first failing argument.
final class ArgumentException extends Exception {

    ArgumentException(String message) {
        super(message);
    }
}
