package io.friendlyclp.core.argument;

public record ParseResult(ParsedArguments arguments, String error) {

    public static ParseResult success(ParsedArguments arguments) {
        return new ParseResult(arguments, null);
    }

    public static ParseResult failure(String error) {
        return new ParseResult(null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
