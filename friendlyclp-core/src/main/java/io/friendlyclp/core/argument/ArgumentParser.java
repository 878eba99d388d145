package io.friendlyclp.core.argument;

import io.friendlyclp.core.text.Tokens;
import io.friendlyclp.core.text.Tokens.TokenSplit;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consumes the argument part of an input line against an ordered argument list.
 * Parsing stops at the first failing argument.
 */
public final class ArgumentParser {
    private final List<Argument<?>> arguments;

    public ArgumentParser(List<Argument<?>> arguments) {
        this.arguments = arguments.stream()
            .sorted(Comparator.comparingInt(Argument::position))
            .toList();
    }

    public List<Argument<?>> arguments() {
        return arguments;
    }

    public ParseResult parse(String line) {
        Map<String, ArgumentValue> values = new LinkedHashMap<>();
        String remainder = line == null ? "" : line;

        for (Argument<?> argument : arguments) {
            ArgumentSpec spec = argument.spec();
            remainder = remainder.stripLeading();
            try {
                if (remainder.isEmpty()) {
                    if (!spec.optional()) {
                        return ParseResult.failure("Argument \"" + spec.name() + "\" is missing!");
                    }
                    // A broken default is reported like broken user input.
                    Object value = spec.defaultValue() == null ? null : convertAndValidate(argument, spec.defaultValue());
                    values.put(spec.name(), ArgumentValue.omitted(spec, value));
                    continue;
                }

                String element;
                if (spec.multisegmented()) {
                    element = remainder;
                    remainder = "";
                } else {
                    TokenSplit split = Tokens.split(remainder);
                    element = split.token();
                    remainder = split.remainder();
                }
                values.put(spec.name(), ArgumentValue.supplied(spec, convertAndValidate(argument, element)));
            } catch (ArgumentException e) {
                return ParseResult.failure(e.getMessage());
            }
        }

        if (!remainder.isBlank()) {
            return ParseResult.failure("Too many arguments!");
        }
        return ParseResult.success(new ParsedArguments(values));
    }

    private static <T> T convertAndValidate(Argument<T> argument, String element) throws ArgumentException {
        T value = argument.type().convert(element, argument.name());
        argument.type().validate(value, argument.name());
        return value;
    }
}
