package io.friendlyclp.core.argument;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class ArgumentTypes {
    private static final String NUMERIC_EXPECTED = "Numeric value expected.";
    private static final DateTimeFormatter DATE_TIME_SPACE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private static final ArgumentType<Integer> INTEGER = ArgumentType.of("integer", Integer::valueOf, NUMERIC_EXPECTED);
    private static final ArgumentType<Long> LONG = ArgumentType.of("long", Long::valueOf, NUMERIC_EXPECTED);
    private static final ArgumentType<Float> FLOAT = ArgumentType.of("float", Float::valueOf, NUMERIC_EXPECTED);
    private static final ArgumentType<Double> DOUBLE = ArgumentType.of("double", Double::valueOf, NUMERIC_EXPECTED);
    private static final ArgumentType<BigDecimal> DECIMAL = ArgumentType.of("decimal", BigDecimal::new, NUMERIC_EXPECTED);
    private static final ArgumentType<Integer> NON_NEGATIVE_INTEGER = INTEGER.withValidation(
        value -> value >= 0,
        "Error validating argument \"%s\". Non-negative value expected."
    );
    private static final ArgumentType<List<Integer>> INTEGER_ARRAY = ArgumentType
        .of("integer array", ArgumentTypes::parseIntegers, "Integer value expected.")
        .requiringMultisegmented();
    private static final ArgumentType<String> STRING = ArgumentType.of("string", token -> token, "");
    private static final ArgumentType<String> CHARACTER = ArgumentType.of(
        "character",
        ArgumentTypes::parseCharacter,
        "Single character expected."
    );
    private static final ArgumentType<LocalDateTime> DATE_TIME = ArgumentType.of(
        "date/time",
        ArgumentTypes::parseDateTime,
        "Wrong date/time format."
    );

    private ArgumentTypes() {
    }

    public static ArgumentType<Integer> integer() {
        return INTEGER;
    }

    public static ArgumentType<Long> longInteger() {
        return LONG;
    }

    public static ArgumentType<Float> floating() {
        return FLOAT;
    }

    public static ArgumentType<Double> doubleFloating() {
        return DOUBLE;
    }

    public static ArgumentType<BigDecimal> decimal() {
        return DECIMAL;
    }

    public static ArgumentType<Integer> nonNegativeInteger() {
        return NON_NEGATIVE_INTEGER;
    }

    /**
     * Whitespace-separated integers. Has to be declared multisegmented; an empty text is an empty list.
     */
    public static ArgumentType<List<Integer>> integerArray() {
        return INTEGER_ARRAY;
    }

    public static ArgumentType<String> string() {
        return STRING;
    }

    /**
     * Exactly one code point, returned as a string so that supplementary characters survive.
     */
    public static ArgumentType<String> character() {
        return CHARACTER;
    }

    public static ArgumentType<LocalDateTime> dateTime() {
        return DATE_TIME;
    }

    public static ArgumentType<Boolean> bool(BooleanSynonyms synonyms) {
        return ArgumentType.of("boolean", synonyms::parse, synonyms.errorDetail());
    }

    /**
     * Case-insensitive keyword table, e.g. {@code d/date/t/time}. Keys are matched in lower case.
     */
    public static <T> ArgumentType<T> oneOf(String name, Map<String, T> keywords) {
        Map<String, T> normalized = new LinkedHashMap<>();
        keywords.forEach((key, value) -> normalized.put(key.toLowerCase(Locale.ROOT), value));
        String detail = "Permissible values are: " + String.join(", ", normalized.keySet()) + ".";
        return ArgumentType.of(name, token -> {
            T value = normalized.get(token.toLowerCase(Locale.ROOT));
            if (value == null) {
                throw new IllegalArgumentException("unknown keyword: " + token);
            }
            return value;
        }, detail);
    }

    private static List<Integer> parseIntegers(String text) {
        if (text.isBlank()) {
            return List.of();
        }
        String[] elements = text.trim().split("\\s+");
        List<Integer> values = new ArrayList<>(elements.length);
        for (int i = 0; i < elements.length; i++) {
            try {
                values.add(Integer.valueOf(elements[i]));
            } catch (NumberFormatException e) {
                throw new ConversionException("Integer value expected at element #" + (i + 1) + ".");
            }
        }
        return List.copyOf(values);
    }

    private static String parseCharacter(String token) {
        if (token.codePointCount(0, token.length()) != 1) {
            throw new IllegalArgumentException("expected a single code point: " + token);
        }
        return token;
    }

    private static LocalDateTime parseDateTime(String text) {
        String value = text.trim();
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException ignored) {
            // try the next layout
        }

        try {
            return LocalDateTime.parse(value, DATE_TIME_SPACE);
        } catch (DateTimeParseException ignored) {
            // try the next layout
        }

        return LocalDate.parse(value).atStartOfDay();
    }
}
