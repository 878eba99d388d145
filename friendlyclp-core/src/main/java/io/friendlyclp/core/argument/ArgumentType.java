package io.friendlyclp.core.argument;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Conversion and validation rules for one kind of argument value.
 *
 * <p>A converter signals failure by throwing any runtime exception; the type's error detail is then
 * shown to the user. Throw {@link ConversionException} to show a more specific detail instead.
 * Validation templates are formatted with the argument name as their only parameter; a check that
 * throws is reported with its template as well.
 */
public final class ArgumentType<T> {
    private final String name;
    private final Function<String, ? extends T> converter;
    private final String errorDetail;
    private final List<Validation<T>> validations;
    private final boolean multisegmentedOnly;

    private ArgumentType(
        String name,
        Function<String, ? extends T> converter,
        String errorDetail,
        List<Validation<T>> validations,
        boolean multisegmentedOnly
    ) {
        this.name = name;
        this.converter = converter;
        this.errorDetail = errorDetail;
        this.validations = List.copyOf(validations);
        this.multisegmentedOnly = multisegmentedOnly;
    }

    public static <T> ArgumentType<T> of(String name, Function<String, ? extends T> converter, String errorDetail) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(converter, "converter must not be null");
        return new ArgumentType<>(name, converter, errorDetail == null ? "" : errorDetail, List.of(), false);
    }

    public ArgumentType<T> withValidation(Predicate<? super T> check, String messageTemplate) {
        Objects.requireNonNull(check, "check must not be null");
        Objects.requireNonNull(messageTemplate, "messageTemplate must not be null");
        List<Validation<T>> extended = new ArrayList<>(validations);
        extended.add(new Validation<>(check, messageTemplate));
        return new ArgumentType<>(name, converter, errorDetail, extended, multisegmentedOnly);
    }

    public ArgumentType<T> requiringMultisegmented() {
        return new ArgumentType<>(name, converter, errorDetail, validations, true);
    }

    public String name() {
        return name;
    }

    public boolean multisegmentedOnly() {
        return multisegmentedOnly;
    }

    T convert(String element, String argumentName) throws ArgumentException {
        try {
            return converter.apply(element);
        } catch (ConversionException e) {
            throw new ArgumentException(parseError(argumentName, e.getMessage()));
        } catch (RuntimeException e) {
            throw new ArgumentException(parseError(argumentName, errorDetail));
        }
    }

    void validate(T value, String argumentName) throws ArgumentException {
        for (Validation<T> validation : validations) {
            if (!passes(validation, value)) {
                throw new ArgumentException(String.format(validation.messageTemplate(), argumentName));
            }
        }
    }

    // A check that throws counts as a rejection.
    private static <T> boolean passes(Validation<T> validation, T value) {
        try {
            return validation.check().test(value);
        } catch (RuntimeException e) {
            return false;
        }
    }

    private static String parseError(String argumentName, String detail) {
        String message = "Error parsing argument \"" + argumentName + "\".";
        return detail == null || detail.isBlank() ? message : message + " " + detail;
    }

    private record Validation<V>(Predicate<? super V> check, String messageTemplate) {
    }
}
