package io.friendlyclp.core.argument;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class ParsedArguments {
    private final Map<String, ArgumentValue> values;

    ParsedArguments(Map<String, ArgumentValue> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @SuppressWarnings("unchecked")
    public <T> T get(Argument<T> argument) {
        return (T) require(argument).value();
    }

    public <T> T getOrDefault(Argument<T> argument, T fallback) {
        T value = get(argument);
        return value == null ? fallback : value;
    }

    public boolean isOmitted(Argument<?> argument) {
        return require(argument).omitted();
    }

    public Optional<ArgumentValue> find(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Map<String, ArgumentValue> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    private ArgumentValue require(Argument<?> argument) {
        ArgumentValue value = values.get(argument.name());
        if (value == null || !value.spec().equals(argument.spec())) {
            throw new IllegalArgumentException("Argument \"" + argument.name() + "\" was not parsed for this command");
        }
        return value;
    }

    @Override
    public String toString() {
        return "ParsedArguments" + values;
    }
}
