package io.friendlyclp.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

public final class Aliases {
    public static final String SEPARATOR = "|";
    private static final Pattern VALID = Pattern.compile("^[a-z0-9]+$");

    private Aliases() {
    }

    /**
     * Splits the {@code "name|alias"} form used in help text into a list. Blank entries are dropped.
     */
    public static List<String> parse(String piped) {
        if (piped == null || piped.isBlank()) {
            return List.of();
        }
        List<String> aliases = new ArrayList<>();
        for (String part : piped.split(Pattern.quote(SEPARATOR))) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                aliases.add(trimmed);
            }
        }
        return List.copyOf(aliases);
    }

    public static String join(List<String> aliases) {
        return String.join(SEPARATOR, aliases);
    }

    public static boolean isValid(String alias) {
        return alias != null && VALID.matcher(alias).matches();
    }

    /**
     * Validates a declared alias list and returns an immutable copy of it.
     *
     * @param kind element kind used in error messages, e.g. "command" or "command group"
     */
    public static List<String> validate(List<String> aliases, String kind) {
        if (aliases == null || aliases.isEmpty()) {
            throw new ConfigurationException("Invalid " + kind + " names (empty).");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String alias : aliases) {
            if (!isValid(alias)) {
                throw new ConfigurationException("Invalid " + kind + " name: \"" + alias + "\".");
            }
            if (!seen.add(alias)) {
                throw new ConfigurationException(
                    "Invalid " + kind + " names: \"" + alias + "\" is declared twice in \"" + join(aliases) + "\"."
                );
            }
        }
        return List.copyOf(seen);
    }
}
