package io.friendlyclp.core.argument;

import java.util.List;
import java.util.Locale;

public enum BooleanSynonyms {
    TRUE_FALSE(List.of("true", "t"), List.of("false", "f")),
    YES_NO(List.of("yes", "y"), List.of("no", "n")),
    ALLOWED_FORBIDDEN(List.of("allowed", "a"), List.of("forbidden", "f"));

    private final List<String> trueSynonyms;
    private final List<String> falseSynonyms;

    BooleanSynonyms(List<String> trueSynonyms, List<String> falseSynonyms) {
        this.trueSynonyms = trueSynonyms;
        this.falseSynonyms = falseSynonyms;
    }

    public Boolean parse(String token) {
        String normalized = token.toLowerCase(Locale.ROOT);
        if (trueSynonyms.contains(normalized)) {
            return Boolean.TRUE;
        }
        if (falseSynonyms.contains(normalized)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("unknown boolean synonym: " + token);
    }

    public String errorDetail() {
        return "Permissible values are: " + String.join(", ", trueSynonyms)
            + "; or: " + String.join(", ", falseSynonyms) + ".";
    }
}
