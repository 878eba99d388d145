package io.friendlyclp.core.text;

public final class Tokens {

    private Tokens() {
    }

    /**
     * Splits off the first whitespace-delimited token. Leading whitespace is skipped; the remainder
     * starts at the delimiter that ended the token.
     */
    public static TokenSplit split(String text) {
        String stripped = text == null ? "" : text.stripLeading();
        int end = 0;
        while (end < stripped.length() && !Character.isWhitespace(stripped.charAt(end))) {
            end++;
        }
        return new TokenSplit(stripped.substring(0, end), stripped.substring(end));
    }

    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    public record TokenSplit(String token, String remainder) {
    }
}
