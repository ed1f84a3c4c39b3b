package ch.so.arp.rag.text2sql.metadata;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helpers for matching SQL identifiers inside free text. An identifier only
 * matches as a whole word: {@code user} does not match inside {@code user_id}.
 */
public final class Identifiers {

    private Identifiers() {
    }

    public static boolean mentions(String text, String identifier) {
        if (text == null || identifier == null || identifier.isBlank()) {
            return false;
        }
        return pattern(identifier).matcher(text).find();
    }

    public static Pattern pattern(String identifier) {
        return Pattern.compile("(?<![A-Za-z0-9_])" + Pattern.quote(identifier) + "(?![A-Za-z0-9_])",
                Pattern.CASE_INSENSITIVE);
    }

    public static String normalize(String identifier) {
        return identifier == null ? "" : identifier.trim().toLowerCase(Locale.ROOT);
    }
}
