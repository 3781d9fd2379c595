package com.warehousesentinel.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Naming helpers shared by definitions and SQL builders.
 *
 * @since 1.0.0
 */
public final class Names {

    private Names() {
        // utility class, not instantiable
    }

    /**
     * Convert an identifier to {@code snake_case}.
     *
     * <p>
     * Words are split on any non-alphanumeric character, on lower-to-upper
     * case transitions, at the end of an upper-case run followed by a
     * lower-case letter, and between letters and digits:
     * {@code "adsDaily"} and {@code "ads-daily"} both become
     * {@code "ads_daily"}, {@code "HTMLReport"} becomes {@code "html_report"},
     * {@code "last90d"} becomes {@code "last_90_d"}.
     * </p>
     *
     * @param value identifier; must not be {@code null}
     * @return snake_case form
     */
    public static String snakeCase(String value) {
        Objects.requireNonNull(value, "Value must not be null");
        List<String> words = new ArrayList<>();
        StringBuilder word = new StringBuilder();

        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                flush(word, words);
                continue;
            }
            if (word.length() > 0 && isBoundary(value, i)) {
                flush(word, words);
            }
            word.append(Character.toLowerCase(c));
        }
        flush(word, words);
        return String.join("_", words);
    }

    /**
     * Check that a name is usable as an unquoted BigQuery column or table
     * identifier.
     *
     * @param name candidate
     * @return {@code true} when it matches {@code [A-Za-z_][A-Za-z0-9_]*}
     */
    public static boolean isSqlIdentifier(String name) {
        return name != null && name.matches("[A-Za-z_][A-Za-z0-9_]*");
    }

    /**
     * Strip every character that is not allowed in an unquoted identifier.
     *
     * @param name raw field name
     * @return sanitized name
     */
    public static String sanitizeIdentifier(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static boolean isBoundary(String value, int i) {
        char prev = value.charAt(i - 1);
        char c = value.charAt(i);
        if (Character.isDigit(c) != Character.isDigit(prev)) {
            return true;
        }
        if (Character.isUpperCase(c) && Character.isLowerCase(prev)) {
            return true;
        }
        // "HTMLReport": split before the 'R' that starts a lower-case word
        return Character.isUpperCase(c) && Character.isUpperCase(prev)
                && i + 1 < value.length() && Character.isLowerCase(value.charAt(i + 1));
    }

    private static void flush(StringBuilder word, List<String> words) {
        if (word.length() > 0) {
            words.add(word.toString());
            word.setLength(0);
        }
    }
}
