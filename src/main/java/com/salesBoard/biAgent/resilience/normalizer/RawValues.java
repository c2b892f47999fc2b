package com.salesBoard.biAgent.resilience.normalizer;

import java.util.Locale;
import java.util.Set;

/**
 * Helpers shared by the field normalizers.
 */
final class RawValues {

    /**
     * Placeholders boards commonly use for "no value".
     */
    private static final Set<String> NULL_TOKENS = Set.of("", "null", "none", "n/a", "na", "-", "--", "tbd", "nil");

    private RawValues() {}

    /**
     * Trimmed text of a raw value, or null when the value is absent or a placeholder.
     */
    static String presentText(Object rawValue) {
        if (rawValue == null) {
            return null;
        }
        String text = rawValue.toString().strip();
        if (NULL_TOKENS.contains(text.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return text;
    }
}
