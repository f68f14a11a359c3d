package com.phillippitts.numberdrill.service.validation;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes answer text before comparison.
 *
 * <p>Rules:
 * <ul>
 *   <li>NFKC (full-width letters, digits and punctuation become their ASCII forms)</li>
 *   <li>Lowercase with {@link Locale#ROOT}</li>
 *   <li>Remove whitespace and readability punctuation: {@code 、。,.・!?'"-}</li>
 * </ul>
 */
public final class TextNormalizer {

    private static final Pattern IGNORABLE = Pattern.compile("[\\s\\p{Z}、。,.・!?'\"\\-]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
        // Prevent instantiation
    }

    /**
     * @param text answer text (may be null)
     * @return normalized text, empty for null
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String folded = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        return IGNORABLE.matcher(folded).replaceAll("");
    }

    /** Removes all whitespace. */
    static String removeWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll("");
    }

    /** Collapses whitespace runs into a single space. */
    static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ");
    }
}
