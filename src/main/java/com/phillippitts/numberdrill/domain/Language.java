package com.phillippitts.numberdrill.domain;

import com.phillippitts.numberdrill.exception.UnsupportedLanguageException;

import java.util.Locale;

/**
 * Languages a numeral can be spoken in.
 *
 * <p>Each language carries the largest value its spoken grammar can name:
 * Japanese stops at 9999兆 (just under 10^16), English at 999 trillion.
 */
public enum Language {

    JAPANESE("ja", 9_999_9999_9999_9999L),
    ENGLISH("en", 999_999_999_999_999L);

    private final String code;
    private final long maxValue;

    Language(String code, long maxValue) {
        this.code = code;
        this.maxValue = maxValue;
    }

    /** Two-letter language code ("ja", "en"). */
    public String code() {
        return code;
    }

    /** Largest value that can be encoded in this language. */
    public long maxValue() {
        return maxValue;
    }

    /**
     * Resolves a language from its code or enum name, ignoring case.
     *
     * @param value language code such as "ja" or "EN"
     * @return matching language
     * @throws UnsupportedLanguageException if the value names no supported language
     */
    public static Language fromCode(String value) {
        if (value != null) {
            String key = value.trim().toLowerCase(Locale.ROOT);
            for (Language language : values()) {
                if (language.code.equals(key) || language.name().toLowerCase(Locale.ROOT).equals(key)) {
                    return language;
                }
            }
        }
        throw new UnsupportedLanguageException(value);
    }
}
