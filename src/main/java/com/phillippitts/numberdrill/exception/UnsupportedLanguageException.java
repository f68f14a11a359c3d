package com.phillippitts.numberdrill.exception;

/**
 * Thrown when a language code does not name a supported language.
 */
public class UnsupportedLanguageException extends NumberDrillException {

    private final String languageCode;

    public UnsupportedLanguageException(String languageCode) {
        super("Unsupported language: " + languageCode);
        this.languageCode = languageCode;
    }

    public String getLanguageCode() {
        return languageCode;
    }
}
