package com.phillippitts.numberdrill.service.numeral.english;

import com.phillippitts.numberdrill.domain.Language;
import com.phillippitts.numberdrill.service.numeral.NumeralDecoder;
import com.phillippitts.numberdrill.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Decodes English numerals as produced by speech transcription.
 *
 * <p>Words and literal digit tokens may be interleaved ("1 billion 200 million"). Tokens are
 * split on whitespace, hyphens and word-trailing commas and folded left to right into a running group value and a
 * confirmed total. Unknown words such as "and" are skipped.
 */
@Component
public class EnglishNumeralDecoder implements NumeralDecoder {

    private static final Logger LOG = LogManager.getLogger(EnglishNumeralDecoder.class);

    /** Whitespace, hyphens, and commas that are not inside a digit group ("1,200"). */
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[\\s-]+|,(?!\\d{3}(?!\\d))");
    private static final Pattern SENTENCE_PUNCTUATION = Pattern.compile("[.!?;:\"()]");
    private static final Pattern DIGIT_TOKEN = Pattern.compile("\\d{1,3}(,\\d{3})+|\\d+");
    private static final Pattern ZERO_DIGITS = Pattern.compile("0+");

    @Override
    public Language language() {
        return Language.ENGLISH;
    }

    @Override
    public OptionalLong decode(String text) {
        if (text == null) {
            return OptionalLong.empty();
        }
        String normalized = SENTENCE_PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("").trim();
        if (normalized.equals(EnglishLexicon.ZERO) || ZERO_DIGITS.matcher(normalized).matches()) {
            return OptionalLong.of(0);
        }

        long result = 0;
        long current = 0;
        try {
            for (String token : TOKEN_SEPARATOR.split(normalized)) {
                if (token.isEmpty()) {
                    continue;
                }
                Integer additive = EnglishLexicon.ADDITIVE_WORDS.get(token);
                Long scale = EnglishLexicon.SCALE_MAGNITUDES.get(token);
                if (DIGIT_TOKEN.matcher(token).matches()) {
                    current = Math.addExact(current, Long.parseLong(token.replace(",", "")));
                } else if (additive != null) {
                    current = Math.addExact(current, additive);
                } else if (token.equals(EnglishLexicon.HUNDRED)) {
                    current = Math.multiplyExact(current == 0 ? 1 : current, 100);
                } else if (scale != null) {
                    result = Math.addExact(result, Math.multiplyExact(current == 0 ? 1 : current, scale));
                    current = 0;
                }
            }
            result = Math.addExact(result, current);
        } catch (ArithmeticException | NumberFormatException e) {
            LOG.debug("English numeral exceeds long range: '{}'", LogSanitizer.preview(text));
            return OptionalLong.empty();
        }
        return result > 0 ? OptionalLong.of(result) : OptionalLong.empty();
    }
}
