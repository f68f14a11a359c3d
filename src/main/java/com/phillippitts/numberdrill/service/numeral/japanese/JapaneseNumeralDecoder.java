package com.phillippitts.numberdrill.service.numeral.japanese;

import com.phillippitts.numberdrill.domain.Language;
import com.phillippitts.numberdrill.service.numeral.NumeralDecoder;
import com.phillippitts.numberdrill.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Decodes Japanese numerals in hiragana ("さんびゃくまん"), mixed digit/kanji form ("300万")
 * or plain digits.
 *
 * <p>Input is NFKC-normalized (full-width digits become ASCII) and stripped of pause marks,
 * commas and whitespace. The mixed parser runs first; if it finds nothing the hiragana
 * state machine runs.
 */
@Component
public class JapaneseNumeralDecoder implements NumeralDecoder {

    private static final Logger LOG = LogManager.getLogger(JapaneseNumeralDecoder.class);

    private static final Pattern SEPARATORS = Pattern.compile("[、,，・\\s]+");
    private static final Pattern ZERO_DIGITS = Pattern.compile("0+");

    private final MixedNumeralParser mixedParser = new MixedNumeralParser();
    private final KanaNumeralParser kanaParser = new KanaNumeralParser();

    @Override
    public Language language() {
        return Language.JAPANESE;
    }

    @Override
    public OptionalLong decode(String text) {
        if (text == null) {
            return OptionalLong.empty();
        }
        String cleaned = clean(text);
        if (cleaned.isEmpty()) {
            return OptionalLong.empty();
        }
        if (JapaneseLexicon.ZERO_WORDS.contains(cleaned) || ZERO_DIGITS.matcher(cleaned).matches()) {
            return OptionalLong.of(0);
        }

        try {
            OptionalLong mixed = mixedParser.parse(cleaned);
            if (mixed.isPresent()) {
                return mixed;
            }
            return kanaParser.parse(cleaned);
        } catch (ArithmeticException | NumberFormatException e) {
            LOG.debug("Japanese numeral exceeds long range: '{}'", LogSanitizer.preview(text));
            return OptionalLong.empty();
        }
    }

    static String clean(String text) {
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC);
        return SEPARATORS.matcher(normalized).replaceAll("");
    }
}
