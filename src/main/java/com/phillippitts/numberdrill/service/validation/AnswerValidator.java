package com.phillippitts.numberdrill.service.validation;

import com.phillippitts.numberdrill.config.properties.ValidationProperties;
import com.phillippitts.numberdrill.domain.Language;
import com.phillippitts.numberdrill.domain.MatchMethod;
import com.phillippitts.numberdrill.domain.ValidationResult;
import com.phillippitts.numberdrill.service.numeral.NumeralConverter;
import com.phillippitts.numberdrill.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Checks a learner's transcribed answer against the expected numeral.
 *
 * <p>Tiers, each tried only if the previous one failed:
 * <ol>
 *   <li><b>Exact</b> - normalized texts are equal (confidence 1.0)</li>
 *   <li><b>Numeric</b> - the number extracted from the answer equals the expected number
 *       (confidence 0.95)</li>
 *   <li><b>Fuzzy</b> - edit-distance similarity of normalized texts reaches the threshold
 *       (confidence = similarity)</li>
 *   <li><b>Variant</b> - Japanese only: a spelling variant of the expected text reaches the
 *       threshold (confidence = similarity)</li>
 *   <li><b>Rejected</b> - otherwise (confidence = fuzzy similarity)</li>
 * </ol>
 *
 * <p>Never throws for any answer text. The extracted number is reported on every result.
 */
@Component
public class AnswerValidator {

    private static final Logger LOG = LogManager.getLogger(AnswerValidator.class);

    static final double EXACT_CONFIDENCE = 1.0;
    static final double NUMERIC_CONFIDENCE = 0.95;

    private static final Pattern DIGIT_GROUPING = Pattern.compile("[,\\s]");
    private static final Pattern PLAIN_DIGITS = Pattern.compile("[0-9]+");

    private final NumeralConverter converter;
    private final double fuzzyThreshold;
    private final boolean variantMatchingEnabled;

    public AnswerValidator(NumeralConverter converter, ValidationProperties properties) {
        this.converter = Objects.requireNonNull(converter, "converter");
        this.fuzzyThreshold = properties.getFuzzyThreshold();
        this.variantMatchingEnabled = properties.isVariantMatchingEnabled();
    }

    /**
     * Validates an answer.
     *
     * @param userAnswer    answer as transcribed (null is treated as empty)
     * @param correctAnswer expected answer text (null is treated as empty)
     * @param language      language of the answer
     * @param correctNumber expected value
     * @return fresh result, never null
     */
    public ValidationResult validate(String userAnswer, String correctAnswer, Language language,
                                     long correctNumber) {
        Objects.requireNonNull(language, "language");
        String answer = userAnswer == null ? "" : userAnswer;
        String expected = correctAnswer == null ? "" : correctAnswer;

        String userNorm = TextNormalizer.normalize(answer);
        String correctNorm = TextNormalizer.normalize(expected);
        OptionalLong userNumber = extractNumber(answer, language);

        if (userNorm.equals(correctNorm)) {
            return verdict(true, EXACT_CONFIDENCE, MatchMethod.EXACT, answer, userNumber, expected, correctNumber);
        }

        if (userNumber.isPresent() && userNumber.getAsLong() == correctNumber) {
            return verdict(true, NUMERIC_CONFIDENCE, MatchMethod.NUMERIC, answer, userNumber, expected,
                    correctNumber);
        }

        double similarity = TextSimilarity.similarity(userNorm, correctNorm);
        if (similarity >= fuzzyThreshold) {
            return verdict(true, similarity, MatchMethod.FUZZY, answer, userNumber, expected, correctNumber);
        }

        if (language == Language.JAPANESE && variantMatchingEnabled) {
            for (String variant : JapaneseSpellingVariants.of(correctNorm)) {
                double variantSimilarity = TextSimilarity.similarity(userNorm, variant);
                if (variantSimilarity >= fuzzyThreshold) {
                    return verdict(true, variantSimilarity, MatchMethod.VARIANT, answer, userNumber, expected,
                            correctNumber);
                }
            }
        }

        return verdict(false, similarity, MatchMethod.REJECTED, answer, userNumber, expected, correctNumber);
    }

    /**
     * Pulls a number out of an answer: plain digits (commas and spaces allowed) are parsed
     * directly, anything else goes through the language's decoder.
     */
    OptionalLong extractNumber(String answer, Language language) {
        String compact = DIGIT_GROUPING.matcher(answer.trim()).replaceAll("");
        if (PLAIN_DIGITS.matcher(compact).matches()) {
            try {
                return OptionalLong.of(Long.parseLong(compact));
            } catch (NumberFormatException e) {
                LOG.debug("Digit answer exceeds long range: '{}'", LogSanitizer.preview(answer));
                return OptionalLong.empty();
            }
        }
        return converter.decode(answer, language);
    }

    private static ValidationResult verdict(boolean correct, double confidence, MatchMethod method, String answer,
                                            OptionalLong userNumber, String expected, long correctNumber) {
        LOG.debug("Answer checked: method={}, correct={}, confidence={}, answer='{}'",
                method, correct, confidence, LogSanitizer.preview(answer));
        return new ValidationResult(correct, confidence, method, answer, userNumber, expected, correctNumber);
    }
}
