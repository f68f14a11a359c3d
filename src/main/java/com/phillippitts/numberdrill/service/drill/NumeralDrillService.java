package com.phillippitts.numberdrill.service.drill;

import com.phillippitts.numberdrill.domain.AnswerDiagnosis;
import com.phillippitts.numberdrill.domain.Language;
import com.phillippitts.numberdrill.domain.ValidationResult;
import com.phillippitts.numberdrill.service.metrics.NumeralMetrics;
import com.phillippitts.numberdrill.service.numeral.NumeralConverter;
import com.phillippitts.numberdrill.service.validation.AnswerDiagnoser;
import com.phillippitts.numberdrill.service.validation.AnswerValidator;
import com.phillippitts.numberdrill.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.OptionalLong;

/**
 * Application-facing facade over the numeral core.
 *
 * <p>Adds what the pure core leaves out: metrics, INFO-level logging of verdicts and the
 * diagnosis of rejected answers. All numeral logic is delegated.
 */
@Service
public class NumeralDrillService {

    private static final Logger LOG = LogManager.getLogger(NumeralDrillService.class);

    private final NumeralConverter converter;
    private final AnswerValidator validator;
    private final AnswerDiagnoser diagnoser;
    private final NumeralMetrics metrics;

    public NumeralDrillService(NumeralConverter converter,
                               AnswerValidator validator,
                               AnswerDiagnoser diagnoser,
                               NumeralMetrics metrics) {
        this.converter = converter;
        this.validator = validator;
        this.diagnoser = diagnoser;
        this.metrics = metrics;
    }

    /**
     * Renders a value in both spoken and grouped form.
     *
     * @throws com.phillippitts.numberdrill.exception.NumeralOutOfRangeException if the value cannot be spoken
     */
    public SpokenNumeral render(long value, Language language) {
        return new SpokenNumeral(
                value,
                language,
                converter.encodeSpoken(value, language),
                converter.encodeGrouped(value, language));
    }

    public OptionalLong decode(String text, Language language) {
        OptionalLong value = converter.decode(text, language);
        metrics.recordDecode(language, value.isPresent());
        return value;
    }

    public CheckedAnswer check(String userAnswer, String correctAnswer, Language language, long correctNumber) {
        ValidationResult result = validator.validate(userAnswer, correctAnswer, language, correctNumber);
        AnswerDiagnosis diagnosis = diagnoser.diagnose(result);
        metrics.recordValidation(language, result.method(), result.correct());
        LOG.info("Answer checked: language={}, correct={}, method={}, confidence={}, diagnosis={}, answer='{}'",
                language.code(), result.correct(), result.method(),
                String.format(Locale.ROOT, "%.2f", result.confidence()), diagnosis.kind(),
                LogSanitizer.preview(result.userAnswer()));
        return new CheckedAnswer(result, diagnosis);
    }
}
