package com.phillippitts.numberdrill.service.validation;

import com.phillippitts.numberdrill.config.properties.ValidationProperties;
import com.phillippitts.numberdrill.domain.AnswerDiagnosis;
import com.phillippitts.numberdrill.domain.AnswerDiagnosis.Kind;
import com.phillippitts.numberdrill.domain.ValidationResult;
import org.springframework.stereotype.Component;

/**
 * Explains why an answer was rejected, using the number already extracted by the validator.
 *
 * <p>Checks in order: not recognized, very close (within a percentage of the expected
 * value), wrong digit count, first wrong place.
 */
@Component
public class AnswerDiagnoser {

    private final double veryClosePercent;

    public AnswerDiagnoser(ValidationProperties properties) {
        this.veryClosePercent = properties.getVeryClosePercent();
    }

    public AnswerDiagnosis diagnose(ValidationResult result) {
        if (result.correct()) {
            return AnswerDiagnosis.of(Kind.CORRECT);
        }
        if (!result.userParsed()) {
            return AnswerDiagnosis.of(Kind.NOT_RECOGNIZED);
        }

        long user = result.userNumber().getAsLong();
        long expected = result.correctNumber();
        long difference = Math.abs(user - expected);
        String userDigits = Long.toString(user);
        String correctDigits = Long.toString(expected);

        if (expected > 0 && difference * 100.0 / expected < veryClosePercent) {
            return new AnswerDiagnosis(Kind.VERY_CLOSE, userDigits.length(), correctDigits.length(), -1, difference);
        }
        if (userDigits.length() != correctDigits.length()) {
            Kind kind = userDigits.length() < correctDigits.length() ? Kind.FEWER_DIGITS : Kind.MORE_DIGITS;
            return new AnswerDiagnosis(kind, userDigits.length(), correctDigits.length(), -1, difference);
        }
        for (int i = 0; i < userDigits.length(); i++) {
            if (userDigits.charAt(i) != correctDigits.charAt(i)) {
                int place = userDigits.length() - 1 - i;
                return new AnswerDiagnosis(Kind.CHECK_PLACE, userDigits.length(), correctDigits.length(), place,
                        difference);
            }
        }
        return new AnswerDiagnosis(Kind.TRY_AGAIN, userDigits.length(), correctDigits.length(), -1, difference);
    }
}
