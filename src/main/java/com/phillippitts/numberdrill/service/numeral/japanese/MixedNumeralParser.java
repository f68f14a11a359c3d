package com.phillippitts.numberdrill.service.numeral.japanese;

import com.phillippitts.numberdrill.service.numeral.japanese.JapaneseLexicon.MajorUnit;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses numerals that mix ASCII digits with kanji major units, such as "300万" or
 * "1億2345万6789".
 *
 * <p>Units are consumed from 兆 down to 万; the first digit run left over is the remainder
 * below 10^4. A unit symbol with no digits in front counts as a coefficient of 1, so "兆"
 * alone reads as 10^12.
 */
final class MixedNumeralParser {

    private static final Pattern APPLICABLE = Pattern.compile("[0-9万億兆]");
    private static final Pattern DIGIT_RUN = Pattern.compile("[0-9]+");

    /**
     * @param text input with separators already removed
     * @return sum of recognized parts, or empty if the text is not in mixed form or sums to zero
     * @throws ArithmeticException if the value does not fit in a long
     * @throws NumberFormatException if a digit run does not fit in a long
     */
    OptionalLong parse(String text) {
        if (!APPLICABLE.matcher(text).find()) {
            return OptionalLong.empty();
        }

        long result = 0;
        String remaining = text;
        for (MajorUnit unit : MajorUnit.values()) {
            Matcher m = unit.symbolPattern().matcher(remaining);
            if (m.find()) {
                String digits = m.group(1);
                long coefficient = digits.isEmpty() ? 1 : Long.parseLong(digits);
                result = Math.addExact(result, Math.multiplyExact(coefficient, unit.magnitude()));
                remaining = remaining.substring(0, m.start()) + remaining.substring(m.end());
            }
        }

        Matcher rest = DIGIT_RUN.matcher(remaining);
        if (rest.find()) {
            result = Math.addExact(result, Long.parseLong(rest.group()));
        }
        return result > 0 ? OptionalLong.of(result) : OptionalLong.empty();
    }
}
