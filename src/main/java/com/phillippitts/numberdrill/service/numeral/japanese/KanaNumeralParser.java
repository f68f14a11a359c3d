package com.phillippitts.numberdrill.service.numeral.japanese;

import com.phillippitts.numberdrill.service.numeral.japanese.JapaneseLexicon.MajorUnit;
import com.phillippitts.numberdrill.service.numeral.japanese.JapaneseLexicon.Reading;

import java.util.OptionalLong;

/**
 * Single left-to-right scan over hiragana numerals.
 *
 * <p>At every position the scanner tries, in this order: a major unit word (ちょう, おく,
 * まん), a minor unit word in any of its sound-changed spellings, then a digit reading,
 * longest first. Characters matching none of them are skipped. The order is significant:
 * unit words must win over digit readings that share a prefix.
 */
final class KanaNumeralParser {

    /**
     * Accumulators threaded through the scan.
     */
    static final class ScanState {
        /** Total of completed major groups. */
        long finalResult;
        /** Value of the group below the next major unit. */
        long groupValue;
        /** Digit waiting for a unit word. */
        long pendingDigit;

        void closeMajorGroup(long magnitude) {
            groupValue = Math.addExact(groupValue, pendingDigit);
            long coefficient = groupValue == 0 ? 1 : groupValue;
            finalResult = Math.addExact(finalResult, Math.multiplyExact(coefficient, magnitude));
            groupValue = 0;
            pendingDigit = 0;
        }

        void applyMinorUnit(long magnitude) {
            long coefficient = pendingDigit == 0 ? 1 : pendingDigit;
            groupValue = Math.addExact(groupValue, coefficient * magnitude);
            pendingDigit = 0;
        }

        void pushDigit(long digit) {
            groupValue = Math.addExact(groupValue, pendingDigit);
            pendingDigit = digit;
        }

        long finish() {
            groupValue = Math.addExact(groupValue, pendingDigit);
            pendingDigit = 0;
            finalResult = Math.addExact(finalResult, groupValue);
            groupValue = 0;
            return finalResult;
        }
    }

    /**
     * @param text hiragana input with separators already removed
     * @return decoded value, or empty if nothing positive was recognized
     * @throws ArithmeticException if the value does not fit in a long
     */
    OptionalLong parse(String text) {
        ScanState state = new ScanState();
        int i = 0;
        while (i < text.length()) {
            int consumed = matchMajorUnit(text, i, state);
            if (consumed == 0) {
                consumed = matchMinorUnit(text, i, state);
            }
            if (consumed == 0) {
                consumed = matchDigit(text, i, state);
            }
            i += consumed == 0 ? 1 : consumed;
        }
        long result = state.finish();
        return result > 0 ? OptionalLong.of(result) : OptionalLong.empty();
    }

    private static int matchMajorUnit(String text, int offset, ScanState state) {
        for (MajorUnit unit : MajorUnit.values()) {
            if (text.startsWith(unit.word(), offset)) {
                state.closeMajorGroup(unit.magnitude());
                return unit.word().length();
            }
        }
        return 0;
    }

    private static int matchMinorUnit(String text, int offset, ScanState state) {
        for (Reading reading : JapaneseLexicon.MINOR_UNIT_READINGS) {
            if (text.startsWith(reading.text(), offset)) {
                state.applyMinorUnit(reading.value());
                return reading.text().length();
            }
        }
        return 0;
    }

    private static int matchDigit(String text, int offset, ScanState state) {
        for (Reading reading : JapaneseLexicon.DIGIT_READINGS) {
            if (text.startsWith(reading.text(), offset)) {
                state.pushDigit(reading.value());
                return reading.text().length();
            }
        }
        return 0;
    }
}
