package com.phillippitts.numberdrill.service.numeral.japanese;

import com.phillippitts.numberdrill.domain.Language;
import com.phillippitts.numberdrill.service.numeral.NumeralEncoder;
import com.phillippitts.numberdrill.service.numeral.japanese.JapaneseLexicon.MajorUnit;
import com.phillippitts.numberdrill.service.numeral.japanese.JapaneseLexicon.MinorUnit;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes integers as Japanese numerals.
 *
 * <p>Spoken form is hiragana built from 4-digit groups closed by ちょう, おく and まん, with
 * groups separated by a pause mark: {@code 12345 -> "いちまん、にせんさんびゃくよんじゅうご"}.
 * Inside a group a coefficient of 1 is dropped before せん, ひゃく and じゅう, and sound
 * changes follow {@link JapaneseLexicon#euphonic}.
 *
 * <p>Grouped form writes each major coefficient in digits followed by its kanji unit:
 * {@code 123456789 -> "1億2345万6789"}.
 */
@Component
public class JapaneseNumeralEncoder implements NumeralEncoder {

    private static final int GROUP_SIZE = 10_000;

    @Override
    public Language language() {
        return Language.JAPANESE;
    }

    @Override
    public String encodeSpoken(long value) {
        NumeralEncoder.requireEncodable(value, Language.JAPANESE);
        if (value == 0) {
            return JapaneseLexicon.ZERO;
        }

        List<String> parts = new ArrayList<>();
        long remaining = value;
        for (MajorUnit unit : MajorUnit.values()) {
            int coefficient = (int) (remaining / unit.magnitude());
            if (coefficient > 0) {
                parts.add(renderGroup(coefficient) + unit.word());
            }
            remaining %= unit.magnitude();
        }
        if (remaining > 0) {
            parts.add(renderGroup((int) remaining));
        }
        return String.join(JapaneseLexicon.PAUSE, parts);
    }

    @Override
    public String encodeGrouped(long value) {
        NumeralEncoder.requireEncodable(value, Language.JAPANESE);

        StringBuilder sb = new StringBuilder();
        long remaining = value;
        for (MajorUnit unit : MajorUnit.values()) {
            long coefficient = remaining / unit.magnitude();
            if (coefficient > 0) {
                sb.append(coefficient).append(unit.symbol());
            }
            remaining %= unit.magnitude();
        }
        if (remaining > 0 || sb.length() == 0) {
            sb.append(remaining);
        }
        return sb.toString();
    }

    /**
     * Renders 1..9999 in hiragana without major units.
     */
    static String renderGroup(int value) {
        if (value <= 0 || value >= GROUP_SIZE) {
            throw new IllegalArgumentException("group value must be in 1..9999, got: " + value);
        }
        StringBuilder sb = new StringBuilder();
        int remaining = value;
        for (MinorUnit unit : MinorUnit.values()) {
            int digit = remaining / unit.magnitude();
            if (digit > 0) {
                if (digit != 1) {
                    sb.append(JapaneseLexicon.DIGITS.get(digit));
                }
                sb.append(JapaneseLexicon.euphonic(unit, digit));
            }
            remaining %= unit.magnitude();
        }
        if (remaining > 0) {
            sb.append(JapaneseLexicon.DIGITS.get(remaining));
        }
        return sb.toString();
    }
}
