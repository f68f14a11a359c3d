package com.phillippitts.numberdrill.service.numeral.english;

import com.phillippitts.numberdrill.domain.Language;
import com.phillippitts.numberdrill.service.numeral.NumeralEncoder;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Encodes integers as English numerals in 3-digit groups.
 *
 * <p>{@code 1234567 -> "one million two hundred thirty-four thousand five hundred sixty-seven"}.
 * No "and" is inserted after "hundred"; compounds 21-99 are hyphenated.
 */
@Component
public class EnglishNumeralEncoder implements NumeralEncoder {

    @Override
    public Language language() {
        return Language.ENGLISH;
    }

    @Override
    public String encodeSpoken(long value) {
        NumeralEncoder.requireEncodable(value, Language.ENGLISH);
        if (value == 0) {
            return EnglishLexicon.ZERO;
        }

        Deque<String> groups = new ArrayDeque<>();
        long remaining = value;
        int groupIndex = 0;
        while (remaining > 0) {
            int group = (int) (remaining % 1000);
            if (group > 0) {
                String text = renderGroup(group);
                groups.addFirst(groupIndex == 0 ? text : text + " " + EnglishLexicon.SCALES.get(groupIndex));
            }
            remaining /= 1000;
            groupIndex++;
        }
        return String.join(" ", groups);
    }

    @Override
    public String encodeGrouped(long value) {
        NumeralEncoder.requireEncodable(value, Language.ENGLISH);
        return String.format(Locale.US, "%,d", value);
    }

    /**
     * Renders 1..999.
     */
    static String renderGroup(int value) {
        if (value <= 0 || value >= 1000) {
            throw new IllegalArgumentException("group value must be in 1..999, got: " + value);
        }
        List<String> parts = new ArrayList<>(2);
        int hundreds = value / 100;
        if (hundreds > 0) {
            parts.add(EnglishLexicon.ONES.get(hundreds) + " " + EnglishLexicon.HUNDRED);
        }

        int rest = value % 100;
        if (rest >= 20) {
            int ones = rest % 10;
            String tens = EnglishLexicon.TENS.get(rest / 10);
            parts.add(ones > 0 ? tens + "-" + EnglishLexicon.ONES.get(ones) : tens);
        } else if (rest >= 10) {
            parts.add(EnglishLexicon.TEENS.get(rest - 10));
        } else if (rest > 0) {
            parts.add(EnglishLexicon.ONES.get(rest));
        }
        return String.join(" ", parts);
    }
}
