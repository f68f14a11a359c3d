package com.phillippitts.numberdrill.service.numeral.japanese;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static word tables for Japanese numerals: digit readings, unit words, unit symbols and
 * the euphony (sound change) table.
 *
 * <p>All tables are immutable. Which sound changes exist is decided here and nowhere else.
 */
final class JapaneseLexicon {

    static final String ZERO = "ぜろ";

    /** Accepted spellings of zero when decoding. */
    static final Set<String> ZERO_WORDS = Set.of(ZERO, "ゼロ", "れい", "零");

    /** Pause mark placed between major groups. */
    static final String PAUSE = "、";

    /** Standard digit readings, indexed by digit. */
    static final List<String> DIGITS = List.of(
            ZERO, "いち", "に", "さん", "よん", "ご", "ろく", "なな", "はち", "きゅう");

    /**
     * Units below 10^4. Each takes a single-digit coefficient inside a group.
     */
    enum MinorUnit {
        THOUSAND("せん", 1_000),
        HUNDRED("ひゃく", 100),
        TEN("じゅう", 10);

        private final String word;
        private final int magnitude;

        MinorUnit(String word, int magnitude) {
            this.word = word;
            this.magnitude = magnitude;
        }

        String word() {
            return word;
        }

        int magnitude() {
            return magnitude;
        }
    }

    /**
     * Units at 10^4, 10^8 and 10^12, most significant first. Each closes a 4-digit group.
     */
    enum MajorUnit {
        CHO("ちょう", '兆', 1_0000_0000_0000L),
        OKU("おく", '億', 1_0000_0000L),
        MAN("まん", '万', 1_0000L);

        private final String word;
        private final char symbol;
        private final long magnitude;
        private final Pattern symbolPattern;

        MajorUnit(String word, char symbol, long magnitude) {
            this.word = word;
            this.symbol = symbol;
            this.magnitude = magnitude;
            this.symbolPattern = Pattern.compile("(\\d*)" + symbol);
        }

        String word() {
            return word;
        }

        char symbol() {
            return symbol;
        }

        long magnitude() {
            return magnitude;
        }

        /** Matches an optional ASCII digit run followed by this unit's symbol. */
        Pattern symbolPattern() {
            return symbolPattern;
        }
    }

    /**
     * A spelling and the value it stands for.
     */
    record Reading(String text, long value) {
    }

    private static final Map<MinorUnit, Map<Integer, String>> EUPHONY = new EnumMap<>(Map.of(
            MinorUnit.HUNDRED, Map.of(3, "びゃく", 6, "ぴゃく", 8, "ぴゃく"),
            MinorUnit.THOUSAND, Map.of(3, "ぜん")
    ));

    /** Digit readings for decoding, longest first so "しち" wins over "し". */
    static final List<Reading> DIGIT_READINGS = digitReadings();

    /** Every spelling of every minor unit, including sound-changed forms. */
    static final List<Reading> MINOR_UNIT_READINGS = minorUnitReadings();

    private JapaneseLexicon() {
        // Prevent instantiation
    }

    /**
     * Renders a minor unit as it sounds after the given coefficient digit.
     *
     * @param unit  unit to render
     * @param digit preceding coefficient digit (1-9)
     * @return sound-changed spelling, or the plain unit word when no change applies
     */
    static String euphonic(MinorUnit unit, int digit) {
        return EUPHONY.getOrDefault(unit, Map.of()).getOrDefault(digit, unit.word());
    }

    private static List<Reading> digitReadings() {
        List<Reading> readings = new ArrayList<>();
        for (int digit = 0; digit < DIGITS.size(); digit++) {
            readings.add(new Reading(DIGITS.get(digit), digit));
        }
        // Alternate readings
        readings.add(new Reading("し", 4));
        readings.add(new Reading("しち", 7));
        readings.add(new Reading("く", 9));
        // Contracted readings before a unit (いっせん, ろっぴゃく, はっぴゃく)
        readings.add(new Reading("いっ", 1));
        readings.add(new Reading("ろっ", 6));
        readings.add(new Reading("はっ", 8));
        readings.sort(Comparator.comparingInt((Reading r) -> r.text().length()).reversed());
        return List.copyOf(readings);
    }

    private static List<Reading> minorUnitReadings() {
        List<Reading> readings = new ArrayList<>();
        for (MinorUnit unit : MinorUnit.values()) {
            readings.add(new Reading(unit.word(), unit.magnitude()));
            for (String variant : EUPHONY.getOrDefault(unit, Map.of()).values()) {
                Reading reading = new Reading(variant, unit.magnitude());
                if (!readings.contains(reading)) {
                    readings.add(reading);
                }
            }
        }
        return List.copyOf(readings);
    }
}
