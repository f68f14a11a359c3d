package com.phillippitts.numberdrill.service.numeral.english;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Static word tables for English numerals.
 */
final class EnglishLexicon {

    static final String ZERO = "zero";
    static final String HUNDRED = "hundred";

    /** Ones words indexed by value; index 0 is unused. */
    static final List<String> ONES = List.of(
            "", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine");

    /** Teen words indexed by value - 10. */
    static final List<String> TEENS = List.of(
            "ten", "eleven", "twelve", "thirteen", "fourteen",
            "fifteen", "sixteen", "seventeen", "eighteen", "nineteen");

    /** Tens words indexed by tens digit; indexes 0 and 1 are unused. */
    static final List<String> TENS = List.of(
            "", "", "twenty", "thirty", "forty", "fifty", "sixty", "seventy", "eighty", "ninety");

    /** Scale words indexed by power of 1000. */
    static final List<String> SCALES = List.of("", "thousand", "million", "billion", "trillion");

    /** Words that add their value to the running group (ones, teens, tens). */
    static final Map<String, Integer> ADDITIVE_WORDS = additiveWords();

    /** Scale words mapped to their magnitude. */
    static final Map<String, Long> SCALE_MAGNITUDES = Map.of(
            "thousand", 1_000L,
            "million", 1_000_000L,
            "billion", 1_000_000_000L,
            "trillion", 1_000_000_000_000L
    );

    private EnglishLexicon() {
        // Prevent instantiation
    }

    private static Map<String, Integer> additiveWords() {
        Map<String, Integer> words = new HashMap<>();
        for (int i = 1; i < ONES.size(); i++) {
            words.put(ONES.get(i), i);
        }
        for (int i = 0; i < TEENS.size(); i++) {
            words.put(TEENS.get(i), 10 + i);
        }
        for (int i = 2; i < TENS.size(); i++) {
            words.put(TENS.get(i), i * 10);
        }
        return Map.copyOf(words);
    }
}
