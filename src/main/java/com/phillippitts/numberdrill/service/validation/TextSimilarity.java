package com.phillippitts.numberdrill.service.validation;

/**
 * Edit-distance based string similarity.
 *
 * <p>similarity = 1 - levenshtein(a, b) / max(len(a), len(b)), and 1.0 when both are empty.
 * Lengths and distances count Unicode code points, not UTF-16 units.
 */
public final class TextSimilarity {

    private TextSimilarity() {
        // Prevent instantiation
    }

    /**
     * @return similarity in [0,1]
     */
    public static double similarity(String a, String b) {
        int[] left = a.codePoints().toArray();
        int[] right = b.codePoints().toArray();
        int maxLength = Math.max(left.length, right.length);
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(left, right) / maxLength;
    }

    /**
     * Classic Levenshtein distance (insert, delete, substitute all cost 1).
     */
    public static int distance(String a, String b) {
        return levenshtein(a.codePoints().toArray(), b.codePoints().toArray());
    }

    private static int levenshtein(int[] a, int[] b) {
        int[] previous = new int[b.length + 1];
        int[] current = new int[b.length + 1];
        for (int j = 0; j <= b.length; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length; i++) {
            current[0] = i;
            for (int j = 1; j <= b.length; j++) {
                int cost = a[i - 1] == b[j - 1] ? 0 : 1;
                current[j] = Math.min(
                        Math.min(current[j - 1] + 1, previous[j] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length];
    }
}
