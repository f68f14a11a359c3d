package com.phillippitts.numberdrill.service.validation;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Alternative spellings of a normalized Japanese answer for the variant tier.
 *
 * <p>Produces the whitespace forms of the answer plus the everyday contracted readings that
 * speech recognizers tend to emit (ろっぴゃく, はっぴゃく, はっせん, いっちょう) where the
 * encoder writes the literal digit reading.
 */
final class JapaneseSpellingVariants {

    private static final Map<String, String> CONTRACTIONS = contractions();

    private JapaneseSpellingVariants() {
        // Prevent instantiation
    }

    /**
     * @param normalized normalized correct answer
     * @return distinct variants in a stable order, the answer itself first
     */
    static List<String> of(String normalized) {
        Set<String> variants = new LinkedHashSet<>();
        variants.add(normalized);
        variants.add(TextNormalizer.removeWhitespace(normalized));
        variants.add(TextNormalizer.collapseWhitespace(normalized));
        variants.add(contract(normalized));
        return List.copyOf(variants);
    }

    static String contract(String text) {
        String result = text;
        for (Map.Entry<String, String> e : CONTRACTIONS.entrySet()) {
            result = result.replace(e.getKey(), e.getValue());
        }
        return result;
    }

    private static Map<String, String> contractions() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("ろくぴゃく", "ろっぴゃく");
        map.put("はちぴゃく", "はっぴゃく");
        map.put("はちせん", "はっせん");
        map.put("いちちょう", "いっちょう");
        map.put("はちちょう", "はっちょう");
        return map;
    }
}
