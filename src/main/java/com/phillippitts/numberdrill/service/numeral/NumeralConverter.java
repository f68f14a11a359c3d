package com.phillippitts.numberdrill.service.numeral;

import com.phillippitts.numberdrill.domain.Language;
import com.phillippitts.numberdrill.service.numeral.english.EnglishNumeralDecoder;
import com.phillippitts.numberdrill.service.numeral.english.EnglishNumeralEncoder;
import com.phillippitts.numberdrill.service.numeral.japanese.JapaneseNumeralDecoder;
import com.phillippitts.numberdrill.service.numeral.japanese.JapaneseNumeralEncoder;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Language-dispatching entry point for numeral encoding and decoding.
 *
 * <p>Collects one {@link NumeralEncoder} and one {@link NumeralDecoder} per {@link Language}
 * and routes each call by language. Stateless after construction and safe for concurrent use.
 */
@Component
public class NumeralConverter {

    private final Map<Language, NumeralEncoder> encoders;
    private final Map<Language, NumeralDecoder> decoders;

    /**
     * @param encoders one encoder per supported language
     * @param decoders one decoder per supported language
     * @throws IllegalStateException if a language has no encoder or decoder, or has two
     */
    public NumeralConverter(List<NumeralEncoder> encoders, List<NumeralDecoder> decoders) {
        this.encoders = new EnumMap<>(Language.class);
        for (NumeralEncoder encoder : encoders) {
            if (this.encoders.put(encoder.language(), encoder) != null) {
                throw new IllegalStateException("Duplicate numeral encoder for " + encoder.language());
            }
        }
        this.decoders = new EnumMap<>(Language.class);
        for (NumeralDecoder decoder : decoders) {
            if (this.decoders.put(decoder.language(), decoder) != null) {
                throw new IllegalStateException("Duplicate numeral decoder for " + decoder.language());
            }
        }
        for (Language language : Language.values()) {
            if (!this.encoders.containsKey(language) || !this.decoders.containsKey(language)) {
                throw new IllegalStateException("Missing numeral encoder or decoder for " + language);
            }
        }
    }

    /**
     * Creates a converter wired with the built-in Japanese and English codecs.
     */
    public static NumeralConverter standard() {
        return new NumeralConverter(
                List.of(new JapaneseNumeralEncoder(), new EnglishNumeralEncoder()),
                List.of(new JapaneseNumeralDecoder(), new EnglishNumeralDecoder()));
    }

    /** @see NumeralEncoder#encodeSpoken(long) */
    public String encodeSpoken(long value, Language language) {
        return encoder(language).encodeSpoken(value);
    }

    /** @see NumeralEncoder#encodeGrouped(long) */
    public String encodeGrouped(long value, Language language) {
        return encoder(language).encodeGrouped(value);
    }

    /** @see NumeralDecoder#decode(String) */
    public OptionalLong decode(String text, Language language) {
        return decoders.get(Objects.requireNonNull(language, "language")).decode(text);
    }

    private NumeralEncoder encoder(Language language) {
        return encoders.get(Objects.requireNonNull(language, "language"));
    }
}
