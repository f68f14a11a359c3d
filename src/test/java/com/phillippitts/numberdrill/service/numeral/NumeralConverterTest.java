package com.phillippitts.numberdrill.service.numeral;

import com.phillippitts.numberdrill.domain.Language;
import com.phillippitts.numberdrill.service.numeral.english.EnglishNumeralDecoder;
import com.phillippitts.numberdrill.service.numeral.english.EnglishNumeralEncoder;
import com.phillippitts.numberdrill.service.numeral.japanese.JapaneseNumeralDecoder;
import com.phillippitts.numberdrill.service.numeral.japanese.JapaneseNumeralEncoder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NumeralConverterTest {

    private final NumeralConverter converter = NumeralConverter.standard();

    @Test
    void roundTripsEveryValueUpToTenThousand() {
        for (Language language : Language.values()) {
            for (long value = 0; value <= 10_000; value++) {
                String spoken = converter.encodeSpoken(value, language);
                assertThat(converter.decode(spoken, language))
                        .as("%s '%s'", language, spoken)
                        .hasValue(value);
            }
        }
    }

    @Test
    void roundTripsRandomLargeValues() {
        Random random = new Random(42);
        for (Language language : Language.values()) {
            for (int i = 0; i < 2_000; i++) {
                long value = Math.floorMod(random.nextLong(), language.maxValue() + 1);
                String spoken = converter.encodeSpoken(value, language);
                assertThat(converter.decode(spoken, language))
                        .as("%s '%s'", language, spoken)
                        .hasValue(value);
            }
        }
    }

    @Test
    void roundTripsGroupedForms() {
        Random random = new Random(7);
        for (Language language : Language.values()) {
            for (int i = 0; i < 500; i++) {
                long value = Math.floorMod(random.nextLong(), language.maxValue() + 1);
                assertThat(converter.decode(converter.encodeGrouped(value, language), language))
                        .hasValue(value);
            }
        }
    }

    @Test
    void roundTripsLargestValues() {
        for (Language language : Language.values()) {
            long max = language.maxValue();
            assertThat(converter.decode(converter.encodeSpoken(max, language), language)).hasValue(max);
        }
    }

    @Test
    void dispatchesByLanguage() {
        assertThat(converter.encodeSpoken(3, Language.JAPANESE)).isEqualTo("さん");
        assertThat(converter.encodeSpoken(3, Language.ENGLISH)).isEqualTo("three");
        assertThat(converter.encodeGrouped(12_345, Language.JAPANESE)).isEqualTo("1万2345");
        assertThat(converter.encodeGrouped(12_345, Language.ENGLISH)).isEqualTo("12,345");
        assertThat(converter.decode("three", Language.JAPANESE)).isEmpty();
    }

    @Test
    void requiresCodecForEveryLanguage() {
        assertThatThrownBy(() -> new NumeralConverter(
                List.of(new JapaneseNumeralEncoder()),
                List.of(new JapaneseNumeralDecoder(), new EnglishNumeralDecoder())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ENGLISH");
    }

    @Test
    void rejectsDuplicateCodecs() {
        assertThatThrownBy(() -> new NumeralConverter(
                List.of(new JapaneseNumeralEncoder(), new EnglishNumeralEncoder(), new EnglishNumeralEncoder()),
                List.of(new JapaneseNumeralDecoder(), new EnglishNumeralDecoder())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void rejectsNullLanguage() {
        assertThatThrownBy(() -> converter.decode("one", null))
                .isInstanceOf(NullPointerException.class);
    }
}
