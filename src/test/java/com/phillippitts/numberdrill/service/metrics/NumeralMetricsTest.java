package com.phillippitts.numberdrill.service.metrics;

import com.phillippitts.numberdrill.domain.Language;
import com.phillippitts.numberdrill.domain.MatchMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NumeralMetricsTest {

    private MeterRegistry registry;
    private NumeralMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new NumeralMetrics(registry);
    }

    @Test
    void shouldCountValidationsByLanguageAndMethod() {
        metrics.recordValidation(Language.JAPANESE, MatchMethod.NUMERIC, true);
        metrics.recordValidation(Language.JAPANESE, MatchMethod.NUMERIC, true);
        metrics.recordValidation(Language.ENGLISH, MatchMethod.REJECTED, false);

        Counter numeric = registry.find("numberdrill.validation.result")
                .tag("language", "ja")
                .tag("method", "numeric")
                .tag("correct", "true")
                .counter();
        Counter rejected = registry.find("numberdrill.validation.result")
                .tag("language", "en")
                .tag("method", "rejected")
                .tag("correct", "false")
                .counter();

        assertThat(numeric).isNotNull();
        assertThat(numeric.count()).isEqualTo(2.0);
        assertThat(rejected).isNotNull();
        assertThat(rejected.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountDecodeOutcomes() {
        metrics.recordDecode(Language.ENGLISH, true);
        metrics.recordDecode(Language.ENGLISH, false);
        metrics.recordDecode(Language.ENGLISH, false);

        Counter unparsed = registry.find("numberdrill.decode.result")
                .tag("language", "en")
                .tag("outcome", "unparsed")
                .counter();

        assertThat(unparsed).isNotNull();
        assertThat(unparsed.count()).isEqualTo(2.0);
        assertThat(registry.find("numberdrill.decode.result").tag("outcome", "parsed").counter().count())
                .isEqualTo(1.0);
    }
}
