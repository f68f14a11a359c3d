package com.phillippitts.numberdrill.service.metrics;

import com.phillippitts.numberdrill.domain.Language;
import com.phillippitts.numberdrill.domain.MatchMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Centralized metrics for numeral decoding and answer validation.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Validation verdicts per language and deciding tier</li>
 *   <li>Decode outcomes (parsed/unparsed) per language</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class NumeralMetrics {

    private static final String METRIC_PREFIX = "numberdrill";

    private final MeterRegistry registry;

    public NumeralMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one validated answer.
     *
     * @param language answer language
     * @param method   tier that decided the answer
     * @param correct  whether the answer was accepted
     */
    public void recordValidation(Language language, MatchMethod method, boolean correct) {
        Counter.builder(METRIC_PREFIX + ".validation.result")
                .description("Number of validated answers by language and match method")
                .tag("language", language.code())
                .tag("method", method.name().toLowerCase(Locale.ROOT))
                .tag("correct", Boolean.toString(correct))
                .register(registry)
                .increment();
    }

    /**
     * Counts one decode request.
     *
     * @param language text language
     * @param parsed   whether a number was found
     */
    public void recordDecode(Language language, boolean parsed) {
        Counter.builder(METRIC_PREFIX + ".decode.result")
                .description("Number of decode requests by language and outcome")
                .tag("language", language.code())
                .tag("outcome", parsed ? "parsed" : "unparsed")
                .register(registry)
                .increment();
    }
}
