package com.phillippitts.numberdrill.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Tolerances for answer validation and feedback.
 */
@Validated
@ConfigurationProperties(prefix = "numeral.validation")
public class ValidationProperties {

    /** Minimum normalized similarity (0..1) for the fuzzy and variant tiers. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double fuzzyThreshold;

    /** Try spelling variants of Japanese answers when the fuzzy tier fails. */
    private final boolean variantMatchingEnabled;

    /** A wrong number within this percentage of the expected one is reported as very close. */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private final double veryClosePercent;

    @ConstructorBinding
    public ValidationProperties(Double fuzzyThreshold, Boolean variantMatchingEnabled, Double veryClosePercent) {
        double t = fuzzyThreshold == null ? 0.80 : fuzzyThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException("numeral.validation.fuzzy-threshold must be in [0,1]");
        }
        this.fuzzyThreshold = t;

        this.variantMatchingEnabled = variantMatchingEnabled == null || variantMatchingEnabled;

        double p = veryClosePercent == null ? 10.0 : veryClosePercent;
        if (p < 0.0 || p > 100.0) {
            throw new IllegalArgumentException("numeral.validation.very-close-percent must be in [0,100]");
        }
        this.veryClosePercent = p;
    }

    /** Properties with every default applied. */
    public static ValidationProperties defaults() {
        return new ValidationProperties(null, null, null);
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public boolean isVariantMatchingEnabled() {
        return variantMatchingEnabled;
    }

    public double getVeryClosePercent() {
        return veryClosePercent;
    }
}
