package com.phillippitts.numberdrill.config.properties;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationPropertiesTest {

    @Test
    void appliesDefaultsForMissingValues() {
        ValidationProperties props = ValidationProperties.defaults();

        assertThat(props.getFuzzyThreshold()).isEqualTo(0.80);
        assertThat(props.isVariantMatchingEnabled()).isTrue();
        assertThat(props.getVeryClosePercent()).isEqualTo(10.0);
    }

    @Test
    void keepsExplicitValues() {
        ValidationProperties props = new ValidationProperties(0.9, false, 5.0);

        assertThat(props.getFuzzyThreshold()).isEqualTo(0.9);
        assertThat(props.isVariantMatchingEnabled()).isFalse();
        assertThat(props.getVeryClosePercent()).isEqualTo(5.0);
    }

    @Test
    void acceptsBoundaryValues() {
        assertThat(new ValidationProperties(0.0, true, 0.0).getFuzzyThreshold()).isZero();
        assertThat(new ValidationProperties(1.0, true, 100.0).getVeryClosePercent()).isEqualTo(100.0);
    }

    @Test
    void rejectsThresholdOutsideUnitInterval() {
        assertThatThrownBy(() -> new ValidationProperties(1.5, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fuzzy-threshold");
        assertThatThrownBy(() -> new ValidationProperties(-0.1, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsPercentOutsideRange() {
        assertThatThrownBy(() -> new ValidationProperties(null, null, 101.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("very-close-percent");
    }
}
