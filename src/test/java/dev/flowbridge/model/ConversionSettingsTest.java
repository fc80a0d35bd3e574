package dev.flowbridge.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversionSettingsTest {

    @Test
    void rejectsInconsistentThresholds() {
        assertThatThrownBy(() -> new ConversionSettings(90, 15, 60, 75, 60, 70, 70, 85, 5, 250, 150))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unattendedThreshold");
        assertThatThrownBy(() -> new ConversionSettings(90, 15, 75, 75, 60, 70, 80, 85, 5, 250, 150))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("scriptConfidence");
        assertThat(ConversionSettings.defaults().withUnattendedThreshold(90).unattendedThreshold()).isEqualTo(90);
    }

    @Test
    void defaultsMatchDocumentedValues() {
        ConversionSettings settings = ConversionSettings.defaults();

        assertThat(settings.unattendedThreshold()).isEqualTo(80);
        assertThat(settings.manualReviewCeiling()).isEqualTo(70);
        assertThat(settings.patternMinimumConfidence()).isEqualTo(85);
        assertThat(settings.maxRetryCount()).isEqualTo(5);
    }
}
