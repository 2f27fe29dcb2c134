package com.bulkops.service.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SensitiveDataDetectorTest {

    private final SensitiveDataDetector detector = new SensitiveDataDetector();

    @Test
    @DisplayName("Should classify social security numbers")
    void shouldDetectSsn() {
        assertThat(detector.classify("SSN 123-45-6789 on file")).contains("SSN");
        assertThat(detector.classify("000-45-6789")).isEmpty();
    }

    @Test
    @DisplayName("Should classify Luhn-valid card numbers, grouped or not")
    void shouldDetectCardNumbers() {
        assertThat(detector.classify("4111111111111111")).contains("CARD_NUMBER");
        assertThat(detector.classify("4111 1111 1111 1111")).contains("CARD_NUMBER");
        assertThat(detector.classify("4111111111111112")).isEmpty();
    }

    @Test
    @DisplayName("Should ignore phone numbers, ids and non-text values")
    void shouldIgnoreOrdinaryValues() {
        assertThat(detector.isSensitive("(555) 012-3456")).isFalse();
        assertThat(detector.isSensitive("wid000000000001")).isFalse();
        assertThat(detector.isSensitive(4111111111111111L)).isFalse();
        assertThat(detector.isSensitive(null)).isFalse();
    }

    @Test
    void passesLuhn_matchesKnownValues() {
        assertThat(SensitiveDataDetector.passesLuhn("79927398713")).isTrue();
        assertThat(SensitiveDataDetector.passesLuhn("79927398710")).isFalse();
    }
}
