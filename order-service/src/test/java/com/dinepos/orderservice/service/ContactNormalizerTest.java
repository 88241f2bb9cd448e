package com.dinepos.orderservice.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContactNormalizerTest {

    @Test
    void normalize_KeepsTenDigitNumberUnchanged() {
        assertThat(ContactNormalizer.normalize("2345678901")).isEqualTo("2345678901");
    }

    @Test
    void normalize_IsIdempotent() {
        String once = ContactNormalizer.normalize("+1 (234) 567-8901");

        assertThat(ContactNormalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    void normalize_FormattedAndPlainNumbersMatch() {
        assertThat(ContactNormalizer.normalize("+1 (234) 567-8901"))
                .isEqualTo(ContactNormalizer.normalize("2345678901"))
                .isEqualTo("2345678901");
    }

    @Test
    void normalize_ShortNumberIsLeftPadded() {
        assertThat(ContactNormalizer.normalize("55-123")).isEqualTo("0000055123");
    }

    @Test
    void normalize_LongNumberKeepsLastTenDigits() {
        assertThat(ContactNormalizer.normalize("00971501234567")).isEqualTo("1501234567");
    }

    @Test
    void normalize_NoDigitsGivesZeros() {
        assertThat(ContactNormalizer.normalize("n/a")).isEqualTo("0000000000");
        assertThat(ContactNormalizer.normalize(null)).isEqualTo("0000000000");
    }
}
