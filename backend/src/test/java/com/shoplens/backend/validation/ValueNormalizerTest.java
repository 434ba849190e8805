package com.shoplens.backend.validation;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

import static com.shoplens.backend.validation.FieldCorrespondence.ValueType.NUMBER;
import static com.shoplens.backend.validation.FieldCorrespondence.ValueType.TEXT;
import static org.assertj.core.api.Assertions.assertThat;

class ValueNormalizerTest {

    @Test
    void shouldStripCurrencyAndSeparators() {
        assertThat(ValueNormalizer.toNumber("¥4,562")).isEqualByComparingTo("4562");
        assertThat(ValueNormalizer.toNumber("4 562 円")).isEqualByComparingTo("4562");
        assertThat(ValueNormalizer.toNumber("1,200pt")).isEqualByComparingTo("1200");
        assertThat(ValueNormalizer.toNumber(new BigDecimal("4562.00"))).isEqualByComparingTo("4562");
    }

    @Test
    void shouldReturnNullForNonNumbers() {
        assertThat(ValueNormalizer.toNumber("N/A")).isNull();
        assertThat(ValueNormalizer.toNumber("円")).isNull();
        assertThat(ValueNormalizer.toNumber(null)).isNull();
    }

    @Test
    void shouldTreatNonFiniteDoublesAsNonNumbers() {
        assertThat(ValueNormalizer.toNumber(Double.NaN)).isNull();
        assertThat(ValueNormalizer.toNumber(Double.POSITIVE_INFINITY)).isNull();
        assertThat(ValueNormalizer.toNumber(Float.NEGATIVE_INFINITY)).isNull();
        assertThat(ValueNormalizer.sameValue(4562, Double.NaN, NUMBER)).isFalse();
    }

    @Test
    void shouldCompareNumbersExactlyWithoutTolerance() {
        assertThat(ValueNormalizer.sameValue(4562, "4,562", NUMBER)).isTrue();
        assertThat(ValueNormalizer.sameValue(4562, 4561, NUMBER)).isFalse();
        assertThat(ValueNormalizer.sameValue(4.5, "4.50", NUMBER)).isTrue();
    }

    @Test
    void shouldFallBackToTextWhenNumberDoesNotParse() {
        assertThat(ValueNormalizer.sameValue("N/A", " N/A ", NUMBER)).isTrue();
        assertThat(ValueNormalizer.sameValue("N/A", 0, NUMBER)).isFalse();
    }

    @Test
    void shouldCollapseWhitespaceInText() {
        assertThat(ValueNormalizer.toText("  a \t b\n c ")).isEqualTo("a b c");
        assertThat(ValueNormalizer.sameValue("Serum  50ml", "Serum 50ml", TEXT)).isTrue();
        assertThat(ValueNormalizer.sameValue("Serum", null, TEXT)).isFalse();
    }
}
