package com.parcel.search.filter;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ValueBoundExtractorTest {

    @Test
    void thousandsSuffixScalesSmallValues() {
        assertThat(ValueBoundExtractor.parseAmount("500", true)).isEqualTo(500_000L);
        assertThat(ValueBoundExtractor.parseAmount("9999", true)).isEqualTo(9_999_000L);
    }

    @Test
    void thousandsSuffixLeavesLargeValuesAlone() {
        assertThat(ValueBoundExtractor.parseAmount("10000", true)).isEqualTo(10_000L);
        assertThat(ValueBoundExtractor.parseAmount("500000", true)).isEqualTo(500_000L);
    }

    @Test
    void separatorsAreStripped() {
        assertThat(ValueBoundExtractor.parseAmount("450,000", false)).isEqualTo(450_000L);
        assertThat(ValueBoundExtractor.parseAmount(",,,", false)).isNull();
    }

    @Test
    void dollarSignAndSpacingAreAccepted() {
        FilterPlan.Builder builder = FilterPlan.builder();
        ValueBoundExtractor.upper().extract(ParseInput.of("less than $ 300k please"), builder);

        assertThat(builder.build().getFilter()).containsExactly(new Condition.NestedRange(
            PropertyFields.TAX_ASSESSMENT_PATH, PropertyFields.ASSESSED_VALUE, BoundKind.LTE, 300_000L));
    }
}
