package com.parcel.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.parcel.search.filter.FilterParser;
import com.parcel.search.filter.FilterPlan;
import com.parcel.search.opensearch.OpenSearchProperties;
import org.junit.jupiter.api.Test;

class EngineQueryFactoryTest {

    private final EngineQueryFactory factory =
        new EngineQueryFactory(new SearchProperties(), new OpenSearchProperties());

    @Test
    void offsetFollowsPageAndSize() {
        FilterPlan plan = new FilterParser().parse("3 bed in Austin");

        assertThat(factory.keywordOnly(plan, 1, 20).getFrom()).isZero();
        assertThat(factory.keywordOnly(plan, 4, 25).getFrom()).isEqualTo(75);
        assertThat(factory.keywordOnly(plan, 20_000_001, 100).getFrom()).isEqualTo(2_000_000_000);
    }

    @Test
    void offsetBeyondIntRangeIsRejected() {
        assertThatThrownBy(() -> EngineQueryFactory.offset(30_000_000, 100))
            .isInstanceOf(ArithmeticException.class);
    }
}
