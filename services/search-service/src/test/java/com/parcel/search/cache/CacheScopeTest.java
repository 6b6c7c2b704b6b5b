package com.parcel.search.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class CacheScopeTest {

    @Test
    void parsesEndpointScopes() {
        assertThat(CacheScope.parse(null)).isEqualTo(CacheScope.ALL);
        assertThat(CacheScope.parse("all")).isEqualTo(CacheScope.ALL);
        assertThat(CacheScope.parse("filters")).isEqualTo(CacheScope.FILTER_PLAN);
        assertThat(CacheScope.parse("Embeddings")).isEqualTo(CacheScope.EMBEDDING);
        assertThat(CacheScope.parse(" queries ")).isEqualTo(CacheScope.RESULT);
    }

    @Test
    void rejectsUnknownScope() {
        assertThatThrownBy(() -> CacheScope.parse("everything"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("everything");
    }
}
