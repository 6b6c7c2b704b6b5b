package com.parcel.search.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class ToyEmbedderTest {

    @Test
    void producesStableUnitVectors() {
        ToyEmbedder embedder = new ToyEmbedder(768);

        List<Double> first = embedder.embed("pool homes");
        List<Double> second = embedder.embed("pool homes");

        assertThat(first).hasSize(768).isEqualTo(second);
        double norm = Math.sqrt(first.stream().mapToDouble(v -> v * v).sum());
        assertThat(norm).isCloseTo(1.0, within(1e-9));
        assertThat(embedder.embed("condo")).isNotEqualTo(first);
    }
}
