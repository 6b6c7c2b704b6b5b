package com.parcel.search.embed;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic stand-in for a real model: a unit vector seeded from the SHA-256 of the text.
 * Useful for local runs without an embedding server; similarity carries no meaning.
 */
public class ToyEmbedder implements EmbeddingProvider {
    private final int dimension;

    public ToyEmbedder(int dimension) {
        this.dimension = Math.max(1, dimension);
    }

    @Override
    public List<Double> embed(String text) {
        if (text == null) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        Random random = new Random(stableSeed(text));
        double[] values = new double[dimension];
        double sumSquares = 0.0;
        for (int i = 0; i < dimension; i++) {
            double value = random.nextDouble();
            values[i] = value;
            sumSquares += value * value;
        }
        double norm = Math.sqrt(sumSquares);
        if (norm == 0.0) {
            norm = 1.0;
        }
        List<Double> vector = new ArrayList<>(dimension);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }

    private long stableSeed(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, 8).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
