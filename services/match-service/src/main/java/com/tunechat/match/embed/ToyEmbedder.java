package com.tunechat.match.embed;

import com.tunechat.match.cache.CacheKeyUtil;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Deterministic local embedder for development and tests. Each word is hashed into a signed
 * bucket so texts sharing words land close to each other under cosine similarity.
 */
public class ToyEmbedder {
    private final int dimension;

    public ToyEmbedder(EmbeddingProperties properties) {
        this.dimension = Math.max(8, properties.getDimension());
    }

    public List<Double> embed(String text) {
        double[] values = new double[dimension];
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        int used = 0;
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            ByteBuffer hash = ByteBuffer.wrap(CacheKeyUtil.sha256(token));
            int bucket = Math.floorMod(hash.getInt(), dimension);
            double sign = hash.get() >= 0 ? 1.0 : -1.0;
            values[bucket] += sign;
            used++;
        }
        if (used == 0) {
            Random random = new Random(ByteBuffer.wrap(CacheKeyUtil.sha256(text)).getLong());
            for (int i = 0; i < dimension; i++) {
                values[i] = random.nextDouble() - 0.5;
            }
        }
        return normalize(values);
    }

    public int getDimension() {
        return dimension;
    }

    private List<Double> normalize(double[] values) {
        double sumSquares = 0.0;
        for (double value : values) {
            sumSquares += value * value;
        }
        double norm = sumSquares == 0.0 ? 1.0 : Math.sqrt(sumSquares);
        List<Double> vector = new ArrayList<>(values.length);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }
}
