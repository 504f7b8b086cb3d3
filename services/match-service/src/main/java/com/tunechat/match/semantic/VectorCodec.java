package com.tunechat.match.semantic;

import java.util.List;

/**
 * The one place where provider vectors and storage-format vector literals are converted to and
 * from {@code float[]}. Nothing past this boundary sees untyped vectors.
 */
public final class VectorCodec {
    private VectorCodec() {
    }

    public static float[] fromProvider(List<Double> values, int expectedDimension) {
        if (values == null || values.isEmpty()) {
            throw new InvalidVectorException("vector_empty");
        }
        if (expectedDimension > 0 && values.size() != expectedDimension) {
            throw new InvalidVectorException(
                "vector_dimension_mismatch got=" + values.size() + " expected=" + expectedDimension
            );
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            Double value = values.get(i);
            if (value == null || !Double.isFinite(value)) {
                throw new InvalidVectorException("vector_non_finite index=" + i);
            }
            vector[i] = value.floatValue();
        }
        return vector;
    }

    /**
     * Parses a pgvector text literal such as {@code [0.1,0.2,0.3]}. Returns null for null input.
     */
    public static float[] parseLiteral(String literal) {
        if (literal == null) {
            return null;
        }
        String trimmed = literal.trim();
        if (trimmed.length() < 2 || trimmed.charAt(0) != '[' || trimmed.charAt(trimmed.length() - 1) != ']') {
            throw new InvalidVectorException("vector_literal_malformed");
        }
        String body = trimmed.substring(1, trimmed.length() - 1).trim();
        if (body.isEmpty()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                vector[i] = Float.parseFloat(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new InvalidVectorException("vector_literal_malformed index=" + i, e);
            }
            if (!Float.isFinite(vector[i])) {
                throw new InvalidVectorException("vector_non_finite index=" + i);
            }
        }
        return vector;
    }

    public static String toLiteral(float[] vector) {
        StringBuilder builder = new StringBuilder(vector.length * 10 + 2);
        builder.append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(vector[i]);
        }
        return builder.append(']').toString();
    }
}
