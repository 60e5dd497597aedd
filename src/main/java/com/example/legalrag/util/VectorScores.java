package com.example.legalrag.util;

import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public final class VectorScores {

    private VectorScores() {}

    /** pgvector's {@code <=>} yields 1 - cosine similarity, so the similarity is 1 - distance. */
    public static double similarityFromDistance(double distance) {
        return 1 - distance;
    }

    /**
     * Converts a vector of floats into a literal accepted by the PostgreSQL vector type
     * (e.g. [0.12340000,0.00001230,...]), using Locale.US so the decimal separator is a dot.
     */
    public static String toPgVectorLiteral(float[] v) {
        return IntStream.range(0, v.length)
            .mapToObj(i -> String.format(Locale.US, "%.8f", v[i]))
            .collect(Collectors.joining(",", "[", "]"));
    }
}
