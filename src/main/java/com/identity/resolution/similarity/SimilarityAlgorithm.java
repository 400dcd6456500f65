package com.identity.resolution.similarity;

/**
 * String similarity measure over normalized names.
 * Implementations return a score between 0.0 (no similarity) and 1.0 (identical)
 * and must be stateless.
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
