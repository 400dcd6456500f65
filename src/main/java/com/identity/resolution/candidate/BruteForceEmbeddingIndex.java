package com.identity.resolution.candidate;

import com.identity.resolution.core.model.IdentityMention;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Exact top-k cosine search by linear scan. Only mentions with an embedding and a
 * non-zero parse confidence are indexed; vectors are L2-normalized once at build time.
 * Immutable after construction and safe to query from several threads.
 */
public class BruteForceEmbeddingIndex implements EmbeddingIndex {

    private static final Comparator<EmbeddingIndex.Neighbour> BEST_FIRST =
            Comparator.comparingDouble(EmbeddingIndex.Neighbour::similarity).reversed()
                    .thenComparing(EmbeddingIndex.Neighbour::mentionId);

    private final List<String> ids;
    private final List<float[]> unitVectors;

    public BruteForceEmbeddingIndex(Collection<IdentityMention> mentions) {
        List<IdentityMention> sorted = new ArrayList<>();
        for (IdentityMention m : mentions) {
            if (m.hasEmbedding() && !m.isParseFailure()) {
                sorted.add(m);
            }
        }
        sorted.sort(Comparator.comparing(IdentityMention::getMentionId));

        this.ids = new ArrayList<>(sorted.size());
        this.unitVectors = new ArrayList<>(sorted.size());
        for (IdentityMention m : sorted) {
            ids.add(m.getMentionId());
            unitVectors.add(normalize(m.getEmbedding()));
        }
    }

    @Override
    public List<EmbeddingIndex.Neighbour> nearest(IdentityMention query, int k, double minSimilarity) {
        if (!query.hasEmbedding() || k <= 0) {
            return List.of();
        }
        float[] q = normalize(query.getEmbedding());

        // Min-heap of the current best k: the root is the weakest kept neighbour.
        PriorityQueue<EmbeddingIndex.Neighbour> best = new PriorityQueue<>(k + 1, BEST_FIRST.reversed());
        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i);
            float[] v = unitVectors.get(i);
            if (id.equals(query.getMentionId()) || v.length != q.length) {
                continue;
            }
            double similarity = dot(q, v);
            if (similarity < minSimilarity) {
                continue;
            }
            best.offer(new EmbeddingIndex.Neighbour(id, similarity));
            if (best.size() > k) {
                best.poll();
            }
        }

        List<EmbeddingIndex.Neighbour> result = new ArrayList<>(best);
        result.sort(BEST_FIRST);
        return result;
    }

    @Override
    public int size() {
        return ids.size();
    }

    private static float[] normalize(float[] vector) {
        double norm = 0.0;
        for (float f : vector) {
            norm += (double) f * f;
        }
        norm = Math.sqrt(norm);
        float[] unit = new float[vector.length];
        if (norm == 0.0) {
            return unit;
        }
        for (int i = 0; i < vector.length; i++) {
            unit[i] = (float) (vector[i] / norm);
        }
        return unit;
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }
}
