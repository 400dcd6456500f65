package com.identity.resolution.candidate;

import com.identity.resolution.core.model.IdentityMention;

import java.util.List;

/**
 * Nearest-neighbour search over mention embeddings, used for cross-block recall.
 * Implementations must be deterministic: ties in similarity are broken by mention id.
 */
public interface EmbeddingIndex {

    /**
     * Finds the closest indexed mentions to the query, excluding the query itself.
     *
     * @param query         the mention to search around; must carry an embedding
     * @param k             maximum number of neighbours
     * @param minSimilarity minimum raw cosine similarity (-1..1) a neighbour must reach
     * @return neighbours ordered by similarity descending, then mention id ascending
     */
    List<Neighbour> nearest(IdentityMention query, int k, double minSimilarity);

    int size();

    /**
     * @param mentionId  the neighbour's mention id
     * @param similarity raw cosine similarity
     */
    record Neighbour(String mentionId, double similarity) {
    }
}
