package com.identity.resolution.candidate;

import com.identity.resolution.core.model.IdentityMention;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.identity.resolution.MentionFixtures.mention;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BruteForceEmbeddingIndex Tests")
class BruteForceEmbeddingIndexTest {

    private final IdentityMention query = mention("q", "Jeffrey Epstein", new float[]{1f, 0f});

    @Test
    @DisplayName("Should return neighbours best first, excluding the query")
    void orderedNeighbours() {
        EmbeddingIndex index = new BruteForceEmbeddingIndex(List.of(
                query,
                mention("a", "Leon Black", new float[]{0f, 1f}),
                mention("b", "Ghislaine Maxwell", new float[]{3f, 1f}),
                mention("c", "Les Wexner", new float[]{2f, 0f})));

        List<EmbeddingIndex.Neighbour> result = index.nearest(query, 5, -1.0);

        assertEquals(List.of("c", "b", "a"), result.stream().map(EmbeddingIndex.Neighbour::mentionId).toList());
        assertEquals(1.0, result.get(0).similarity(), 1e-6);
        assertEquals(4, index.size());
    }

    @Test
    @DisplayName("Ties are broken by mention id")
    void tieBreak() {
        EmbeddingIndex index = new BruteForceEmbeddingIndex(List.of(
                query,
                mention("z", "Leon Black", new float[]{5f, 0f}),
                mention("y", "Les Wexner", new float[]{2f, 0f})));

        assertEquals(List.of("y", "z"),
                index.nearest(query, 2, 0.0).stream().map(EmbeddingIndex.Neighbour::mentionId).toList());
    }

    @Test
    @DisplayName("Should honour k and the similarity floor")
    void limits() {
        EmbeddingIndex index = new BruteForceEmbeddingIndex(List.of(
                query,
                mention("a", "Leon Black", new float[]{0f, 1f}),
                mention("b", "Ghislaine Maxwell", new float[]{3f, 1f}),
                mention("c", "Les Wexner", new float[]{2f, 0f})));

        assertEquals(1, index.nearest(query, 1, -1.0).size());
        assertEquals(2, index.nearest(query, 5, 0.5).size());
        assertTrue(index.nearest(query, 0, 0.0).isEmpty());
    }

    @Test
    @DisplayName("Parse failures, missing embeddings and other dimensions are skipped")
    void skipsIneligible() {
        EmbeddingIndex index = new BruteForceEmbeddingIndex(List.of(
                query,
                mention("fail", "?", new float[]{1f, 0f}),
                mention("none", "Leon Black"),
                mention("3d", "Les Wexner", new float[]{1f, 0f, 0f})));

        assertEquals(2, index.size());
        assertTrue(index.nearest(query, 5, -1.0).isEmpty());
        assertTrue(index.nearest(mention("x", "Leon Black"), 5, -1.0).isEmpty());
    }
}
