package com.identity.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdentityMention")
class IdentityMentionTest {

    private static IdentityMention.Builder base(String id) {
        return IdentityMention.builder()
                .mentionId(id)
                .sourceReference(SourceReference.of("flight_logs", id))
                .rawName("Jeffrey Epstein")
                .parsed(ParsedName.person("Jeffrey", null, "Epstein"))
                .parseType(ParseType.PERSON)
                .parseConfidence(0.9)
                .blockingKey("E123|j")
                .comparisonName("jeffrey epstein");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Should reject confidence outside [0,1]")
        void rejectsConfidenceOutOfRange() {
            assertThrows(IllegalArgumentException.class, () -> base("m1").parseConfidence(1.5).build());
            assertThrows(IllegalArgumentException.class, () -> base("m1").parseConfidence(-0.1).build());
        }

        @Test
        @DisplayName("Should require a source reference")
        void requiresSourceReference() {
            assertThrows(NullPointerException.class, () -> base("m1").sourceReference(null).build());
        }

        @Test
        @DisplayName("Zero confidence marks a parse failure")
        void parseFailure() {
            IdentityMention m = base("m1").parseConfidence(0.0).blockingKey("").build();
            assertTrue(m.isParseFailure());
            assertTrue(m.isUnblockable());
        }

        @Test
        @DisplayName("Embedding is defensively copied")
        void embeddingCopied() {
            float[] vector = {1f, 2f};
            IdentityMention m = base("m1").embedding(vector).build();
            vector[0] = 9f;
            assertEquals(1f, m.getEmbedding()[0]);
            assertEquals(2, m.embeddingDimension());
        }
    }

    @Nested
    @DisplayName("Embedding cosine")
    class EmbeddingCosine {

        @Test
        @DisplayName("Identical directions map to 1, orthogonal to 0.5, opposite to 0")
        void mapsToUnitInterval() {
            IdentityMention a = base("a").embedding(new float[]{1f, 0f}).build();
            IdentityMention same = base("b").embedding(new float[]{2f, 0f}).build();
            IdentityMention orthogonal = base("c").embedding(new float[]{0f, 1f}).build();
            IdentityMention opposite = base("d").embedding(new float[]{-1f, 0f}).build();

            assertEquals(1.0, a.embeddingCosine(same), 1e-6);
            assertEquals(0.5, a.embeddingCosine(orthogonal), 1e-6);
            assertEquals(0.0, a.embeddingCosine(opposite), 1e-6);
        }

        @Test
        @DisplayName("Missing or mismatched embeddings yield no signal")
        void absentSignal() {
            IdentityMention a = base("a").embedding(new float[]{1f, 0f}).build();
            IdentityMention none = base("b").build();
            IdentityMention longer = base("c").embedding(new float[]{1f, 0f, 0f}).build();

            assertNull(a.embeddingCosine(none));
            assertNull(a.embeddingCosine(longer));
        }
    }

    @Test
    @DisplayName("Equality is by mention id")
    void equalityById() {
        assertEquals(base("m1").build(), base("m1").rawName("Other").build());
        assertNotEquals(base("m1").build(), base("m2").build());
    }
}
