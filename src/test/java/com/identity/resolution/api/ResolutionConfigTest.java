package com.identity.resolution.api;

import com.identity.resolution.cache.CacheConfig;
import com.identity.resolution.similarity.EditAlgorithm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResolutionConfig Tests")
class ResolutionConfigTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void defaults() {
        ResolutionConfig config = ResolutionConfig.defaults();

        assertEquals(0.60, config.getTLow());
        assertEquals(0.90, config.getTHigh());
        assertEquals(0.95, config.getCrossBlockAutoMergeThreshold());
        assertEquals(0.40, config.getTypeConflictCap());
        assertEquals(0.75, config.getLowConfidenceCap());
        assertEquals(500, config.getMaxBlockSize());
        assertEquals(3, config.getKAnonymityK());
        assertEquals("v1", config.getBlockingKeyVersion());
        assertEquals(EditAlgorithm.LEVENSHTEIN, config.getEditAlgorithm());
        assertNull(config.getEmbeddingModelId());
        assertNull(config.getEmbeddingDimension());
        assertTrue(config.getParallelism() >= 1);
    }

    @Nested
    @DisplayName("Fail-fast validation")
    class Validation {

        @Test
        @DisplayName("Should reject unknown blocking key versions")
        void unknownVersion() {
            assertThrows(ConfigurationException.class, () -> ResolutionConfig.builder().blockingKeyVersion("v7").build());
        }

        @Test
        @DisplayName("Should reject tLow above tHigh")
        void thresholdOrder() {
            assertThrows(ConfigurationException.class, () -> ResolutionConfig.builder().tLow(0.95).tHigh(0.9).build());
        }

        @Test
        @DisplayName("Should reject a cross-block threshold below tHigh")
        void crossBlockThreshold() {
            assertThrows(ConfigurationException.class,
                    () -> ResolutionConfig.builder().crossBlockAutoMergeThreshold(0.85).build());
        }

        @Test
        @DisplayName("Should reject values outside [0,1]")
        void unitRange() {
            assertThrows(ConfigurationException.class, () -> ResolutionConfig.builder().tHigh(1.2).build());
            assertThrows(ConfigurationException.class, () -> ResolutionConfig.builder().typeConflictCap(-0.1).build());
            assertThrows(ConfigurationException.class,
                    () -> ResolutionConfig.builder().embeddingMinSimilarity(1.5).build());
        }

        @Test
        @DisplayName("Should reject weights that do not sum to one")
        void weights() {
            assertThrows(ConfigurationException.class, () -> ResolutionConfig.builder().weights(0.5, 0.5, 0.5));
        }

        @Test
        @DisplayName("Should reject bad integers")
        void integers() {
            assertThrows(ConfigurationException.class, () -> ResolutionConfig.builder().maxBlockSize(1).build());
            assertThrows(ConfigurationException.class, () -> ResolutionConfig.builder().kAnonymityK(0).build());
            assertThrows(ConfigurationException.class, () -> ResolutionConfig.builder().parallelism(0).build());
            assertThrows(ConfigurationException.class, () -> ResolutionConfig.builder().embeddingDimension(0).build());
        }

        @Test
        @DisplayName("Should reject invalid placeholder patterns")
        void patterns() {
            assertThrows(ConfigurationException.class,
                    () -> ResolutionConfig.builder().placeholderPatterns(List.of("(unclosed")).build());
            assertThrows(ConfigurationException.class,
                    () -> ResolutionConfig.builder().placeholderPatterns(Arrays.asList("ok", null)).build());
        }
    }

    @Nested
    @DisplayName("Fingerprint")
    class Fingerprint {

        @Test
        @DisplayName("Equal partition settings give equal fingerprints")
        void stable() {
            ResolutionConfig a = ResolutionConfig.builder().parallelism(1).reportExampleLimit(5).build();
            ResolutionConfig b = ResolutionConfig.builder().parallelism(8)
                    .parseCache(CacheConfig.disabled()).build();

            assertEquals(a.fingerprint(), b.fingerprint());
            assertEquals(64, a.fingerprint().length());
        }

        @Test
        @DisplayName("Threshold changes alter the fingerprint")
        void changes() {
            assertNotEquals(ResolutionConfig.defaults().fingerprint(),
                    ResolutionConfig.builder().tHigh(0.92).build().fingerprint());
            assertNotEquals(ResolutionConfig.defaults().fingerprint(),
                    ResolutionConfig.builder().blockingKeyVersion("v2").build().fingerprint());
        }
    }

    @Test
    @DisplayName("Candidate settings are derived from the config")
    void candidateSettings() {
        ResolutionConfig config = ResolutionConfig.builder().maxBlockSize(100).embeddingTopK(0).build();
        assertEquals(100, config.toCandidateSettings().maxBlockSize());
        assertEquals(0, config.toCandidateSettings().embeddingTopK());
        assertTrue(config.placeholderMatcher().matches("Female (1)"));
    }
}
