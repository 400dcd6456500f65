package com.identity.resolution.api;

import com.identity.resolution.similarity.EditAlgorithm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResolutionConfigLoader Tests")
class ResolutionConfigLoaderTest {

    private final ResolutionConfigLoader loader = new ResolutionConfigLoader();

    private ResolutionConfig loadYaml(String yaml) {
        return loader.load(new StringReader(yaml));
    }

    @Test
    @DisplayName("Should load every section of a full document")
    void loadsFixture() throws Exception {
        ResolutionConfig config;
        try (InputStream in = getClass().getResourceAsStream("/resolution-config.yaml")) {
            assertNotNull(in);
            config = loader.load(in);
        }

        assertEquals("v2", config.getBlockingKeyVersion());
        assertEquals("minilm-l6", config.getEmbeddingModelId());
        assertEquals(Integer.valueOf(384), config.getEmbeddingDimension());
        assertEquals(0.55, config.getTLow());
        assertEquals(0.88, config.getTHigh());
        assertEquals(0.96, config.getCrossBlockAutoMergeThreshold());
        assertEquals(250, config.getMaxBlockSize());
        assertEquals(0.30, config.getWeights().embeddingWeight());
        assertEquals(EditAlgorithm.JARO_WINKLER, config.getEditAlgorithm());
        assertEquals(5, config.getKAnonymityK());
        assertEquals(2, config.getPlaceholderPatterns().size());
        assertTrue(config.placeholderMatcher().matches("Redacted 3"));
        assertEquals(2, config.getParallelism());
        assertEquals(1000, config.getParseCache().maxSize());
        assertTrue(config.getParseCache().enabled());
        // untouched keys keep their defaults
        assertEquals(ResolutionConfig.DEFAULT_TYPE_CONFLICT_CAP, config.getTypeConflictCap());
    }

    @Test
    @DisplayName("Should load from a file path")
    void loadsPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("config.yaml");
        Files.writeString(file, "tHigh: 0.93\nparseCache:\n  maxSize: 10\n  ttlSeconds: 5\n  enabled: false\n");

        ResolutionConfig config = loader.load(file);

        assertEquals(0.93, config.getTHigh());
        assertFalse(config.getParseCache().enabled());
    }

    @Test
    @DisplayName("Empty document yields defaults")
    void emptyDocument() {
        assertEquals(ResolutionConfig.defaults().fingerprint(), loadYaml("").fingerprint());
    }

    @Test
    @DisplayName("Should reject unknown keys")
    void unknownKey() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loadYaml("tMedium: 0.7\n"));
        assertTrue(e.getMessage().contains("tMedium"));
    }

    @Test
    @DisplayName("Should reject wrongly typed values")
    void wrongTypes() {
        assertThrows(ConfigurationException.class, () -> loadYaml("tLow: high\n"));
        assertThrows(ConfigurationException.class, () -> loadYaml("maxBlockSize: 2.5\n"));
        assertThrows(ConfigurationException.class, () -> loadYaml("placeholderPatterns: redacted\n"));
    }

    @Test
    @DisplayName("Should reject incomplete weights")
    void incompleteWeights() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> loadYaml("weights:\n  phonetic: 0.5\n  edit: 0.5\n"));
        assertTrue(e.getMessage().contains("weights.embedding"));
    }

    @Test
    @DisplayName("Semantic errors surface as ConfigurationException")
    void semanticErrors() {
        assertThrows(ConfigurationException.class, () -> loadYaml("tLow: 0.95\ntHigh: 0.9\n"));
        assertThrows(ConfigurationException.class, () -> loadYaml("editAlgorithm: soundex\n"));
    }

    @Test
    @DisplayName("Missing file surfaces as ConfigurationException")
    void missingFile(@TempDir Path dir) {
        assertThrows(ConfigurationException.class, () -> loader.load(dir.resolve("absent.yaml")));
    }
}
