package com.identity.resolution.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.identity.resolution.cache.CacheConfig;
import com.identity.resolution.similarity.EditAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a {@link ResolutionConfig} from a YAML document. Keys not present keep their defaults;
 * unknown keys and malformed values are rejected.
 *
 * <pre>
 * blockingKeyVersion: v1
 * tLow: 0.60
 * tHigh: 0.90
 * weights:
 *   phonetic: 0.25
 *   edit: 0.50
 *   embedding: 0.25
 * parseCache:
 *   maxSize: 50000
 *   ttlSeconds: 3600
 *   enabled: true
 * </pre>
 */
public class ResolutionConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ResolutionConfigLoader.class);

    private static final Set<String> KNOWN_KEYS = Set.of(
            "blockingKeyVersion", "embeddingModelId", "embeddingDimension", "tLow", "tHigh",
            "crossBlockAutoMergeThreshold", "typeConflictCap", "lowConfidenceCap", "maxBlockSize",
            "publicDisclosureFloor", "weights", "editAlgorithm", "embeddingTopK",
            "embeddingConfidenceFloor", "embeddingMinSimilarity", "kAnonymityK",
            "kAnonymityConfidenceFloor", "placeholderPatterns", "parallelism", "reportExampleLimit",
            "parseCache");

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public ResolutionConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            ResolutionConfig config = load(in);
            log.info("config.loaded path={} fingerprint={}", path, config.fingerprint());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + path + ": " + e.getMessage(), e);
        }
    }

    public ResolutionConfig load(InputStream in) {
        try {
            return fromTree(mapper.readTree(in));
        } catch (IOException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getMessage(), e);
        }
    }

    public ResolutionConfig load(Reader reader) {
        try {
            return fromTree(mapper.readTree(reader));
        } catch (IOException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getMessage(), e);
        }
    }

    ResolutionConfig fromTree(JsonNode root) {
        ResolutionConfig.Builder builder = ResolutionConfig.builder();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return builder.build();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if (!KNOWN_KEYS.contains(key)) {
                throw new ConfigurationException("Unknown configuration key: " + key);
            }
            switch (key) {
                case "blockingKeyVersion" -> builder.blockingKeyVersion(text(key, value));
                case "embeddingModelId" -> builder.embeddingModelId(value.isNull() ? null : text(key, value));
                case "embeddingDimension" -> builder.embeddingDimension(value.isNull() ? null : integer(key, value));
                case "tLow" -> builder.tLow(number(key, value));
                case "tHigh" -> builder.tHigh(number(key, value));
                case "crossBlockAutoMergeThreshold" -> builder.crossBlockAutoMergeThreshold(number(key, value));
                case "typeConflictCap" -> builder.typeConflictCap(number(key, value));
                case "lowConfidenceCap" -> builder.lowConfidenceCap(number(key, value));
                case "maxBlockSize" -> builder.maxBlockSize(integer(key, value));
                case "publicDisclosureFloor" -> builder.publicDisclosureFloor(number(key, value));
                case "weights" -> builder.weights(
                        number("weights.phonetic", required(value, "phonetic", "weights")),
                        number("weights.edit", required(value, "edit", "weights")),
                        number("weights.embedding", required(value, "embedding", "weights")));
                case "editAlgorithm" -> builder.editAlgorithm(editAlgorithm(text(key, value)));
                case "embeddingTopK" -> builder.embeddingTopK(integer(key, value));
                case "embeddingConfidenceFloor" -> builder.embeddingConfidenceFloor(number(key, value));
                case "embeddingMinSimilarity" -> builder.embeddingMinSimilarity(number(key, value));
                case "kAnonymityK" -> builder.kAnonymityK(integer(key, value));
                case "kAnonymityConfidenceFloor" -> builder.kAnonymityConfidenceFloor(number(key, value));
                case "placeholderPatterns" -> builder.placeholderPatterns(patterns(value));
                case "parallelism" -> builder.parallelism(integer(key, value));
                case "reportExampleLimit" -> builder.reportExampleLimit(integer(key, value));
                case "parseCache" -> builder.parseCache(parseCache(value));
                default -> throw new ConfigurationException("Unknown configuration key: " + key);
            }
        }
        return builder.build();
    }

    private static JsonNode required(JsonNode parent, String name, String section) {
        if (parent == null || !parent.isObject()) {
            throw new ConfigurationException(section + " must be a mapping");
        }
        JsonNode node = parent.get(name);
        if (node == null || node.isNull()) {
            throw new ConfigurationException("Missing " + section + "." + name);
        }
        return node;
    }

    private static String text(String key, JsonNode value) {
        if (!value.isTextual()) {
            throw new ConfigurationException(key + " must be a string");
        }
        return value.asText();
    }

    private static double number(String key, JsonNode value) {
        if (!value.isNumber()) {
            throw new ConfigurationException(key + " must be a number");
        }
        return value.asDouble();
    }

    private static int integer(String key, JsonNode value) {
        if (!value.isIntegralNumber()) {
            throw new ConfigurationException(key + " must be an integer");
        }
        return value.asInt();
    }

    private static boolean bool(String key, JsonNode value) {
        if (!value.isBoolean()) {
            throw new ConfigurationException(key + " must be a boolean");
        }
        return value.asBoolean();
    }

    private static EditAlgorithm editAlgorithm(String value) {
        try {
            return EditAlgorithm.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown editAlgorithm: " + value, e);
        }
    }

    private static List<String> patterns(JsonNode value) {
        if (!value.isArray()) {
            throw new ConfigurationException("placeholderPatterns must be a list");
        }
        List<String> patterns = new ArrayList<>();
        for (JsonNode item : value) {
            patterns.add(text("placeholderPatterns[]", item));
        }
        return patterns;
    }

    private static CacheConfig parseCache(JsonNode value) {
        int maxSize = integer("parseCache.maxSize", required(value, "maxSize", "parseCache"));
        int ttlSeconds = integer("parseCache.ttlSeconds", required(value, "ttlSeconds", "parseCache"));
        JsonNode enabled = value.get("enabled");
        try {
            return new CacheConfig(maxSize, ttlSeconds, enabled == null || bool("parseCache.enabled", enabled));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid parseCache: " + e.getMessage(), e);
        }
    }
}
