package com.identity.resolution.api;

import com.identity.resolution.blocking.BlockingKeyStrategies;
import com.identity.resolution.cache.CacheConfig;
import com.identity.resolution.candidate.CandidateSettings;
import com.identity.resolution.similarity.EditAlgorithm;
import com.identity.resolution.similarity.SimilarityWeights;
import com.identity.resolution.suppression.PlaceholderIdentityMatcher;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable configuration of a resolution run.
 * Every value is validated in {@link Builder#build()}, so a bad configuration fails before any
 * mention is read.
 */
public final class ResolutionConfig {

    public static final double DEFAULT_T_LOW = 0.60;
    public static final double DEFAULT_T_HIGH = 0.90;
    public static final double DEFAULT_CROSS_BLOCK_AUTO_MERGE_THRESHOLD = 0.95;
    public static final double DEFAULT_TYPE_CONFLICT_CAP = 0.40;
    public static final double DEFAULT_LOW_CONFIDENCE_CAP = 0.75;
    public static final int DEFAULT_MAX_BLOCK_SIZE = 500;
    public static final double DEFAULT_PUBLIC_DISCLOSURE_FLOOR = 0.5;
    public static final int DEFAULT_EMBEDDING_TOP_K = 5;
    public static final double DEFAULT_EMBEDDING_CONFIDENCE_FLOOR = 0.5;
    public static final double DEFAULT_EMBEDDING_MIN_SIMILARITY = 0.80;
    public static final int DEFAULT_K_ANONYMITY_K = 3;
    public static final double DEFAULT_K_ANONYMITY_CONFIDENCE_FLOOR = 0.5;
    public static final int DEFAULT_REPORT_EXAMPLE_LIMIT = 20;
    public static final String DEFAULT_BLOCKING_KEY_VERSION = "v1";

    private final String blockingKeyVersion;
    private final String embeddingModelId;
    private final Integer embeddingDimension;
    private final double tLow;
    private final double tHigh;
    private final double crossBlockAutoMergeThreshold;
    private final double typeConflictCap;
    private final double lowConfidenceCap;
    private final int maxBlockSize;
    private final double publicDisclosureFloor;
    private final SimilarityWeights weights;
    private final EditAlgorithm editAlgorithm;
    private final int embeddingTopK;
    private final double embeddingConfidenceFloor;
    private final double embeddingMinSimilarity;
    private final int kAnonymityK;
    private final double kAnonymityConfidenceFloor;
    private final List<String> placeholderPatterns;
    private final int parallelism;
    private final int reportExampleLimit;
    private final CacheConfig parseCache;

    private ResolutionConfig(Builder builder) {
        this.blockingKeyVersion = builder.blockingKeyVersion;
        this.embeddingModelId = builder.embeddingModelId;
        this.embeddingDimension = builder.embeddingDimension;
        this.tLow = builder.tLow;
        this.tHigh = builder.tHigh;
        this.crossBlockAutoMergeThreshold = builder.crossBlockAutoMergeThreshold;
        this.typeConflictCap = builder.typeConflictCap;
        this.lowConfidenceCap = builder.lowConfidenceCap;
        this.maxBlockSize = builder.maxBlockSize;
        this.publicDisclosureFloor = builder.publicDisclosureFloor;
        this.weights = builder.weights;
        this.editAlgorithm = builder.editAlgorithm;
        this.embeddingTopK = builder.embeddingTopK;
        this.embeddingConfidenceFloor = builder.embeddingConfidenceFloor;
        this.embeddingMinSimilarity = builder.embeddingMinSimilarity;
        this.kAnonymityK = builder.kAnonymityK;
        this.kAnonymityConfidenceFloor = builder.kAnonymityConfidenceFloor;
        this.placeholderPatterns = List.copyOf(builder.placeholderPatterns);
        this.parallelism = builder.parallelism;
        this.reportExampleLimit = builder.reportExampleLimit;
        this.parseCache = builder.parseCache;
    }

    public String getBlockingKeyVersion() {
        return blockingKeyVersion;
    }

    public String getEmbeddingModelId() {
        return embeddingModelId;
    }

    /**
     * Expected embedding length, or null when any length is accepted.
     */
    public Integer getEmbeddingDimension() {
        return embeddingDimension;
    }

    public double getTLow() {
        return tLow;
    }

    public double getTHigh() {
        return tHigh;
    }

    public double getCrossBlockAutoMergeThreshold() {
        return crossBlockAutoMergeThreshold;
    }

    public double getTypeConflictCap() {
        return typeConflictCap;
    }

    public double getLowConfidenceCap() {
        return lowConfidenceCap;
    }

    public int getMaxBlockSize() {
        return maxBlockSize;
    }

    public double getPublicDisclosureFloor() {
        return publicDisclosureFloor;
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    public EditAlgorithm getEditAlgorithm() {
        return editAlgorithm;
    }

    public int getEmbeddingTopK() {
        return embeddingTopK;
    }

    public double getEmbeddingConfidenceFloor() {
        return embeddingConfidenceFloor;
    }

    public double getEmbeddingMinSimilarity() {
        return embeddingMinSimilarity;
    }

    public int getKAnonymityK() {
        return kAnonymityK;
    }

    public double getKAnonymityConfidenceFloor() {
        return kAnonymityConfidenceFloor;
    }

    public List<String> getPlaceholderPatterns() {
        return placeholderPatterns;
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getReportExampleLimit() {
        return reportExampleLimit;
    }

    public CacheConfig getParseCache() {
        return parseCache;
    }

    public CandidateSettings toCandidateSettings() {
        return new CandidateSettings(maxBlockSize, embeddingTopK, embeddingConfidenceFloor, embeddingMinSimilarity);
    }

    public PlaceholderIdentityMatcher placeholderMatcher() {
        return new PlaceholderIdentityMatcher(placeholderPatterns);
    }

    /**
     * SHA-256 over every value that influences the partition, recorded with each snapshot.
     * Parallelism, report size and cache settings are left out since they never change results.
     */
    public String fingerprint() {
        String canonical = String.join(";",
                "blockingKeyVersion=" + blockingKeyVersion,
                "embeddingModelId=" + embeddingModelId,
                "embeddingDimension=" + embeddingDimension,
                "tLow=" + format(tLow),
                "tHigh=" + format(tHigh),
                "crossBlockAutoMergeThreshold=" + format(crossBlockAutoMergeThreshold),
                "typeConflictCap=" + format(typeConflictCap),
                "lowConfidenceCap=" + format(lowConfidenceCap),
                "maxBlockSize=" + maxBlockSize,
                "publicDisclosureFloor=" + format(publicDisclosureFloor),
                "weights=" + format(weights.phoneticWeight()) + "," + format(weights.editWeight())
                        + "," + format(weights.embeddingWeight()),
                "editAlgorithm=" + editAlgorithm,
                "embeddingTopK=" + embeddingTopK,
                "embeddingConfidenceFloor=" + format(embeddingConfidenceFloor),
                "embeddingMinSimilarity=" + format(embeddingMinSimilarity),
                "kAnonymityK=" + kAnonymityK,
                "kAnonymityConfidenceFloor=" + format(kAnonymityConfidenceFloor),
                "placeholderPatterns=" + String.join("\u0000", placeholderPatterns));
        return DigestUtils.sha256Hex(canonical);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }

    @Override
    public String toString() {
        return "ResolutionConfig{blockingKeyVersion=" + blockingKeyVersion +
                ", tLow=" + tLow +
                ", tHigh=" + tHigh +
                ", crossBlockAutoMergeThreshold=" + crossBlockAutoMergeThreshold +
                ", maxBlockSize=" + maxBlockSize +
                ", weights=" + weights +
                ", editAlgorithm=" + editAlgorithm +
                ", parallelism=" + parallelism + '}';
    }

    public static ResolutionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String blockingKeyVersion = DEFAULT_BLOCKING_KEY_VERSION;
        private String embeddingModelId;
        private Integer embeddingDimension;
        private double tLow = DEFAULT_T_LOW;
        private double tHigh = DEFAULT_T_HIGH;
        private double crossBlockAutoMergeThreshold = DEFAULT_CROSS_BLOCK_AUTO_MERGE_THRESHOLD;
        private double typeConflictCap = DEFAULT_TYPE_CONFLICT_CAP;
        private double lowConfidenceCap = DEFAULT_LOW_CONFIDENCE_CAP;
        private int maxBlockSize = DEFAULT_MAX_BLOCK_SIZE;
        private double publicDisclosureFloor = DEFAULT_PUBLIC_DISCLOSURE_FLOOR;
        private SimilarityWeights weights = SimilarityWeights.defaultWeights();
        private EditAlgorithm editAlgorithm = EditAlgorithm.LEVENSHTEIN;
        private int embeddingTopK = DEFAULT_EMBEDDING_TOP_K;
        private double embeddingConfidenceFloor = DEFAULT_EMBEDDING_CONFIDENCE_FLOOR;
        private double embeddingMinSimilarity = DEFAULT_EMBEDDING_MIN_SIMILARITY;
        private int kAnonymityK = DEFAULT_K_ANONYMITY_K;
        private double kAnonymityConfidenceFloor = DEFAULT_K_ANONYMITY_CONFIDENCE_FLOOR;
        private List<String> placeholderPatterns = new ArrayList<>(PlaceholderIdentityMatcher.DEFAULT_PATTERNS);
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private int reportExampleLimit = DEFAULT_REPORT_EXAMPLE_LIMIT;
        private CacheConfig parseCache = CacheConfig.defaults();

        public Builder blockingKeyVersion(String blockingKeyVersion) {
            this.blockingKeyVersion = blockingKeyVersion;
            return this;
        }

        public Builder embeddingModelId(String embeddingModelId) {
            this.embeddingModelId = embeddingModelId;
            return this;
        }

        public Builder embeddingDimension(Integer embeddingDimension) {
            this.embeddingDimension = embeddingDimension;
            return this;
        }

        public Builder tLow(double tLow) {
            this.tLow = tLow;
            return this;
        }

        public Builder tHigh(double tHigh) {
            this.tHigh = tHigh;
            return this;
        }

        public Builder crossBlockAutoMergeThreshold(double crossBlockAutoMergeThreshold) {
            this.crossBlockAutoMergeThreshold = crossBlockAutoMergeThreshold;
            return this;
        }

        public Builder typeConflictCap(double typeConflictCap) {
            this.typeConflictCap = typeConflictCap;
            return this;
        }

        public Builder lowConfidenceCap(double lowConfidenceCap) {
            this.lowConfidenceCap = lowConfidenceCap;
            return this;
        }

        public Builder maxBlockSize(int maxBlockSize) {
            this.maxBlockSize = maxBlockSize;
            return this;
        }

        public Builder publicDisclosureFloor(double publicDisclosureFloor) {
            this.publicDisclosureFloor = publicDisclosureFloor;
            return this;
        }

        public Builder weights(SimilarityWeights weights) {
            this.weights = weights;
            return this;
        }

        /**
         * Sets the weights from raw values, reporting an invalid combination as a configuration error.
         */
        public Builder weights(double phonetic, double edit, double embedding) {
            try {
                this.weights = new SimilarityWeights(phonetic, edit, embedding);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid similarity weights: " + e.getMessage(), e);
            }
            return this;
        }

        public Builder editAlgorithm(EditAlgorithm editAlgorithm) {
            this.editAlgorithm = editAlgorithm;
            return this;
        }

        public Builder embeddingTopK(int embeddingTopK) {
            this.embeddingTopK = embeddingTopK;
            return this;
        }

        public Builder embeddingConfidenceFloor(double embeddingConfidenceFloor) {
            this.embeddingConfidenceFloor = embeddingConfidenceFloor;
            return this;
        }

        public Builder embeddingMinSimilarity(double embeddingMinSimilarity) {
            this.embeddingMinSimilarity = embeddingMinSimilarity;
            return this;
        }

        public Builder kAnonymityK(int kAnonymityK) {
            this.kAnonymityK = kAnonymityK;
            return this;
        }

        public Builder kAnonymityConfidenceFloor(double kAnonymityConfidenceFloor) {
            this.kAnonymityConfidenceFloor = kAnonymityConfidenceFloor;
            return this;
        }

        public Builder placeholderPatterns(List<String> placeholderPatterns) {
            this.placeholderPatterns = placeholderPatterns != null ? new ArrayList<>(placeholderPatterns) : null;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder reportExampleLimit(int reportExampleLimit) {
            this.reportExampleLimit = reportExampleLimit;
            return this;
        }

        public Builder parseCache(CacheConfig parseCache) {
            this.parseCache = parseCache;
            return this;
        }

        /**
         * @throws ConfigurationException if any value is missing, out of range or inconsistent
         */
        public ResolutionConfig build() {
            if (blockingKeyVersion == null || !BlockingKeyStrategies.isSupported(blockingKeyVersion)) {
                throw new ConfigurationException("Unknown blockingKeyVersion '" + blockingKeyVersion
                        + "', supported: " + BlockingKeyStrategies.SUPPORTED_VERSIONS);
            }
            if (weights == null) {
                throw new ConfigurationException("weights are required");
            }
            if (editAlgorithm == null) {
                throw new ConfigurationException("editAlgorithm is required");
            }
            if (parseCache == null) {
                throw new ConfigurationException("parseCache is required");
            }
            validateUnit(tLow, "tLow");
            validateUnit(tHigh, "tHigh");
            validateUnit(crossBlockAutoMergeThreshold, "crossBlockAutoMergeThreshold");
            validateUnit(typeConflictCap, "typeConflictCap");
            validateUnit(lowConfidenceCap, "lowConfidenceCap");
            validateUnit(publicDisclosureFloor, "publicDisclosureFloor");
            validateUnit(embeddingConfidenceFloor, "embeddingConfidenceFloor");
            validateUnit(kAnonymityConfidenceFloor, "kAnonymityConfidenceFloor");
            if (embeddingMinSimilarity < -1.0 || embeddingMinSimilarity > 1.0) {
                throw new ConfigurationException("embeddingMinSimilarity must be between -1.0 and 1.0");
            }
            if (tLow > tHigh) {
                throw new ConfigurationException("tLow (" + tLow + ") must be <= tHigh (" + tHigh + ")");
            }
            if (crossBlockAutoMergeThreshold < tHigh) {
                throw new ConfigurationException("crossBlockAutoMergeThreshold (" + crossBlockAutoMergeThreshold
                        + ") must be >= tHigh (" + tHigh + ")");
            }
            if (maxBlockSize < 2) {
                throw new ConfigurationException("maxBlockSize must be >= 2");
            }
            if (embeddingTopK < 0) {
                throw new ConfigurationException("embeddingTopK must be >= 0");
            }
            if (embeddingDimension != null && embeddingDimension <= 0) {
                throw new ConfigurationException("embeddingDimension must be positive");
            }
            if (kAnonymityK < 1) {
                throw new ConfigurationException("kAnonymityK must be >= 1");
            }
            if (parallelism < 1) {
                throw new ConfigurationException("parallelism must be >= 1");
            }
            if (reportExampleLimit < 0) {
                throw new ConfigurationException("reportExampleLimit must be >= 0");
            }
            if (placeholderPatterns == null) {
                throw new ConfigurationException("placeholderPatterns are required");
            }
            for (String pattern : placeholderPatterns) {
                if (pattern == null) {
                    throw new ConfigurationException("placeholderPatterns must not contain null");
                }
                try {
                    Pattern.compile(pattern);
                } catch (PatternSyntaxException e) {
                    throw new ConfigurationException("Invalid placeholder pattern: " + pattern, e);
                }
            }
            return new ResolutionConfig(this);
        }

        private static void validateUnit(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new ConfigurationException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
