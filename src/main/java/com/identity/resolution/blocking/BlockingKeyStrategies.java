package com.identity.resolution.blocking;

import java.util.Set;

/**
 * Registry of the supported blocking key versions.
 */
public final class BlockingKeyStrategies {

    public static final Set<String> SUPPORTED_VERSIONS = Set.of(SoundexBlockingKeyStrategy.V1, SoundexBlockingKeyStrategy.V2);

    private BlockingKeyStrategies() {
        // Utility class
    }

    public static boolean isSupported(String version) {
        return version != null && SUPPORTED_VERSIONS.contains(version);
    }

    /**
     * @throws IllegalArgumentException if the version is not supported
     */
    public static BlockingKeyStrategy forVersion(String version, NameNormalizer normalizer) {
        return new SoundexBlockingKeyStrategy(version, normalizer);
    }
}
