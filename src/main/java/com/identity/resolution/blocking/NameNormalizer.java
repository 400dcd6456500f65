package com.identity.resolution.blocking;

import com.identity.resolution.core.model.ParseType;
import com.identity.resolution.core.model.ParsedName;
import com.identity.resolution.rules.NameNormalizationRules;
import com.identity.resolution.rules.NormalizationEngine;

import java.util.Locale;

/**
 * Produces the normalized strings used for blocking and comparison:
 * diacritics folded, lowercased, punctuation stripped, whitespace collapsed.
 */
public class NameNormalizer {

    private final NormalizationEngine engine;

    public NameNormalizer() {
        this(NameNormalizationRules.createDefaultEngine());
    }

    public NameNormalizer(NormalizationEngine engine) {
        this.engine = engine;
    }

    public String normalize(String value) {
        return engine.normalize(value);
    }

    public String normalize(String value, ParseType type) {
        return engine.normalize(value, type);
    }

    /**
     * Normalized full name fed to the edit-similarity signal.
     */
    public String comparisonName(ParsedName parsed, ParseType type, String rawName) {
        if (parsed == null || parsed.isEmpty()) {
            return engine.normalize(rawName);
        }
        if (parsed.corporateName() != null) {
            return engine.normalize(parsed.corporateName(), ParseType.ORGANIZATION);
        }
        String full = parsed.fullName();
        if (full.isEmpty()) {
            return engine.normalize(parsed.nickname());
        }
        return engine.normalize(full, type == ParseType.HOUSEHOLD ? ParseType.HOUSEHOLD : ParseType.PERSON);
    }

    /**
     * Reduces a value to the letters {@code a-z} only, the alphabet the phonetic encoder accepts.
     */
    public String asciiLetters(String value) {
        if (value == null) {
            return "";
        }
        String folded = NormalizationEngine.foldDiacritics(value).toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(folded.length());
        for (int i = 0; i < folded.length(); i++) {
            char c = folded.charAt(i);
            if (c >= 'a' && c <= 'z') {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
