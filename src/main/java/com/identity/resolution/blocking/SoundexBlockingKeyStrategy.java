package com.identity.resolution.blocking;

import com.identity.resolution.core.model.ParseType;
import com.identity.resolution.core.model.ParsedName;
import org.apache.commons.codec.language.Soundex;

import java.util.Set;

/**
 * Phonetic blocking keys built on American Soundex.
 *
 * <ul>
 *   <li>{@code v1}: {@code Soundex(family) + "|" + first letter of given}, e.g. {@code E123|j}</li>
 *   <li>{@code v2}: {@code Soundex(family) + "|" + Soundex(given)}, e.g. {@code E123|J116}</li>
 *   <li>organizations: {@code "org|" + Soundex(first significant token)}</li>
 * </ul>
 *
 * <p>The family component is the last token of the normalized family name, so surname
 * particles ("van", "de") do not change the key. A missing given name leaves the part after
 * the separator empty.</p>
 */
public class SoundexBlockingKeyStrategy implements BlockingKeyStrategy {

    public static final String V1 = "v1";
    public static final String V2 = "v2";
    static final String ORGANIZATION_PREFIX = "org|";

    private static final Set<String> PLACEHOLDER_TOKENS = Set.of("unknown", "unk", "na", "none", "null", "illegible");
    private static final Set<String> ORGANIZATION_STOP_WORDS = Set.of("the", "of", "and", "a", "an", "for");

    private final String version;
    private final NameNormalizer normalizer;
    private final Soundex soundex = Soundex.US_ENGLISH;

    public SoundexBlockingKeyStrategy(String version) {
        this(version, new NameNormalizer());
    }

    public SoundexBlockingKeyStrategy(String version, NameNormalizer normalizer) {
        if (!V1.equals(version) && !V2.equals(version)) {
            throw new IllegalArgumentException("Unknown blocking key version: " + version);
        }
        this.version = version;
        this.normalizer = normalizer;
    }

    @Override
    public String generateKey(ParsedName parsed, ParseType type, double confidence) {
        if (parsed == null || parsed.isEmpty() || confidence <= 0.0) {
            return UNBLOCKABLE;
        }
        if (type == ParseType.ORGANIZATION || parsed.corporateName() != null) {
            return organizationKey(parsed);
        }
        return personKey(parsed);
    }

    @Override
    public String version() {
        return version;
    }

    private String personKey(ParsedName parsed) {
        String family = lastToken(normalizer.normalize(parsed.family(), ParseType.PERSON));
        String familyLetters = normalizer.asciiLetters(family);
        if (familyLetters.length() <= 1 || PLACEHOLDER_TOKENS.contains(familyLetters)) {
            return UNBLOCKABLE;
        }
        String givenLetters = normalizer.asciiLetters(firstToken(normalizer.normalize(parsed.given(), ParseType.PERSON)));
        String familyCode = soundex.encode(familyLetters);
        if (V1.equals(version)) {
            return familyCode + "|" + (givenLetters.isEmpty() ? "" : givenLetters.substring(0, 1));
        }
        return familyCode + "|" + (givenLetters.isEmpty() ? "" : soundex.encode(givenLetters));
    }

    private String organizationKey(ParsedName parsed) {
        String name = parsed.corporateName() != null ? parsed.corporateName() : parsed.fullName();
        String normalized = normalizer.normalize(name, ParseType.ORGANIZATION);
        for (String token : normalized.split(" ")) {
            String letters = normalizer.asciiLetters(token);
            if (letters.length() > 1 && !ORGANIZATION_STOP_WORDS.contains(letters)) {
                return ORGANIZATION_PREFIX + soundex.encode(letters);
            }
        }
        return UNBLOCKABLE;
    }

    private static String lastToken(String value) {
        int idx = value.lastIndexOf(' ');
        return idx >= 0 ? value.substring(idx + 1) : value;
    }

    private static String firstToken(String value) {
        int idx = value.indexOf(' ');
        return idx >= 0 ? value.substring(0, idx) : value;
    }
}
