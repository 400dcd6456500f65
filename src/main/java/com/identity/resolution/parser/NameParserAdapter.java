package com.identity.resolution.parser;

import com.identity.resolution.cache.NoOpParseCache;
import com.identity.resolution.cache.ParseCache;
import com.identity.resolution.core.model.MentionHints;
import com.identity.resolution.core.model.ParseType;
import com.identity.resolution.core.model.ParsedName;
import com.identity.resolution.metrics.MetricsService;
import com.identity.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

import static com.identity.resolution.parser.RawNameParse.CORPORATION_NAME;
import static com.identity.resolution.parser.RawNameParse.FIRST_INITIAL;
import static com.identity.resolution.parser.RawNameParse.GIVEN_NAME;
import static com.identity.resolution.parser.RawNameParse.LAST_INITIAL;
import static com.identity.resolution.parser.RawNameParse.MIDDLE_INITIAL;
import static com.identity.resolution.parser.RawNameParse.MIDDLE_NAME;
import static com.identity.resolution.parser.RawNameParse.NICKNAME;
import static com.identity.resolution.parser.RawNameParse.PREFIX_MARITAL;
import static com.identity.resolution.parser.RawNameParse.PREFIX_OTHER;
import static com.identity.resolution.parser.RawNameParse.SECOND_GIVEN_NAME;
import static com.identity.resolution.parser.RawNameParse.SECOND_SURNAME;
import static com.identity.resolution.parser.RawNameParse.SUFFIX_GENERATIONAL;
import static com.identity.resolution.parser.RawNameParse.SUFFIX_OTHER;
import static com.identity.resolution.parser.RawNameParse.SURNAME;

/**
 * Wraps a {@link NameParser} into the fixed {@link ParseResult} variant and assigns parse confidence.
 *
 * <p>Confidence scheme:</p>
 * <ul>
 *   <li>parse failure: 0.0, type UNKNOWN, {@link ParsedName#EMPTY}</li>
 *   <li>person with full given and family names: 0.9</li>
 *   <li>person whose given or family name is only an initial: 0.3</li>
 *   <li>single token: 0.1, type UNKNOWN</li>
 *   <li>organization or household: 0.5</li>
 * </ul>
 *
 * <p>Results are memoized per raw string. A declared type hint replaces the type tag but
 * never the confidence, and is ignored for failed parses.</p>
 */
public class NameParserAdapter {
    private static final Logger log = LoggerFactory.getLogger(NameParserAdapter.class);

    public static final double CONFIDENCE_FULL_NAME = 0.9;
    public static final double CONFIDENCE_ORGANIZATION = 0.5;
    public static final double CONFIDENCE_HOUSEHOLD = 0.5;
    public static final double CONFIDENCE_INITIALS = 0.3;
    public static final double CONFIDENCE_SINGLE_TOKEN = 0.1;

    private final NameParser parser;
    private final ParseCache cache;
    private final MetricsService metricsService;

    public NameParserAdapter() {
        this(new HeuristicNameParser(), new NoOpParseCache(), new NoOpMetricsService());
    }

    public NameParserAdapter(NameParser parser, ParseCache cache, MetricsService metricsService) {
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Parses a raw name, applying any declared type hint.
     */
    public ParseResult parse(String rawName, MentionHints hints) {
        ParseResult result = parse(rawName);
        ParseType declared = hints != null ? hints.declaredType() : null;
        if (declared != null && declared.isKnown() && !result.isFailure() && declared != result.type()) {
            log.debug("parse.hintOverride rawName='{}' parsedType={} declaredType={}", rawName, result.type(), declared);
            return result.withType(declared);
        }
        return result;
    }

    /**
     * Parses a raw name without hints.
     */
    public ParseResult parse(String rawName) {
        if (rawName == null) {
            return ParseResult.FAILED;
        }
        Optional<ParseResult> cached = cache.get(rawName);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get();
        }
        metricsService.recordCacheMiss();

        ParseResult result;
        try {
            result = adapt(parser.parse(rawName));
        } catch (NameParseException e) {
            log.debug("parse.failed rawName='{}' reason={}", rawName, e.getMessage());
            result = ParseResult.FAILED;
        }
        cache.put(rawName, result);
        return result;
    }

    ParseResult adapt(RawNameParse raw) {
        switch (raw.type()) {
            case RawNameParse.TYPE_CORPORATION:
                return adaptCorporation(raw);
            case RawNameParse.TYPE_HOUSEHOLD:
                return adaptHousehold(raw);
            case RawNameParse.TYPE_PERSON:
                return adaptPerson(raw);
            default:
                log.warn("parse.unknownType type={} labels={}", raw.type(), raw.labels().keySet());
                return ParseResult.FAILED;
        }
    }

    private ParseResult adaptCorporation(RawNameParse raw) {
        String name = raw.label(CORPORATION_NAME);
        if (name == null || name.isBlank()) {
            return ParseResult.FAILED;
        }
        return new ParseResult(ParsedName.organization(name), ParseType.ORGANIZATION, CONFIDENCE_ORGANIZATION);
    }

    private ParseResult adaptHousehold(RawNameParse raw) {
        String given = joinNonNull(" & ", raw.label(GIVEN_NAME), raw.label(SECOND_GIVEN_NAME));
        String family = raw.label(SURNAME) != null ? raw.label(SURNAME) : raw.label(SECOND_SURNAME);
        ParsedName parsed = new ParsedName(raw.label(PREFIX_MARITAL), given, null, family, null,
                raw.label(NICKNAME), null);
        if (parsed.isEmpty()) {
            return ParseResult.FAILED;
        }
        return new ParseResult(parsed, ParseType.HOUSEHOLD, CONFIDENCE_HOUSEHOLD);
    }

    private ParseResult adaptPerson(RawNameParse raw) {
        String given = firstOf(raw.label(GIVEN_NAME), raw.label(FIRST_INITIAL));
        String middle = firstOf(raw.label(MIDDLE_NAME), raw.label(MIDDLE_INITIAL));
        String family = firstOf(raw.label(SURNAME), raw.label(LAST_INITIAL));
        ParsedName parsed = new ParsedName(
                joinNonNull(" ", raw.label(PREFIX_MARITAL), raw.label(PREFIX_OTHER)),
                given,
                middle,
                family,
                joinNonNull(" ", raw.label(SUFFIX_GENERATIONAL), raw.label(SUFFIX_OTHER)),
                raw.label(NICKNAME),
                null);

        if (parsed.isEmpty() || (!parsed.hasGiven() && !parsed.hasFamily() && parsed.nickname() == null)) {
            return ParseResult.FAILED;
        }
        if (!parsed.hasGiven() || !parsed.hasFamily()) {
            return new ParseResult(parsed, ParseType.UNKNOWN, CONFIDENCE_SINGLE_TOKEN);
        }
        if (raw.has(FIRST_INITIAL) || raw.has(LAST_INITIAL)) {
            return new ParseResult(parsed, ParseType.PERSON, CONFIDENCE_INITIALS);
        }
        return new ParseResult(parsed, ParseType.PERSON, CONFIDENCE_FULL_NAME);
    }

    private static String firstOf(String primary, String fallback) {
        return primary != null ? primary : fallback;
    }

    private static String joinNonNull(String separator, String a, String b) {
        if (a == null) return b;
        if (b == null) return a;
        return a + separator + b;
    }
}
