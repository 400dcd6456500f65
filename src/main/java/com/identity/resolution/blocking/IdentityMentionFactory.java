package com.identity.resolution.blocking;

import com.identity.resolution.core.model.IdentityMention;
import com.identity.resolution.core.model.MentionRecord;
import com.identity.resolution.parser.NameParserAdapter;
import com.identity.resolution.parser.ParseResult;
import com.identity.resolution.suppression.PlaceholderIdentityMatcher;

import java.util.Objects;

/**
 * Turns a validated {@link MentionRecord} into an immutable {@link IdentityMention}:
 * parse, normalize, key.
 *
 * <p>Privacy placeholders ({@code "Female (1)"}) are never parsed as names: they are
 * treated as parse failures so they cannot be merged with anything.</p>
 */
public class IdentityMentionFactory {

    private final NameParserAdapter parserAdapter;
    private final NameNormalizer normalizer;
    private final BlockingKeyStrategy keyStrategy;
    private final PlaceholderIdentityMatcher placeholderMatcher;

    public IdentityMentionFactory(NameParserAdapter parserAdapter,
                                  NameNormalizer normalizer,
                                  BlockingKeyStrategy keyStrategy,
                                  PlaceholderIdentityMatcher placeholderMatcher) {
        this.parserAdapter = Objects.requireNonNull(parserAdapter, "parserAdapter is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.keyStrategy = Objects.requireNonNull(keyStrategy, "keyStrategy is required");
        this.placeholderMatcher = Objects.requireNonNull(placeholderMatcher, "placeholderMatcher is required");
    }

    public IdentityMention create(MentionRecord record) {
        ParseResult result = placeholderMatcher.matches(record.rawName())
                ? ParseResult.FAILED
                : parserAdapter.parse(record.rawName(), record.hints());

        return IdentityMention.builder()
                .mentionId(record.mentionId())
                .sourceReference(record.sourceReference())
                .rawName(record.rawName())
                .parsed(result.parsed())
                .parseType(result.type())
                .parseConfidence(result.confidence())
                .blockingKey(keyStrategy.generateKey(result.parsed(), result.type(), result.confidence()))
                .comparisonName(normalizer.comparisonName(result.parsed(), result.type(), record.rawName()))
                .embedding(record.embedding())
                .protectedMarker(record.hints().protectedMarker())
                .build();
    }

    public boolean isPlaceholder(String rawName) {
        return placeholderMatcher.matches(rawName);
    }

    public String blockingKeyVersion() {
        return keyStrategy.version();
    }
}
