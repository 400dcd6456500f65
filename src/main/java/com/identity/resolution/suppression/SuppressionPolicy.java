package com.identity.resolution.suppression;

import com.identity.resolution.core.model.IdentityMention;
import com.identity.resolution.core.model.ResolvedEntity;
import com.identity.resolution.core.model.SuppressionReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which entities are withheld from public projections. Re-evaluated on every run.
 *
 * <p>An entity is suppressed when any member carries the upstream protected marker, has a
 * raw name matching a placeholder-identity pattern, or was suppressed in an earlier run; or
 * when the entity is a low-confidence partial identity (best parse confidence above zero but
 * below {@code kAnonymityConfidenceFloor}) whose blocking key is shared by fewer than
 * {@code kAnonymityK} entities of the run. Parse failures are not identities and are only
 * suppressed when a member-level rule applies.</p>
 */
public class SuppressionPolicy {
    private static final Logger log = LoggerFactory.getLogger(SuppressionPolicy.class);

    private final PlaceholderIdentityMatcher placeholderMatcher;
    private final SuppressionRegistry registry;
    private final int kAnonymityK;
    private final double kAnonymityConfidenceFloor;

    public SuppressionPolicy(PlaceholderIdentityMatcher placeholderMatcher, SuppressionRegistry registry,
                             int kAnonymityK, double kAnonymityConfidenceFloor) {
        this.placeholderMatcher = Objects.requireNonNull(placeholderMatcher, "placeholderMatcher is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.kAnonymityK = kAnonymityK;
        this.kAnonymityConfidenceFloor = kAnonymityConfidenceFloor;
    }

    /**
     * Returns the entities with their suppression reasons set, in the same order.
     */
    public List<ResolvedEntity> apply(List<ResolvedEntity> entities, Map<String, IdentityMention> mentionsById) {
        Map<String, Integer> entitiesPerKey = new HashMap<>();
        for (ResolvedEntity entity : entities) {
            entitiesPerKey.merge(quasiIdentifier(entity, mentionsById), 1, Integer::sum);
        }

        List<ResolvedEntity> result = new ArrayList<>(entities.size());
        int suppressed = 0;
        for (ResolvedEntity entity : entities) {
            Set<SuppressionReason> reasons = EnumSet.noneOf(SuppressionReason.class);
            for (String mentionId : entity.getMemberMentionIds()) {
                IdentityMention mention = mentionsById.get(mentionId);
                if (mention.isProtectedMarker()) {
                    reasons.add(SuppressionReason.PROTECTED_MARKER);
                }
                if (placeholderMatcher.matches(mention.getRawName())) {
                    reasons.add(SuppressionReason.PLACEHOLDER_IDENTITY);
                }
                if (registry.isSuppressed(mentionId)) {
                    reasons.add(SuppressionReason.PREVIOUSLY_SUPPRESSED);
                }
            }
            double best = entity.getBestParseConfidence();
            if (best > 0.0 && best < kAnonymityConfidenceFloor
                    && entitiesPerKey.get(quasiIdentifier(entity, mentionsById)) < kAnonymityK) {
                reasons.add(SuppressionReason.K_ANONYMITY);
            }

            if (reasons.isEmpty()) {
                result.add(entity);
            } else {
                suppressed++;
                log.debug("entity.suppressed entityId={} reasons={}", entity.getEntityId(), reasons);
                result.add(entity.withSuppression(reasons));
            }
        }
        log.info("suppression.evaluated entities={} suppressed={}", entities.size(), suppressed);
        return result;
    }

    /**
     * The blocking key of the canonical member stands in for the quasi-identifier.
     */
    private static String quasiIdentifier(ResolvedEntity entity, Map<String, IdentityMention> mentionsById) {
        return mentionsById.get(entity.getCanonicalMentionId()).getBlockingKey();
    }
}
