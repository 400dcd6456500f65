package com.identity.resolution.resolution;

import com.identity.resolution.core.model.CandidatePair;
import com.identity.resolution.core.model.EdgeDecision;
import com.identity.resolution.core.model.EntityMentionLink;
import com.identity.resolution.core.model.IdentityMention;
import com.identity.resolution.core.model.MentionPair;
import com.identity.resolution.core.model.ParseType;
import com.identity.resolution.core.model.ResolvedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Clusters mentions into entities from classified candidate edges.
 *
 * <p>Only AUTO_MERGE and FORCED_MERGE edges are unioned; REVIEW edges are collected for the
 * review queue and never merged, so no merge happens transitively past a review gate.
 * Merge edges are applied on the calling thread in a fixed order (forced first, then
 * score descending, then pair ids), which makes the partition reproducible.</p>
 */
public class ResolutionEngine {
    private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);

    private static final String ENTITY_ID_NAMESPACE = "identity-entity:";
    private static final ParseType[] TYPE_PRECEDENCE = {ParseType.ORGANIZATION, ParseType.HOUSEHOLD, ParseType.PERSON};

    private static final Comparator<ClassifiedEdge> MERGE_ORDER = Comparator
            .comparing((ClassifiedEdge e) -> e.decision() == EdgeDecision.FORCED_MERGE ? 0 : 1)
            .thenComparing(e -> -e.candidate().compositeScore())
            .thenComparing(e -> e.candidate().pair());

    private final EdgeClassifier classifier;

    public ResolutionEngine(EdgeClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
    }

    public ClusteringResult resolve(Collection<IdentityMention> mentions,
                                    List<CandidatePair> candidates,
                                    ReviewOverrides overrides) {
        Map<String, IdentityMention> byId = new TreeMap<>();
        for (IdentityMention m : mentions) {
            byId.put(m.getMentionId(), m);
        }
        UnionFind unionFind = new UnionFind(byId.keySet());

        Map<MentionPair, ClassifiedEdge> edges = new TreeMap<>();
        for (CandidatePair candidate : candidates) {
            if (!byId.containsKey(candidate.mentionIdA()) || !byId.containsKey(candidate.mentionIdB())) {
                throw new IllegalArgumentException("Candidate references unknown mention: " + candidate.pair());
            }
            edges.put(candidate.pair(), new ClassifiedEdge(candidate, initialDecision(candidate, overrides),
                    classifier.effectiveHigh(candidate.origin())));
        }

        List<MentionPair> cannotLinks = new ArrayList<>();
        for (MentionPair pair : overrides.getCannotLinks()) {
            if (unionFind.contains(pair.mentionIdA()) && unionFind.contains(pair.mentionIdB())) {
                cannotLinks.add(pair);
            }
        }

        List<ClassifiedEdge> mergeEdges = new ArrayList<>();
        for (ClassifiedEdge edge : edges.values()) {
            if (edge.decision().isMerge()) {
                mergeEdges.add(edge);
            }
        }
        mergeEdges.sort(MERGE_ORDER);

        Map<String, Double> acceptedScore = new HashMap<>();
        for (ClassifiedEdge edge : mergeEdges) {
            MentionPair pair = edge.candidate().pair();
            if (violatesCannotLink(unionFind, pair, cannotLinks)) {
                edges.put(pair, new ClassifiedEdge(edge.candidate(), EdgeDecision.BLOCKED_BY_OVERRIDE, edge.effectiveHigh()));
                log.info("edge.blockedByOverride pair={} decision={} score={}",
                        pair, edge.decision(), edge.candidate().compositeScore());
                continue;
            }
            unionFind.union(pair.mentionIdA(), pair.mentionIdB());
            double score = edge.candidate().compositeScore();
            acceptedScore.merge(pair.mentionIdA(), score, Math::max);
            acceptedScore.merge(pair.mentionIdB(), score, Math::max);
        }

        Set<String> unverifiedRoots = new HashSet<>();
        List<CandidatePair> reviewPairs = new ArrayList<>();
        for (ClassifiedEdge edge : edges.values()) {
            MentionPair pair = edge.candidate().pair();
            if (!edge.decision().isMerge() && unionFind.connected(pair.mentionIdA(), pair.mentionIdB())) {
                unverifiedRoots.add(unionFind.find(pair.mentionIdA()));
            }
            if (edge.decision() == EdgeDecision.REVIEW) {
                reviewPairs.add(edge.candidate());
            }
        }

        List<ResolvedEntity> entities = new ArrayList<>();
        List<EntityMentionLink> links = new ArrayList<>();
        SortedMap<String, SortedSet<String>> components = unionFind.components();
        for (Map.Entry<String, SortedSet<String>> component : components.entrySet()) {
            SortedSet<String> members = component.getValue();
            ResolvedEntity entity = buildEntity(component.getKey(), members, byId,
                    members.size() >= 2 && !unverifiedRoots.contains(component.getKey()));
            entities.add(entity);
            for (String mentionId : members) {
                double score = members.size() == 1 ? 1.0 : acceptedScore.getOrDefault(mentionId, 1.0);
                links.add(new EntityMentionLink(entity.getEntityId(), mentionId, score));
            }
        }
        entities.sort(Comparator.comparing(ResolvedEntity::getEntityId));
        links.sort(Comparator.comparing(EntityMentionLink::mentionId));

        ClusteringResult result = new ClusteringResult(entities, links, new ArrayList<>(edges.values()), reviewPairs);
        log.info("clustering.completed mentions={} entities={} autoMerge={} forcedMerge={} review={} noMatch={} blocked={}",
                byId.size(), entities.size(),
                result.count(EdgeDecision.AUTO_MERGE), result.count(EdgeDecision.FORCED_MERGE),
                result.count(EdgeDecision.REVIEW), result.count(EdgeDecision.NO_MATCH),
                result.count(EdgeDecision.BLOCKED_BY_OVERRIDE));
        return result;
    }

    /**
     * Deterministic entity id derived from the smallest member mention id.
     */
    public static String entityIdFor(String smallestMentionId) {
        return UUID.nameUUIDFromBytes((ENTITY_ID_NAMESPACE + smallestMentionId).getBytes(StandardCharsets.UTF_8))
                .toString();
    }

    private EdgeDecision initialDecision(CandidatePair candidate, ReviewOverrides overrides) {
        if (overrides.isForced(candidate.pair())) {
            return EdgeDecision.FORCED_MERGE;
        }
        EdgeDecision decision = classifier.classify(candidate);
        if (overrides.isCannotLink(candidate.pair()) && decision != EdgeDecision.NO_MATCH) {
            return EdgeDecision.BLOCKED_BY_OVERRIDE;
        }
        return decision;
    }

    private static boolean violatesCannotLink(UnionFind unionFind, MentionPair edge, List<MentionPair> cannotLinks) {
        if (cannotLinks.isEmpty()) {
            return false;
        }
        String rootA = unionFind.find(edge.mentionIdA());
        String rootB = unionFind.find(edge.mentionIdB());
        if (rootA.equals(rootB)) {
            return false;
        }
        for (MentionPair forbidden : cannotLinks) {
            String x = unionFind.find(forbidden.mentionIdA());
            String y = unionFind.find(forbidden.mentionIdB());
            if ((x.equals(rootA) && y.equals(rootB)) || (x.equals(rootB) && y.equals(rootA))) {
                return true;
            }
        }
        return false;
    }

    private static ResolvedEntity buildEntity(String root, SortedSet<String> members,
                                              Map<String, IdentityMention> byId, boolean verified) {
        IdentityMention canonical = null;
        Map<ParseType, Integer> typeVotes = new EnumMap<>(ParseType.class);
        for (String mentionId : members) {
            IdentityMention m = byId.get(mentionId);
            // Members iterate in id order, so strict > keeps the smallest id on ties.
            if (canonical == null || m.getParseConfidence() > canonical.getParseConfidence()) {
                canonical = m;
            }
            if (m.getParseType().isKnown()) {
                typeVotes.merge(m.getParseType(), 1, Integer::sum);
            }
        }

        return ResolvedEntity.builder()
                .entityId(entityIdFor(root))
                .canonicalName(canonical.getRawName().trim())
                .canonicalMentionId(canonical.getMentionId())
                .entityType(majorityType(typeVotes))
                .memberMentionIds(members)
                .verified(verified)
                .bestParseConfidence(canonical.getParseConfidence())
                .build();
    }

    static ParseType majorityType(Map<ParseType, Integer> votes) {
        ParseType best = ParseType.UNKNOWN;
        int bestCount = 0;
        for (ParseType type : TYPE_PRECEDENCE) {
            int count = votes.getOrDefault(type, 0);
            if (count > bestCount) {
                best = type;
                bestCount = count;
            }
        }
        return best;
    }
}
