package com.identity.resolution.resolution;

import com.identity.resolution.core.model.CandidatePair;
import com.identity.resolution.core.model.EdgeDecision;
import com.identity.resolution.core.model.EntityMentionLink;
import com.identity.resolution.core.model.ResolvedEntity;

import java.util.List;

/**
 * Output of the resolution engine before suppression is applied.
 *
 * @param entities    one entity per component, ordered by entity id
 * @param links       one link per mention, ordered by mention id
 * @param edges       every classified candidate pair, ordered by pair
 * @param reviewPairs pairs routed to manual review
 */
public record ClusteringResult(
        List<ResolvedEntity> entities,
        List<EntityMentionLink> links,
        List<ClassifiedEdge> edges,
        List<CandidatePair> reviewPairs
) {
    public ClusteringResult {
        entities = List.copyOf(entities);
        links = List.copyOf(links);
        edges = List.copyOf(edges);
        reviewPairs = List.copyOf(reviewPairs);
    }

    public long count(EdgeDecision decision) {
        return edges.stream().filter(e -> e.decision() == decision).count();
    }
}
