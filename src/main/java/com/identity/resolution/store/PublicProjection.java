package com.identity.resolution.store;

import com.identity.resolution.core.model.EntityMentionLink;
import com.identity.resolution.core.model.ResolvedEntity;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Public view of a snapshot.
 *
 * <p>Excludes suppressed entities and singleton entities whose member confidence is below the
 * disclosure floor. Only links of visible entities are exposed.</p>
 */
public final class PublicProjection {

    private final ResolutionSnapshot snapshot;
    private final List<ResolvedEntity> entities;
    private final List<EntityMentionLink> links;

    private PublicProjection(ResolutionSnapshot snapshot, double publicDisclosureFloor) {
        this.snapshot = snapshot;
        this.entities = snapshot.getEntities().stream()
                .filter(e -> isVisible(e, publicDisclosureFloor))
                .collect(Collectors.toUnmodifiableList());
        Set<String> visibleIds = entities.stream()
                .map(ResolvedEntity::getEntityId)
                .collect(Collectors.toSet());
        this.links = snapshot.getLinks().stream()
                .filter(link -> visibleIds.contains(link.entityId()))
                .collect(Collectors.toUnmodifiableList());
    }

    public static PublicProjection of(ResolutionSnapshot snapshot, double publicDisclosureFloor) {
        return new PublicProjection(snapshot, publicDisclosureFloor);
    }

    static boolean isVisible(ResolvedEntity entity, double publicDisclosureFloor) {
        if (entity.isSuppressFromPublic()) {
            return false;
        }
        return !entity.isSingleton() || entity.getBestParseConfidence() >= publicDisclosureFloor;
    }

    public String getRunId() {
        return snapshot.getRunId();
    }

    public List<ResolvedEntity> getEntities() {
        return entities;
    }

    public List<EntityMentionLink> getLinks() {
        return links;
    }

    public boolean isVisible(String entityId) {
        return entities.stream().anyMatch(e -> e.getEntityId().equals(entityId));
    }
}
