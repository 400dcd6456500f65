package com.identity.resolution.store;

import com.identity.resolution.core.model.EntityMentionLink;
import com.identity.resolution.core.model.ResolvedEntity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The committed output of one resolution run: the entity table and the mention-to-entity map.
 * Immutable; a new run replaces the whole snapshot.
 */
public final class ResolutionSnapshot {

    private final String runId;
    private final Instant committedAt;
    private final String configFingerprint;
    private final List<ResolvedEntity> entities;
    private final List<EntityMentionLink> links;
    private final Map<String, ResolvedEntity> entitiesById;
    private final Map<String, EntityMentionLink> linksByMention;

    public ResolutionSnapshot(String runId, Instant committedAt, String configFingerprint,
                              List<ResolvedEntity> entities, List<EntityMentionLink> links) {
        this.runId = Objects.requireNonNull(runId, "runId is required");
        this.committedAt = Objects.requireNonNull(committedAt, "committedAt is required");
        this.configFingerprint = configFingerprint;
        this.entities = List.copyOf(entities);
        this.links = List.copyOf(links);

        Map<String, ResolvedEntity> byId = new LinkedHashMap<>();
        for (ResolvedEntity entity : this.entities) {
            byId.put(entity.getEntityId(), entity);
        }
        Map<String, EntityMentionLink> byMention = new LinkedHashMap<>();
        for (EntityMentionLink link : this.links) {
            if (byMention.put(link.mentionId(), link) != null) {
                throw new IllegalArgumentException("Mention linked to more than one entity: " + link.mentionId());
            }
        }
        this.entitiesById = Collections.unmodifiableMap(byId);
        this.linksByMention = Collections.unmodifiableMap(byMention);
    }

    public String getRunId() {
        return runId;
    }

    public Instant getCommittedAt() {
        return committedAt;
    }

    public String getConfigFingerprint() {
        return configFingerprint;
    }

    public List<ResolvedEntity> getEntities() {
        return entities;
    }

    public List<EntityMentionLink> getLinks() {
        return links;
    }

    public Optional<ResolvedEntity> findEntity(String entityId) {
        return Optional.ofNullable(entitiesById.get(entityId));
    }

    public Optional<ResolvedEntity> findEntityForMention(String mentionId) {
        EntityMentionLink link = linksByMention.get(mentionId);
        return link == null ? Optional.empty() : findEntity(link.entityId());
    }

    public Optional<EntityMentionLink> findLink(String mentionId) {
        return Optional.ofNullable(linksByMention.get(mentionId));
    }

    public List<EntityMentionLink> linksForEntity(String entityId) {
        return links.stream()
                .filter(link -> link.entityId().equals(entityId))
                .collect(Collectors.toList());
    }

    public int entityCount() {
        return entities.size();
    }

    public int mentionCount() {
        return links.size();
    }

    @Override
    public String toString() {
        return "ResolutionSnapshot{runId='" + runId + "', entities=" + entities.size()
                + ", links=" + links.size() + ", committedAt=" + committedAt + '}';
    }
}
