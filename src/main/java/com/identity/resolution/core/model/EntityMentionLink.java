package com.identity.resolution.core.model;

import java.util.Objects;

/**
 * Mapping row from a mention to the entity it resolved into.
 *
 * @param compositeScore highest accepted-edge score incident to the mention, 1.0 for singletons
 */
public record EntityMentionLink(String entityId, String mentionId, double compositeScore) {

    public EntityMentionLink {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(mentionId, "mentionId is required");
    }
}
