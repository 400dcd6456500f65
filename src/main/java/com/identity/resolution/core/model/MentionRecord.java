package com.identity.resolution.core.model;

/**
 * A mention as delivered by the upstream extraction collaborator, before parsing.
 * Fields are not validated here; the pipeline rejects incomplete records with a report entry
 * instead of failing the run.
 *
 * @param mentionId       unique mention identifier
 * @param sourceReference pointer to the originating record
 * @param rawName         name text as extracted
 * @param hints           optional structured hints (never null after construction)
 * @param embedding       optional name embedding produced by an external model, or null
 */
public record MentionRecord(
        String mentionId,
        SourceReference sourceReference,
        String rawName,
        MentionHints hints,
        float[] embedding
) {
    public MentionRecord {
        hints = hints != null ? hints : MentionHints.none();
        embedding = embedding != null ? embedding.clone() : null;
    }

    public MentionRecord(String mentionId, SourceReference sourceReference, String rawName) {
        this(mentionId, sourceReference, rawName, MentionHints.none(), null);
    }

    @Override
    public float[] embedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
