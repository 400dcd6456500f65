package com.identity.resolution.core.model;

import java.util.Objects;

/**
 * Opaque pointer to the record a mention was extracted from.
 * The resolution pipeline carries it through untouched and never interprets its fields.
 *
 * @param sourceTable    table the mention was read from (e.g. {@code flight_passengers})
 * @param sourceId       row identifier within that table
 * @param originCorpus   originating corpus (e.g. {@code flight_logs}, {@code black_book}), nullable
 * @param originRecordId record identifier within the originating corpus, nullable
 */
public record SourceReference(
        String sourceTable,
        String sourceId,
        String originCorpus,
        String originRecordId
) {
    public SourceReference {
        Objects.requireNonNull(sourceTable, "sourceTable is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
    }

    public static SourceReference of(String sourceTable, String sourceId) {
        return new SourceReference(sourceTable, sourceId, null, null);
    }

    @Override
    public String toString() {
        return sourceTable + "/" + sourceId;
    }
}
