package com.identity.resolution.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.identity.resolution.audit.MergeDecisionRecord;
import com.identity.resolution.core.model.ScoreSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes merge decision records as JSON Lines, one decision per line, for audit tooling.
 *
 * <pre>
 * {"id":"...","runId":"...","mentionIdA":"m1","mentionIdB":"m2","origin":"BLOCK","compositeScore":0.97,
 *  "signals":{"phonetic":1.0,"edit":0.95,"cosine":null,"typeConflict":false,"capApplied":false},
 *  "outcome":"AUTO_MERGE","tLow":0.6,"tHigh":0.9,"blockingKeyVersion":"v1","embeddingModelId":null,
 *  "evaluatedAt":"2024-01-01T00:00:00Z"}
 * </pre>
 */
public class JsonLinesDecisionLogExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesDecisionLogExporter.class);

    private final ObjectMapper objectMapper;

    public JsonLinesDecisionLogExporter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ExportResult export(List<MergeDecisionRecord> records, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        long written = 0;
        try {
            BufferedWriter out = new BufferedWriter(writer);
            for (MergeDecisionRecord record : records) {
                out.write(toJson(record));
                out.newLine();
                written++;
                if (written % 1000 == 0) {
                    cb.onProgress(written, records.size(), "Exported " + written + " decisions");
                }
            }
            out.flush();
        } catch (IOException e) {
            log.error("export.failed format=jsonl written={} error={}", written, e.getMessage());
            throw new UncheckedIOException("Failed to export decision log", e);
        }
        cb.onProgress(written, written, "Export completed");
        ExportResult result = new ExportResult(getFormat(), written);
        log.info("export.completed result={}", result);
        return result;
    }

    public String getFormat() {
        return "jsonl";
    }

    String toJson(MergeDecisionRecord record) throws JsonProcessingException {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("id", record.id());
        line.put("runId", record.runId());
        line.put("mentionIdA", record.mentionIdA());
        line.put("mentionIdB", record.mentionIdB());
        line.put("origin", record.origin().name());
        line.put("compositeScore", record.compositeScore());
        line.put("signals", signals(record.signals()));
        line.put("outcome", record.outcome().name());
        line.put("tLow", record.tLow());
        line.put("tHigh", record.tHigh());
        line.put("blockingKeyVersion", record.blockingKeyVersion());
        line.put("embeddingModelId", record.embeddingModelId());
        line.put("evaluatedAt", record.evaluatedAt());
        return objectMapper.writeValueAsString(line);
    }

    private static Map<String, Object> signals(ScoreSignals signals) {
        if (signals == null) {
            return null;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("phonetic", signals.phonetic());
        map.put("edit", signals.edit());
        map.put("cosine", signals.cosine());
        map.put("typeConflict", signals.typeConflict());
        map.put("capApplied", signals.capApplied());
        return map;
    }
}
