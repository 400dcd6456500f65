package com.identity.resolution.export;

import com.identity.resolution.core.model.EntityMentionLink;
import com.identity.resolution.core.model.ResolvedEntity;
import com.identity.resolution.store.PublicProjection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Locale;

/**
 * Exports the public projection of a snapshot as CSV.
 *
 * <p>Output format:</p>
 * <pre>
 * # ENTITIES
 * entityId,canonicalName,entityType,verified,memberCount
 * 3f2a...,Jeffrey Epstein,PERSON,true,2
 * 9b1c...,"Smith, John & Jane",HOUSEHOLD,false,1
 *
 * # LINKS
 * entityId,mentionId,compositeScore
 * 3f2a...,m-1,0.97
 * </pre>
 *
 * <p>Values are quoted only when they contain a comma, a double quote or a line break.</p>
 */
public class CsvEntityExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvEntityExporter.class);

    public ExportResult export(PublicProjection projection, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        long total = projection.getEntities().size();
        long rows = 0;

        pw.println("# ENTITIES");
        pw.println("entityId,canonicalName,entityType,verified,memberCount");
        for (ResolvedEntity entity : projection.getEntities()) {
            pw.printf(Locale.ROOT, "%s,%s,%s,%b,%d%n",
                    csvEscape(entity.getEntityId()),
                    csvEscape(entity.getCanonicalName()),
                    entity.getEntityType().name(),
                    entity.isVerified(),
                    entity.size());
            rows++;
            cb.onProgress(rows, total, "Exported " + rows + " entities");
        }

        pw.println();
        pw.println("# LINKS");
        pw.println("entityId,mentionId,compositeScore");
        for (EntityMentionLink link : projection.getLinks()) {
            pw.printf(Locale.ROOT, "%s,%s,%.4f%n",
                    csvEscape(link.entityId()),
                    csvEscape(link.mentionId()),
                    link.compositeScore());
            rows++;
        }
        pw.flush();
        if (pw.checkError()) {
            log.error("export.failed format=csv runId={}", projection.getRunId());
            throw new UncheckedIOException(new IOException("Failed to write CSV export"));
        }

        ExportResult result = new ExportResult(getFormat(), rows);
        cb.onProgress(total, total, "Export completed");
        log.info("export.completed runId={} result={}", projection.getRunId(), result);
        return result;
    }

    public String getFormat() {
        return "csv";
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
