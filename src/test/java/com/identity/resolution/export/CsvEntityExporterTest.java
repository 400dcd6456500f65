package com.identity.resolution.export;

import com.identity.resolution.core.model.EntityMentionLink;
import com.identity.resolution.core.model.ParseType;
import com.identity.resolution.core.model.ResolvedEntity;
import com.identity.resolution.core.model.SuppressionReason;
import com.identity.resolution.store.PublicProjection;
import com.identity.resolution.store.ResolutionSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CsvEntityExporterTest {

    private final CsvEntityExporter exporter = new CsvEntityExporter();

    private static PublicProjection projection() {
        ResolvedEntity merged = ResolvedEntity.builder()
                .entityId("e1")
                .canonicalName("Epstein, Jeffrey")
                .canonicalMentionId("m1")
                .entityType(ParseType.PERSON)
                .memberMentionIds(Set.of("m1", "m2"))
                .verified(true)
                .bestParseConfidence(0.9)
                .build();
        ResolvedEntity hidden = ResolvedEntity.builder()
                .entityId("e2")
                .canonicalName("Female (1)")
                .canonicalMentionId("m3")
                .memberMentionIds(Set.of("m3"))
                .suppressionReasons(Set.of(SuppressionReason.PLACEHOLDER_IDENTITY))
                .build();
        ResolutionSnapshot snapshot = new ResolutionSnapshot("run-1", Instant.now(), null,
                List.of(merged, hidden),
                List.of(new EntityMentionLink("e1", "m1", 0.97),
                        new EntityMentionLink("e1", "m2", 0.97),
                        new EntityMentionLink("e2", "m3", 1.0)));
        return PublicProjection.of(snapshot, 0.5);
    }

    @Test
    @DisplayName("Should export visible entities and their links")
    void testExport() {
        StringWriter out = new StringWriter();
        List<Long> progress = new ArrayList<>();

        ExportResult result = exporter.export(projection(), out, (processed, total, message) -> progress.add(processed));

        String expected = String.join(System.lineSeparator(),
                "# ENTITIES",
                "entityId,canonicalName,entityType,verified,memberCount",
                "e1,\"Epstein, Jeffrey\",PERSON,true,2",
                "",
                "# LINKS",
                "entityId,mentionId,compositeScore",
                "e1,m1,0.9700",
                "e1,m2,0.9700",
                "");
        assertEquals(expected, out.toString());
        assertEquals("csv", result.format());
        assertEquals(3, result.totalRecords());
        assertFalse(progress.isEmpty());
    }

    @Test
    @DisplayName("Should escape quotes and commas")
    void testEscape() {
        assertEquals("\"Acme, \"\"The\"\" Corp\"", CsvEntityExporter.csvEscape("Acme, \"The\" Corp"));
        assertEquals("plain", CsvEntityExporter.csvEscape("plain"));
        assertEquals("", CsvEntityExporter.csvEscape(null));
    }

    @Test
    @DisplayName("Should quote values containing line breaks")
    void testEscapeLineBreaks() {
        assertEquals("\"Maria\nFarmer\"", CsvEntityExporter.csvEscape("Maria\nFarmer"));
        assertEquals("\"Maria\rFarmer\"", CsvEntityExporter.csvEscape("Maria\rFarmer"));
        assertEquals("\"Maria\r\nFarmer\"", CsvEntityExporter.csvEscape("Maria\r\nFarmer"));
    }

    @Test
    @DisplayName("Write failures surface as UncheckedIOException")
    void testWriteFailure() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void close() {
            }
        };

        assertThrows(UncheckedIOException.class, () -> exporter.export(projection(), broken, null));
    }
}
