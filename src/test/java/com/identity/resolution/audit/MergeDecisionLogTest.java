package com.identity.resolution.audit;

import com.identity.resolution.core.model.CandidateOrigin;
import com.identity.resolution.core.model.EdgeDecision;
import com.identity.resolution.core.model.MentionPair;
import com.identity.resolution.core.model.ScoreSignals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MergeDecisionLogTest {

    private MergeDecisionLog decisionLog;

    @BeforeEach
    void setUp() {
        decisionLog = new MergeDecisionLog();
    }

    private static MergeDecisionRecord record(String runId, String a, String b, double score, EdgeDecision outcome) {
        return MergeDecisionRecord.builder()
                .runId(runId)
                .pair(MentionPair.of(a, b))
                .origin(CandidateOrigin.BLOCK)
                .compositeScore(score)
                .signals(new ScoreSignals(1.0, score, null, false, false))
                .outcome(outcome)
                .thresholds(0.6, 0.9)
                .blockingKeyVersion("v1")
                .build();
    }

    @Test
    @DisplayName("Should append records and query them")
    void testAppendAndQuery() {
        decisionLog.appendAll(List.of(
                record("run-1", "m1", "m2", 0.95, EdgeDecision.AUTO_MERGE),
                record("run-1", "m2", "m3", 0.70, EdgeDecision.REVIEW)));
        decisionLog.appendAll(List.of(record("run-2", "m2", "m3", 0.70, EdgeDecision.FORCED_MERGE)));

        assertEquals(3, decisionLog.size());
        assertEquals(2, decisionLog.getRecordsForRun("run-1").size());
        assertEquals(3, decisionLog.getRecordsForMention("m2").size());
        assertEquals(1, decisionLog.getRecordsByOutcome(EdgeDecision.REVIEW).size());
    }

    @Test
    @DisplayName("Latest decision for a pair spans runs")
    void testLatestFor() {
        decisionLog.append(record("run-1", "m2", "m3", 0.70, EdgeDecision.REVIEW));
        decisionLog.append(record("run-2", "m3", "m2", 0.70, EdgeDecision.FORCED_MERGE));

        MergeDecisionRecord latest = decisionLog.latestFor(MentionPair.of("m2", "m3")).orElseThrow();
        assertEquals("run-2", latest.runId());
        assertEquals(EdgeDecision.FORCED_MERGE, latest.outcome());
        assertTrue(decisionLog.latestFor(MentionPair.of("m1", "m9")).isEmpty());
    }

    @Test
    @DisplayName("Records cannot be modified through the returned list")
    void testImmutable() {
        decisionLog.append(record("run-1", "m1", "m2", 0.95, EdgeDecision.AUTO_MERGE));
        assertThrows(UnsupportedOperationException.class, () -> decisionLog.getAllRecords().clear());
    }

    @Test
    @DisplayName("Pair ids are canonical")
    void testCanonicalPair() {
        MergeDecisionRecord r = record("run-1", "m9", "m1", 0.5, EdgeDecision.NO_MATCH);
        assertEquals("m1", r.mentionIdA());
        assertEquals(MentionPair.of("m1", "m9"), r.pair());
    }
}
