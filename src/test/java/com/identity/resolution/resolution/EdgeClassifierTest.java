package com.identity.resolution.resolution;

import com.identity.resolution.core.model.CandidateOrigin;
import com.identity.resolution.core.model.CandidatePair;
import com.identity.resolution.core.model.EdgeDecision;
import com.identity.resolution.core.model.MentionPair;
import com.identity.resolution.core.model.ScoreSignals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EdgeClassifier Tests")
class EdgeClassifierTest {

    private final EdgeClassifier classifier = new EdgeClassifier(0.60, 0.90, 0.95);

    private static CandidatePair pair(double score, CandidateOrigin origin) {
        return new CandidatePair(MentionPair.of("m1", "m2"), origin, score,
                new ScoreSignals(0.0, score, null, false, false));
    }

    @ParameterizedTest(name = "{0} from {1} -> {2}")
    @CsvSource({
            "0.95, BLOCK, AUTO_MERGE",
            "0.90, BLOCK, AUTO_MERGE",
            "0.89, BLOCK, REVIEW",
            "0.60, BLOCK, REVIEW",
            "0.59, BLOCK, NO_MATCH",
            "0.92, EMBEDDING, REVIEW",
            "0.95, EMBEDDING, AUTO_MERGE",
            "0.74, LOW_CONFIDENCE_BLOCK, REVIEW"
    })
    void classifies(double score, CandidateOrigin origin, EdgeDecision expected) {
        assertEquals(expected, classifier.classify(pair(score, origin)));
    }

    @Test
    @DisplayName("Embedding pairs use the stricter high threshold")
    void effectiveHigh() {
        assertEquals(0.90, classifier.effectiveHigh(CandidateOrigin.BLOCK));
        assertEquals(0.95, classifier.effectiveHigh(CandidateOrigin.EMBEDDING));
    }

    @Test
    @DisplayName("Should reject inconsistent thresholds")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new EdgeClassifier(0.9, 0.6, 0.95));
        assertThrows(IllegalArgumentException.class, () -> new EdgeClassifier(0.6, 0.9, 0.85));
    }
}
