package com.identity.resolution.api;

import com.identity.resolution.core.model.EdgeDecision;
import com.identity.resolution.core.model.ResolvedEntity;
import com.identity.resolution.store.ResolutionSnapshot;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a committed resolution run.
 *
 * @param runId                 the run id
 * @param snapshot              the snapshot the run committed
 * @param report                non-fatal issues met during the run
 * @param candidatePairs        number of scored candidate pairs
 * @param decisionCounts        classified edges per decision
 * @param reviewItemsSubmitted  review items newly queued by this run
 * @param newlySuppressed       entities suppressed for the first time by this run
 * @param duration              wall-clock duration of the run
 */
public record ResolutionRunResult(
        String runId,
        ResolutionSnapshot snapshot,
        RunReport report,
        int candidatePairs,
        Map<EdgeDecision, Long> decisionCounts,
        int reviewItemsSubmitted,
        int newlySuppressed,
        Duration duration
) {
    public ResolutionRunResult {
        decisionCounts = Collections.unmodifiableMap(decisionCounts.isEmpty()
                ? new EnumMap<>(EdgeDecision.class) : new EnumMap<>(decisionCounts));
    }

    public List<ResolvedEntity> entities() {
        return snapshot.getEntities();
    }

    public long count(EdgeDecision decision) {
        return decisionCounts.getOrDefault(decision, 0L);
    }
}
