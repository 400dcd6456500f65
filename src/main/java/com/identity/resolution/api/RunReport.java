package com.identity.resolution.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Non-fatal issues of one run: a count per category and up to {@code exampleLimit}
 * example ids each.
 */
public final class RunReport {

    private final int exampleLimit;
    private final Map<RunIssue, Integer> counts = new EnumMap<>(RunIssue.class);
    private final Map<RunIssue, List<String>> examples = new EnumMap<>(RunIssue.class);

    public RunReport(int exampleLimit) {
        if (exampleLimit < 0) {
            throw new IllegalArgumentException("exampleLimit must be >= 0");
        }
        this.exampleLimit = exampleLimit;
    }

    public synchronized void add(RunIssue issue, String exampleId) {
        counts.merge(issue, 1, Integer::sum);
        List<String> list = examples.computeIfAbsent(issue, k -> new ArrayList<>());
        if (list.size() < exampleLimit && exampleId != null) {
            list.add(exampleId);
        }
    }

    public synchronized int count(RunIssue issue) {
        return counts.getOrDefault(issue, 0);
    }

    public synchronized List<String> examples(RunIssue issue) {
        return List.copyOf(examples.getOrDefault(issue, Collections.emptyList()));
    }

    public synchronized int skippedMentions() {
        int total = 0;
        for (Map.Entry<RunIssue, Integer> e : counts.entrySet()) {
            if (e.getKey().skipsMention()) {
                total += e.getValue();
            }
        }
        return total;
    }

    public synchronized boolean isClean() {
        return counts.isEmpty();
    }

    public synchronized Map<RunIssue, Integer> counts() {
        return Collections.unmodifiableMap(new EnumMap<>(counts));
    }

    @Override
    public synchronized String toString() {
        return "RunReport" + counts;
    }
}
