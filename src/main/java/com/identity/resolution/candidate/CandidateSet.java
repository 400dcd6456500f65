package com.identity.resolution.candidate;

import com.identity.resolution.core.model.CandidateOrigin;
import com.identity.resolution.core.model.CandidatePair;

import java.util.List;

/**
 * Scored, deduplicated candidate pairs of one run, sorted by pair.
 *
 * @param pairs           candidate pairs, unique per mention pair
 * @param oversizedBlocks keys of blocks that were sampled with the sliding window
 * @param blockCount      number of blocks processed
 */
public record CandidateSet(List<CandidatePair> pairs, List<String> oversizedBlocks, int blockCount) {

    public CandidateSet {
        pairs = List.copyOf(pairs);
        oversizedBlocks = List.copyOf(oversizedBlocks);
    }

    public long count(CandidateOrigin origin) {
        return pairs.stream().filter(p -> p.origin() == origin).count();
    }

    public int size() {
        return pairs.size();
    }
}
