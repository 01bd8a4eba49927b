package com.contestfeed.domain.model;

import java.util.List;

/**
 * Candidate records of one tick, keyed by contest-package identifiers.
 *
 * @param unmappedRecords records dropped because a team or problem had no mapping
 */
public record NormalizedSnapshot(
    List<Submission> submissions,
    List<Judgement> judgements,
    int unmappedRecords
) {

    public NormalizedSnapshot {
        submissions = List.copyOf(submissions);
        judgements = List.copyOf(judgements);
    }
}
