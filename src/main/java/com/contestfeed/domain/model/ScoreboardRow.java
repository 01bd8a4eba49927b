package com.contestfeed.domain.model;

import java.util.Map;

/**
 * One team's row of a polled scoreboard, keyed by upstream identifiers.
 *
 * @param results per upstream problem id
 */
public record ScoreboardRow(
    String teamId,
    String teamName,
    Integer rank,
    double score,
    long penaltyMs,
    boolean unofficial,
    String group,
    Map<String, ProblemResult> results
) {

    /**
     * Aggregated result of a team on one problem.
     *
     * @param attempts        rejected attempts (the accepted one is not counted)
     * @param pendingAttempts attempts still waiting for a verdict
     * @param timeMs          contest time of the last improvement
     */
    public record ProblemResult(
        boolean accepted,
        int attempts,
        int pendingAttempts,
        long timeMs,
        long penaltyMs,
        boolean firstAccepted
    ) {}
}
