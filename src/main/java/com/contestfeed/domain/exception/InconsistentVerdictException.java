package com.contestfeed.domain.exception;

import com.contestfeed.domain.model.Verdict;

/**
 * Raised when the upstream scoreboard reports a different outcome for a judgement
 * that already has a terminal verdict in the log. Terminal verdicts are immutable.
 */
public class InconsistentVerdictException extends FeedEngineException {

    private final String judgementId;
    private final Verdict stored;
    private final Verdict candidate;

    public InconsistentVerdictException(String judgementId, Verdict stored, Verdict candidate) {
        super("Judgement " + judgementId + " already judged " + stored + ", upstream now reports " + candidate);
        this.judgementId = judgementId;
        this.stored = stored;
        this.candidate = candidate;
    }

    public String getJudgementId() {
        return judgementId;
    }

    public Verdict getStored() {
        return stored;
    }

    public Verdict getCandidate() {
        return candidate;
    }
}
