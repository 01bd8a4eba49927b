package com.contestfeed.domain.model;

/**
 * A detected state change awaiting event emission.
 *
 * @param previous the stored judgement being replaced, only for {@link Kind#JUDGEMENT_VERDICT_CHANGED}
 */
public record Transition(Kind kind, Submission submission, Judgement judgement, Judgement previous) {

    public enum Kind {
        NEW_SUBMISSION,
        NEW_JUDGEMENT,
        JUDGEMENT_VERDICT_CHANGED
    }

    public static Transition newSubmission(Submission submission) {
        return new Transition(Kind.NEW_SUBMISSION, submission, null, null);
    }

    public static Transition newJudgement(Judgement judgement) {
        return new Transition(Kind.NEW_JUDGEMENT, null, judgement, null);
    }

    public static Transition verdictChanged(Judgement previous, Judgement judgement) {
        return new Transition(Kind.JUDGEMENT_VERDICT_CHANGED, null, judgement, previous);
    }

    /** Submission this transition belongs to. */
    public String submissionId() {
        return kind == Kind.NEW_SUBMISSION ? submission.id() : judgement.submissionId();
    }
}
