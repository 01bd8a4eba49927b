package com.contestfeed.domain.model;

import java.util.Arrays;

/**
 * Judgement outcomes published as CCS judgement types.
 * {@link #PENDING} has no judgement type id and is never published as a type.
 */
public enum Verdict {
    ACCEPTED("AC", "Accepted", false, true),
    WRONG_ANSWER("WA", "Wrong Answer", true, false),
    TIME_LIMIT("TLE", "Time Limit Exceeded", true, false),
    RUN_TIME_ERROR("RTE", "Run-Time Error", true, false),
    COMPILE_ERROR("CE", "Compile Error", false, false),
    PENDING(null, "Pending", false, false);

    private final String code;
    private final String displayName;
    private final boolean penalty;
    private final boolean solved;

    Verdict(String code, String displayName, boolean penalty, boolean solved) {
        this.code = code;
        this.displayName = displayName;
        this.penalty = penalty;
        this.solved = solved;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isPenalty() {
        return penalty;
    }

    public boolean isSolved() {
        return solved;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Resolves a CCS judgement type id. A null id means the judgement is still pending.
     */
    public static Verdict fromCode(String code) {
        if (code == null) {
            return PENDING;
        }
        return Arrays.stream(values())
            .filter(v -> code.equals(v.code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown judgement type: " + code));
    }

    @Override
    public String toString() {
        return code != null ? code : "PENDING";
    }
}
