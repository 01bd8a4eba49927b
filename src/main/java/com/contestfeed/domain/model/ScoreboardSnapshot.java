package com.contestfeed.domain.model;

import java.util.List;

/**
 * The raw scoreboard observed during a single tick.
 */
public record ScoreboardSnapshot(List<ScoreboardRow> rows) {

    public ScoreboardSnapshot {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
