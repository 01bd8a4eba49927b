package com.contestfeed.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A submission as published on the CCS feed. Immutable once created.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "team_id", "problem_id", "language_id", "time", "contest_time"})
public record Submission(
    @JsonProperty("id") String id,
    @JsonProperty("team_id") String teamId,
    @JsonProperty("problem_id") String problemId,
    @JsonProperty("language_id") String languageId,
    @JsonProperty("time") String time,
    @JsonProperty("contest_time") String contestTime
) {

    /** Contest-relative submission time, used for ordering. */
    @JsonIgnore
    public long contestTimeMillis() {
        return CcsTime.parseRelTime(contestTime);
    }
}
