package com.contestfeed.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A judgement of one submission.
 *
 * <p>{@code judgementTypeId} and the end times stay null while the judgement is pending.
 * Once a terminal verdict is recorded the judgement never changes again.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"id", "submission_id", "judgement_type_id", "start_time", "start_contest_time",
    "end_time", "end_contest_time"})
public record Judgement(
    @JsonProperty("id") String id,
    @JsonProperty("submission_id") String submissionId,
    @JsonProperty("judgement_type_id") String judgementTypeId,
    @JsonProperty("start_time") String startTime,
    @JsonProperty("start_contest_time") String startContestTime,
    @JsonProperty("end_time") String endTime,
    @JsonProperty("end_contest_time") String endContestTime
) {

    @JsonIgnore
    public Verdict verdict() {
        return Verdict.fromCode(judgementTypeId);
    }
}
