package com.contestfeed.infrastructure.scraper.algotester;

import com.contestfeed.domain.model.ScoreboardRow;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses rows of the Algotester {@code ListScoreboardWithAPI} response.
 *
 * <pre>
 * {"Id": 17, "Contestant": {"Text": "Team"}, "Rank": 3, "Score": 2, "PenaltyMs": 5400000,
 *  "IsUnofficial": false, "Group": {"Text": "..."},
 *  "Results": {"1021": {"IsAccepted": true, "Attempts": 1, "PendingAttempts": 0,
 *                       "LastImprovementMs": 1800000, "PenaltyMs": 3000000, "IsFirstAccepted": false}}}
 * </pre>
 */
public class AlgotesterRowParser {

    private AlgotesterRowParser() {
    }

    public static ScoreboardRow parseRow(JsonNode row) {
        JsonNode id = row.get("Id");
        if (id == null || id.isNull()) {
            throw new IllegalArgumentException("Scoreboard row without Id");
        }

        Integer rank = row.hasNonNull("Rank") ? row.get("Rank").asInt() : null;
        return new ScoreboardRow(
            id.asText(),
            row.path("Contestant").path("Text").asText("").trim(),
            rank,
            row.path("Score").asDouble(0),
            row.path("PenaltyMs").asLong(0),
            row.path("IsUnofficial").asBoolean(false),
            row.path("Group").path("Text").asText(""),
            parseResults(row.path("Results"))
        );
    }

    static Map<String, ScoreboardRow.ProblemResult> parseResults(JsonNode results) {
        Map<String, ScoreboardRow.ProblemResult> parsed = new LinkedHashMap<>();
        if (results == null || !results.isObject()) {
            return parsed;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = results.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode result = field.getValue();
            parsed.put(field.getKey(), new ScoreboardRow.ProblemResult(
                result.path("IsAccepted").asBoolean(false),
                result.path("Attempts").asInt(0),
                result.path("PendingAttempts").asInt(0),
                result.path("LastImprovementMs").asLong(0),
                result.path("PenaltyMs").asLong(0),
                result.path("IsFirstAccepted").asBoolean(false)
            ));
        }
        return parsed;
    }
}
