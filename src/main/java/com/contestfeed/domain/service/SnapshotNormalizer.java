package com.contestfeed.domain.service;

import com.contestfeed.domain.exception.UnmappedIdentifierException;
import com.contestfeed.domain.model.CcsTime;
import com.contestfeed.domain.model.Judgement;
import com.contestfeed.domain.model.NormalizedSnapshot;
import com.contestfeed.domain.model.ScoreboardRow;
import com.contestfeed.domain.model.ScoreboardSnapshot;
import com.contestfeed.domain.model.Submission;
import com.contestfeed.domain.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Expands the per team/problem aggregates of a scoreboard into individual submissions
 * and judgements.
 *
 * <p>The scoreboard only tells how many attempts a team made on a problem, so submissions
 * get positional ids {@code <team>-<problem>-<n>}:
 * <ol>
 *   <li>{@code n = 1..attempts}: rejected attempts, spread evenly before the last improvement</li>
 *   <li>{@code n = attempts + 1}: the accepted attempt, if any, at the last improvement</li>
 *   <li>then one submission per pending attempt, without a judgement</li>
 * </ol>
 * A pending attempt that gets judged keeps its position, so its id stays stable across ticks.
 *
 * <p>Output depends only on the snapshot content: results are visited in key order and
 * both lists are sorted by contest time and id.
 */
public class SnapshotNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotNormalizer.class);

    private static final Comparator<Submission> SUBMISSION_ORDER =
        Comparator.comparingLong(Submission::contestTimeMillis).thenComparing(Submission::id);

    private final IdentityMapper identityMapper;
    private final OffsetDateTime contestStart;
    private final String languageId;

    // Only used to keep the log readable, never affects the output
    private final Set<String> reportedUnmapped = ConcurrentHashMap.newKeySet();

    public SnapshotNormalizer(IdentityMapper identityMapper, OffsetDateTime contestStart, String languageId) {
        this.identityMapper = identityMapper;
        this.contestStart = contestStart;
        this.languageId = languageId;
    }

    public NormalizedSnapshot normalize(ScoreboardSnapshot snapshot) {
        List<Submission> submissions = new ArrayList<>();
        List<Judgement> judgements = new ArrayList<>();
        int unmapped = 0;

        for (ScoreboardRow row : snapshot.rows()) {
            String teamId;
            try {
                teamId = identityMapper.mapTeam(row.teamId());
            } catch (UnmappedIdentifierException e) {
                reportUnmapped(e, row.teamName());
                unmapped++;
                continue;
            }

            if (row.results() == null) {
                continue;
            }
            Map<String, ScoreboardRow.ProblemResult> results = new TreeMap<>(row.results());
            for (Map.Entry<String, ScoreboardRow.ProblemResult> entry : results.entrySet()) {
                String problemId;
                try {
                    problemId = identityMapper.mapProblem(entry.getKey());
                } catch (UnmappedIdentifierException e) {
                    reportUnmapped(e, null);
                    unmapped++;
                    continue;
                }
                expand(teamId, problemId, entry.getValue(), submissions, judgements);
            }
        }

        submissions.sort(SUBMISSION_ORDER);
        judgements.sort(Comparator.comparing(Judgement::startContestTime, Comparator.comparingLong(CcsTime::parseRelTime))
            .thenComparing(Judgement::id));

        return new NormalizedSnapshot(submissions, judgements, unmapped);
    }

    private void expand(String teamId, String problemId, ScoreboardRow.ProblemResult result,
                        List<Submission> submissions, List<Judgement> judgements) {
        int rejected = Math.max(result.attempts(), 0);
        int pending = Math.max(result.pendingAttempts(), 0);
        int judged = rejected + (result.accepted() ? 1 : 0);
        long lastImprovement = Math.max(result.timeMs(), 0);

        if (judged == 0 && pending == 0) {
            return;
        }

        int position = 0;
        for (int i = 1; i <= rejected; i++) {
            long at = Math.round(lastImprovement * i / (double) (judged + 1));
            Submission submission = submission(teamId, problemId, ++position, at);
            submissions.add(submission);
            judgements.add(judgement(submission, Verdict.WRONG_ANSWER, at));
        }

        if (result.accepted()) {
            Submission submission = submission(teamId, problemId, ++position, lastImprovement);
            submissions.add(submission);
            judgements.add(judgement(submission, Verdict.ACCEPTED, lastImprovement));
        }

        for (int i = 0; i < pending; i++) {
            submissions.add(submission(teamId, problemId, ++position, lastImprovement));
        }
    }

    private Submission submission(String teamId, String problemId, int position, long contestTimeMs) {
        return new Submission(
            teamId + "-" + problemId + "-" + position,
            teamId,
            problemId,
            languageId,
            CcsTime.absoluteAt(contestStart, contestTimeMs),
            CcsTime.formatRelTime(contestTimeMs)
        );
    }

    private Judgement judgement(Submission submission, Verdict verdict, long contestTimeMs) {
        String absolute = CcsTime.absoluteAt(contestStart, contestTimeMs);
        String relative = CcsTime.formatRelTime(contestTimeMs);
        return new Judgement(submission.id(), submission.id(), verdict.getCode(),
            absolute, relative, absolute, relative);
    }

    private void reportUnmapped(UnmappedIdentifierException e, String displayName) {
        String key = e.getKind() + ":" + e.getExternalId();
        if (reportedUnmapped.add(key)) {
            logger.warn("Skipping scoreboard record: {}{}", e.getMessage(),
                displayName != null ? " (" + displayName + ")" : "");
        } else {
            logger.debug("Skipping scoreboard record: {}", e.getMessage());
        }
    }
}
