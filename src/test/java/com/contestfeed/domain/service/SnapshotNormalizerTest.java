package com.contestfeed.domain.service;

import com.contestfeed.domain.model.Judgement;
import com.contestfeed.domain.model.NormalizedSnapshot;
import com.contestfeed.domain.model.ScoreboardRow;
import com.contestfeed.domain.model.ScoreboardSnapshot;
import com.contestfeed.domain.model.Submission;
import com.contestfeed.domain.model.Verdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static com.contestfeed.support.Scoreboards.pending;
import static com.contestfeed.support.Scoreboards.result;
import static com.contestfeed.support.Scoreboards.row;
import static com.contestfeed.support.Scoreboards.snapshot;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SnapshotNormalizer.
 */
class SnapshotNormalizerTest {

    private SnapshotNormalizer normalizer;

    @BeforeEach
    void setUp() {
        IdentityMapper mapper = new IdentityMapper(
            Map.of("101", "T1", "102", "T2"),
            Map.of("9001", "P1", "9002", "P2")
        );
        normalizer = new SnapshotNormalizer(mapper, OffsetDateTime.parse("2025-01-01T10:00:00+02:00"), "cpp");
    }

    @Test
    void testPendingAttemptHasNoJudgement() {
        NormalizedSnapshot normalized = normalizer.normalize(snapshot(
            row("101", Map.of("9001", pending(1, 600_000)))
        ));

        assertEquals(1, normalized.submissions().size());
        assertTrue(normalized.judgements().isEmpty());

        Submission submission = normalized.submissions().get(0);
        assertEquals("T1-P1-1", submission.id());
        assertEquals("T1", submission.teamId());
        assertEquals("P1", submission.problemId());
        assertEquals("cpp", submission.languageId());
        assertEquals("0:10:00.000", submission.contestTime());
        assertEquals("2025-01-01T10:10:00.000+02:00", submission.time());
    }

    @Test
    void testRejectedAttemptsPrecedeAcceptedOne() {
        NormalizedSnapshot normalized = normalizer.normalize(snapshot(
            row("101", Map.of("9001", result(true, 2, 0, 3_000_000)))
        ));

        List<Submission> submissions = normalized.submissions();
        assertEquals(List.of("T1-P1-1", "T1-P1-2", "T1-P1-3"),
            submissions.stream().map(Submission::id).toList());
        assertEquals("0:12:30.000", submissions.get(0).contestTime());
        assertEquals("0:25:00.000", submissions.get(1).contestTime());
        assertEquals("0:50:00.000", submissions.get(2).contestTime());

        List<Judgement> judgements = normalized.judgements();
        assertEquals(3, judgements.size());
        assertEquals(Verdict.WRONG_ANSWER, judgements.get(0).verdict());
        assertEquals(Verdict.WRONG_ANSWER, judgements.get(1).verdict());
        assertEquals(Verdict.ACCEPTED, judgements.get(2).verdict());
        assertEquals("T1-P1-3", judgements.get(2).submissionId());
        assertEquals(judgements.get(2).submissionId(), judgements.get(2).id());
        assertEquals("0:50:00.000", judgements.get(2).endContestTime());
    }

    @Test
    void testJudgedPendingAttemptKeepsItsId() {
        NormalizedSnapshot before = normalizer.normalize(snapshot(
            row("101", Map.of("9001", pending(1, 600_000)))
        ));
        NormalizedSnapshot after = normalizer.normalize(snapshot(
            row("101", Map.of("9001", result(true, 0, 0, 600_000)))
        ));

        assertEquals(before.submissions(), after.submissions());
        assertEquals("T1-P1-1", after.judgements().get(0).submissionId());
    }

    @Test
    void testUnmappedTeamIsCountedAndDropped() {
        NormalizedSnapshot normalized = normalizer.normalize(snapshot(
            row("999", Map.of("9001", pending(1, 60_000))),
            row("102", Map.of("9002", result(true, 0, 0, 120_000)))
        ));

        assertEquals(1, normalized.unmappedRecords());
        assertEquals(1, normalized.submissions().size());
        assertEquals("T2", normalized.submissions().get(0).teamId());
    }

    @Test
    void testUnmappedProblemIsCountedAndDropped() {
        NormalizedSnapshot normalized = normalizer.normalize(snapshot(
            row("101", Map.of("9001", pending(1, 60_000), "7777", pending(2, 60_000)))
        ));

        assertEquals(1, normalized.unmappedRecords());
        assertEquals(List.of("T1-P1-1"), normalized.submissions().stream().map(Submission::id).toList());
    }

    @Test
    void testUntouchedProblemsProduceNothing() {
        NormalizedSnapshot normalized = normalizer.normalize(snapshot(
            row("101", Map.of("9001", result(false, 0, 0, 0)))
        ));

        assertTrue(normalized.submissions().isEmpty());
        assertTrue(normalized.judgements().isEmpty());
        assertEquals(0, normalized.unmappedRecords());
    }

    @Test
    void testOutputDoesNotDependOnRowOrder() {
        ScoreboardRow first = row("101", Map.of("9001", result(true, 1, 0, 900_000), "9002", pending(1, 300_000)));
        ScoreboardRow second = row("102", Map.of("9001", result(false, 3, 1, 900_000)));

        NormalizedSnapshot a = normalizer.normalize(snapshot(first, second));
        NormalizedSnapshot b = normalizer.normalize(snapshot(second, first));

        assertEquals(a, b);
    }

    @Test
    void testSubmissionsSortedByContestTimeThenId() {
        NormalizedSnapshot normalized = normalizer.normalize(new ScoreboardSnapshot(List.of(
            row("102", Map.of("9001", pending(1, 60_000))),
            row("101", Map.of("9002", pending(1, 60_000), "9001", pending(1, 30_000)))
        )));

        assertEquals(List.of("T1-P1-1", "T1-P2-1", "T2-P1-1"),
            normalized.submissions().stream().map(Submission::id).toList());
    }
}
