package com.contestfeed.domain.service;

import com.contestfeed.domain.exception.InconsistentVerdictException;
import com.contestfeed.domain.model.Judgement;
import com.contestfeed.domain.model.NormalizedSnapshot;
import com.contestfeed.domain.model.Submission;
import com.contestfeed.domain.model.Transition;
import com.contestfeed.domain.ports.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compares the candidates of one tick against the last-known state and lists the
 * transitions that must become events.
 *
 * <p>Transitions are ordered by submission contest time, then submission id, and a
 * submission always precedes any judgement of it.
 */
public class DiffEngine {

    private static final Logger logger = LoggerFactory.getLogger(DiffEngine.class);

    private static final Comparator<OrderedTransition> ORDER = Comparator
        .comparingLong(OrderedTransition::contestTimeMillis)
        .thenComparing(OrderedTransition::submissionId)
        .thenComparingInt(OrderedTransition::phase);

    private final StateStore stateStore;

    public DiffEngine(StateStore stateStore) {
        this.stateStore = stateStore;
    }

    public DiffResult diff(NormalizedSnapshot snapshot) {
        Map<String, Submission> candidates = new LinkedHashMap<>();
        for (Submission submission : snapshot.submissions()) {
            candidates.putIfAbsent(submission.id(), submission);
        }

        List<OrderedTransition> ordered = new ArrayList<>();
        for (Submission candidate : candidates.values()) {
            if (stateStore.lastKnownSubmission(candidate.id()).isEmpty()) {
                ordered.add(new OrderedTransition(candidate.contestTimeMillis(), candidate.id(), 0,
                    Transition.newSubmission(candidate)));
            }
        }

        List<InconsistentVerdictException> rejected = new ArrayList<>();
        Set<String> seenJudgements = new HashSet<>();
        for (Judgement candidate : snapshot.judgements()) {
            if (!seenJudgements.add(candidate.id())) {
                continue;
            }

            Submission owner = stateStore.lastKnownSubmission(candidate.submissionId())
                .orElse(candidates.get(candidate.submissionId()));
            if (owner == null) {
                logger.warn("Skipping judgement {} of unknown submission {}", candidate.id(), candidate.submissionId());
                continue;
            }

            try {
                Transition transition = judgementTransition(stateStore.lastKnownJudgement(candidate.id()), candidate);
                if (transition != null) {
                    ordered.add(new OrderedTransition(owner.contestTimeMillis(), owner.id(), 1, transition));
                }
            } catch (InconsistentVerdictException e) {
                logger.warn("Upstream verdict regression, judgement skipped: {}", e.getMessage());
                rejected.add(e);
            }
        }

        ordered.sort(ORDER);
        List<Transition> transitions = ordered.stream().map(OrderedTransition::transition).toList();
        return new DiffResult(transitions, rejected);
    }

    /**
     * @return the transition, or null when the candidate brings nothing new
     * @throws InconsistentVerdictException if a terminal verdict would change
     */
    private Transition judgementTransition(Optional<Judgement> stored, Judgement candidate) {
        if (stored.isEmpty()) {
            // Nothing to publish until the judgement has an outcome
            return candidate.verdict().isTerminal() ? Transition.newJudgement(candidate) : null;
        }

        Judgement previous = stored.get();
        if (!previous.verdict().isTerminal()) {
            return candidate.verdict().isTerminal() ? Transition.verdictChanged(previous, candidate) : null;
        }

        if (previous.verdict() == candidate.verdict()) {
            return null;
        }
        throw new InconsistentVerdictException(candidate.id(), previous.verdict(), candidate.verdict());
    }

    private record OrderedTransition(long contestTimeMillis, String submissionId, int phase, Transition transition) {}

    /**
     * @param rejected candidates dropped because they contradict a terminal verdict
     */
    public record DiffResult(List<Transition> transitions, List<InconsistentVerdictException> rejected) {}
}
