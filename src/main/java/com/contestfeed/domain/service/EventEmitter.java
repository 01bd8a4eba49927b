package com.contestfeed.domain.service;

import com.contestfeed.domain.model.EventOp;
import com.contestfeed.domain.model.EventType;
import com.contestfeed.domain.model.FeedEvent;
import com.contestfeed.domain.model.Judgement;
import com.contestfeed.domain.model.Submission;
import com.contestfeed.domain.model.Transition;
import com.contestfeed.domain.ports.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns transitions into feed events, one committed event at a time.
 */
public class EventEmitter {

    private static final Logger logger = LoggerFactory.getLogger(EventEmitter.class);

    private final StateStore stateStore;

    public EventEmitter(StateStore stateStore) {
        this.stateStore = stateStore;
    }

    /**
     * Appends one event per transition, in order. Each event is committed before the next
     * token is assigned.
     *
     * @return the committed events
     * @throws com.contestfeed.domain.exception.StoreUnavailableException if an append fails;
     *         events committed before the failure stay in the log
     */
    public List<FeedEvent> emit(List<Transition> transitions) {
        List<FeedEvent> emitted = new ArrayList<>(transitions.size());
        for (Transition transition : transitions) {
            FeedEvent event = toEvent(transition, stateStore.lastToken() + 1);
            stateStore.append(event);
            logEvent(event);
            emitted.add(event);
        }
        return emitted;
    }

    static FeedEvent toEvent(Transition transition, long token) {
        return switch (transition.kind()) {
            case NEW_SUBMISSION -> new FeedEvent(token, transition.submission().id(),
                EventType.SUBMISSIONS, EventOp.CREATE, transition.submission());
            case NEW_JUDGEMENT -> new FeedEvent(token, transition.judgement().id(),
                EventType.JUDGEMENTS, EventOp.CREATE, transition.judgement());
            case JUDGEMENT_VERDICT_CHANGED -> new FeedEvent(token, transition.judgement().id(),
                EventType.JUDGEMENTS, EventOp.UPDATE, transition.judgement());
        };
    }

    private void logEvent(FeedEvent event) {
        if (event.data() instanceof Submission submission) {
            logger.info("New submission: {} (team={}, problem={}, token={})",
                submission.id(), submission.teamId(), submission.problemId(), event.token());
        } else if (event.data() instanceof Judgement judgement) {
            logger.info("New judgement: {} (submission={}, result={}, token={})",
                judgement.id(), judgement.submissionId(), judgement.verdict(), event.token());
        }
    }
}
