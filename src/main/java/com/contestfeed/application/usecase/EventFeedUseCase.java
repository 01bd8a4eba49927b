package com.contestfeed.application.usecase;

import com.contestfeed.domain.exception.InvalidTokenException;
import com.contestfeed.domain.model.FeedEvent;
import com.contestfeed.domain.model.Judgement;
import com.contestfeed.domain.model.Submission;
import com.contestfeed.domain.ports.StateStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the engine: point-in-time projections and the resumable event feed.
 * Serves purely from the state store, so it works on a cold start before any poll.
 */
@Service
public class EventFeedUseCase {

    private final StateStore stateStore;
    private final int pageSize;

    public EventFeedUseCase(StateStore stateStore, @Value("${feed.page-size:500}") int pageSize) {
        this.stateStore = stateStore;
        this.pageSize = pageSize;
    }

    public List<Submission> listSubmissions() {
        return stateStore.listSubmissions();
    }

    public Optional<Submission> findSubmission(String id) {
        return stateStore.lastKnownSubmission(id);
    }

    public List<Judgement> listJudgements() {
        return stateStore.listJudgements();
    }

    public Optional<Judgement> findJudgement(String id) {
        return stateStore.lastKnownJudgement(id);
    }

    public long lastToken() {
        return stateStore.lastToken();
    }

    /**
     * Validates a resume token supplied by a feed consumer. No token means full history.
     *
     * @return the token to resume after
     * @throws InvalidTokenException if the token is not a number, negative, or not yet issued
     */
    public long parseResumeToken(String sinceToken) {
        if (sinceToken == null) {
            return 0;
        }
        long token;
        try {
            token = Long.parseLong(sinceToken.trim());
        } catch (NumberFormatException e) {
            throw new InvalidTokenException("Invalid token format: " + sinceToken);
        }
        if (token < 0) {
            throw new InvalidTokenException("Invalid token: " + sinceToken);
        }
        if (token > stateStore.lastToken()) {
            throw new InvalidTokenException("Unknown token: " + sinceToken);
        }
        return token;
    }

    /**
     * All committed events from {@code fromToken} (inclusive) up to the current head.
     */
    public List<FeedEvent> readFrom(long fromToken) {
        List<FeedEvent> result = new ArrayList<>();
        long next = Math.max(fromToken, 1);
        while (true) {
            List<FeedEvent> page = stateStore.readFrom(next, pageSize);
            if (page.isEmpty()) {
                return result;
            }
            result.addAll(page);
            next = page.get(page.size() - 1).token() + 1;
        }
    }

    /**
     * Opens a live cursor delivering every event with a token greater than {@code sinceToken}.
     */
    public FeedCursor openCursor(long sinceToken) {
        return new FeedCursor(sinceToken);
    }

    /**
     * Position of one feed consumer. Holds nothing but the last delivered token, so
     * abandoning it is all it takes to close the session.
     */
    public final class FeedCursor {

        private long lastDelivered;

        private FeedCursor(long sinceToken) {
            this.lastDelivered = sinceToken;
        }

        public long lastDelivered() {
            return lastDelivered;
        }

        /**
         * Returns the next committed events, waiting up to {@code maxWait} for an append
         * when the consumer has caught up.
         *
         * @return the next page of events, empty if nothing arrived in time
         */
        public List<FeedEvent> next(Duration maxWait) throws InterruptedException {
            List<FeedEvent> page = stateStore.readFrom(lastDelivered + 1, pageSize);
            if (page.isEmpty()) {
                if (!stateStore.awaitAppend(lastDelivered, maxWait)) {
                    return List.of();
                }
                page = stateStore.readFrom(lastDelivered + 1, pageSize);
            }
            if (!page.isEmpty()) {
                lastDelivered = page.get(page.size() - 1).token();
            }
            return page;
        }
    }
}
