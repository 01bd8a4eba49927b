package com.contestfeed.domain.ports;

import com.contestfeed.domain.model.FeedEvent;
import com.contestfeed.domain.model.Judgement;
import com.contestfeed.domain.model.Submission;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable event log plus the last-known state derived from it.
 *
 * <p>Single writer (the event emitter), many readers. Readers only ever observe events
 * whose token is at or below the committed head; the head moves after the log entry,
 * the last-known projection and the token counter of an event are all durable.
 */
public interface StateStore {

    /**
     * Appends one event as a single unit: log entry, last-known projection, token counter.
     *
     * @param event event whose token must be exactly {@code lastToken() + 1}
     * @return the committed token
     * @throws com.contestfeed.domain.exception.StoreUnavailableException on durability failure;
     *         the committed head is left unchanged
     */
    long append(FeedEvent event);

    /**
     * Finishes any recovery left pending by a failed write, so that the last-known state
     * matches the committed log. Called at the start of every tick, before diffing.
     *
     * @throws com.contestfeed.domain.exception.StoreUnavailableException if the store still
     *         cannot be read; the last-known state is left as it was
     */
    void recoverIfNeeded();

    /**
     * Reads committed events starting at {@code fromToken} (inclusive), in token order.
     * Safe to call concurrently with {@link #append(FeedEvent)}.
     *
     * @param limit maximum number of events to return
     */
    List<FeedEvent> readFrom(long fromToken, int limit);

    /**
     * Last committed token, 0 when the log is empty.
     */
    long lastToken();

    Optional<Submission> lastKnownSubmission(String submissionId);

    Optional<Judgement> lastKnownJudgement(String judgementId);

    List<Submission> listSubmissions();

    List<Judgement> listJudgements();

    /**
     * Blocks until an event with a token greater than {@code afterToken} is committed.
     *
     * @return true if such an event exists, false on timeout
     */
    boolean awaitAppend(long afterToken, Duration timeout) throws InterruptedException;
}
