package com.contestfeed.application.usecase;

import com.contestfeed.domain.exception.InconsistentVerdictException;
import com.contestfeed.domain.exception.StoreUnavailableException;
import com.contestfeed.domain.exception.UpstreamFetchFailedException;
import com.contestfeed.domain.model.NormalizedSnapshot;
import com.contestfeed.domain.model.ScoreboardSnapshot;
import com.contestfeed.domain.ports.ScoreboardGateway;
import com.contestfeed.domain.ports.StateStore;
import com.contestfeed.domain.service.DiffEngine;
import com.contestfeed.domain.service.EventEmitter;
import com.contestfeed.domain.service.SnapshotNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Use case for one poll-diff-emit cycle (a tick).
 *
 * <p>Ticks must not overlap. The scheduler calls {@link #poll()} from a single
 * fixed-delay job, so the token counter only ever has one writer.
 */
@Service
public class SyncScoreboardUseCase {

    private static final Logger logger = LoggerFactory.getLogger(SyncScoreboardUseCase.class);

    private final ScoreboardGateway scoreboardGateway;
    private final SnapshotNormalizer normalizer;
    private final DiffEngine diffEngine;
    private final EventEmitter eventEmitter;
    private final StateStore stateStore;

    public SyncScoreboardUseCase(ScoreboardGateway scoreboardGateway, SnapshotNormalizer normalizer,
                                 DiffEngine diffEngine, EventEmitter eventEmitter, StateStore stateStore) {
        this.scoreboardGateway = scoreboardGateway;
        this.normalizer = normalizer;
        this.diffEngine = diffEngine;
        this.eventEmitter = eventEmitter;
        this.stateStore = stateStore;
    }

    /**
     * Fetches the scoreboard and runs a tick on it. A failed fetch skips the tick.
     *
     * @return Summary of the tick
     */
    public TickSummary poll() {
        ScoreboardSnapshot snapshot;
        try {
            snapshot = fetch();
        } catch (UpstreamFetchFailedException e) {
            logger.error("Skipping tick: {}", e.getMessage(), e.getCause());
            return TickSummary.skipped(stateStore.lastToken(), e.getMessage());
        }
        return runTick(snapshot);
    }

    /**
     * Brings the store up to date with its log, then normalizes the snapshot, diffs it
     * against the last-known state and emits the events.
     *
     * @return Summary of the tick
     */
    public TickSummary runTick(ScoreboardSnapshot snapshot) {
        try {
            stateStore.recoverIfNeeded();
        } catch (StoreUnavailableException e) {
            logger.error("Aborting tick before diffing, store recovery failed", e);
            return new TickSummary(TickStatus.ABORTED_STORE_UNAVAILABLE, 0, stateStore.lastToken(),
                0, List.of(), e.getMessage());
        }
        long tokenBefore = stateStore.lastToken();

        NormalizedSnapshot normalized = normalizer.normalize(snapshot);
        DiffEngine.DiffResult diff = diffEngine.diff(normalized);
        List<String> rejected = diff.rejected().stream()
            .map(InconsistentVerdictException::getJudgementId)
            .toList();

        try {
            eventEmitter.emit(diff.transitions());
        } catch (StoreUnavailableException e) {
            long committed = stateStore.lastToken() - tokenBefore;
            logger.error("Aborting tick after {} of {} events, will retry next interval",
                committed, diff.transitions().size(), e);
            return new TickSummary(TickStatus.ABORTED_STORE_UNAVAILABLE, (int) committed, stateStore.lastToken(),
                normalized.unmappedRecords(), rejected, e.getMessage());
        }

        long lastToken = stateStore.lastToken();
        int emitted = (int) (lastToken - tokenBefore);
        if (emitted > 0) {
            logger.info("Tick emitted {} events, last token {}", emitted, lastToken);
        } else {
            logger.debug("Tick produced no changes, last token {}", lastToken);
        }
        return new TickSummary(TickStatus.COMPLETED, emitted, lastToken, normalized.unmappedRecords(), rejected, null);
    }

    private ScoreboardSnapshot fetch() {
        String provider = scoreboardGateway.getProviderName();
        try {
            ScoreboardSnapshot snapshot = scoreboardGateway.fetchSnapshot();
            logger.debug("Fetched {} scoreboard rows from {}", snapshot.rows().size(), provider);
            return snapshot;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchFailedException("Fetch from " + provider + " interrupted", e);
        } catch (Exception e) {
            throw new UpstreamFetchFailedException("Fetch from " + provider + " failed: " + e.getMessage(), e);
        }
    }

    public enum TickStatus {
        COMPLETED,
        SKIPPED_UPSTREAM_FAILED,
        ABORTED_STORE_UNAVAILABLE
    }

    /**
     * @param rejectedJudgements judgements dropped for contradicting a terminal verdict
     */
    public record TickSummary(
        TickStatus status,
        int eventsEmitted,
        long lastToken,
        int unmappedRecords,
        List<String> rejectedJudgements,
        String error
    ) {

        static TickSummary skipped(long lastToken, String error) {
            return new TickSummary(TickStatus.SKIPPED_UPSTREAM_FAILED, 0, lastToken, 0, List.of(), error);
        }
    }
}
