package com.contestfeed.infrastructure.persistence;

import com.contestfeed.domain.exception.StoreCorruptException;

/**
 * Startup consistency rules between the persisted event log and token counter.
 *
 * <p>The log is the source of truth. Tokens must be exactly {@code 1..n}. A counter that
 * lags the log means the process stopped between the log write and the counter write;
 * the missing projections can be rebuilt from the log. A counter ahead of the log means
 * events were lost, and continuing would reissue tokens.
 */
public final class EventLogRecovery {

    public enum Action {
        CONSISTENT,
        ROLL_FORWARD
    }

    /**
     * @param eventCount   number of persisted events
     * @param lowestToken  smallest persisted token, 0 if none
     * @param highestToken largest persisted token, 0 if none
     * @param counter      persisted token counter, 0 if never written
     */
    public record LogState(long eventCount, long lowestToken, long highestToken, long counter) {}

    private EventLogRecovery() {
    }

    public static Action check(LogState state) {
        if (state.eventCount() > 0 && (state.lowestToken() != 1 || state.highestToken() != state.eventCount())) {
            throw new StoreCorruptException(String.format(
                "Event log has gaps: %d events spanning tokens %d..%d",
                state.eventCount(), state.lowestToken(), state.highestToken()));
        }
        if (state.counter() > state.highestToken()) {
            throw new StoreCorruptException(String.format(
                "Token counter %d is ahead of the event log (last token %d)",
                state.counter(), state.highestToken()));
        }
        if (state.counter() < 0) {
            throw new StoreCorruptException("Negative token counter: " + state.counter());
        }
        return state.counter() < state.highestToken() ? Action.ROLL_FORWARD : Action.CONSISTENT;
    }
}
