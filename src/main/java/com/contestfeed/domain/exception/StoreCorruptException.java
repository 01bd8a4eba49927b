package com.contestfeed.domain.exception;

/**
 * Persisted token counter and event log disagree in a way that cannot be repaired
 * without risking duplicate or gapped tokens. Startup must not proceed.
 */
public class StoreCorruptException extends FeedEngineException {

    public StoreCorruptException(String message) {
        super(message);
    }
}
