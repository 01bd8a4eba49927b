package com.contestfeed.domain.exception;

/**
 * The scoreboard provider could not be polled. The tick is skipped.
 */
public class UpstreamFetchFailedException extends FeedEngineException {

    public UpstreamFetchFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
