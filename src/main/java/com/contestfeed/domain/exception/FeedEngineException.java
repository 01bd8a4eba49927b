package com.contestfeed.domain.exception;

/**
 * Base type for all failures raised by the synchronization engine.
 */
public class FeedEngineException extends RuntimeException {

    public FeedEngineException(String message) {
        super(message);
    }

    public FeedEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
