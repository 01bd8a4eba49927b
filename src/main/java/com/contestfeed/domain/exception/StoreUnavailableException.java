package com.contestfeed.domain.exception;

/**
 * Durable write failed. Fatal for the current tick only.
 */
public class StoreUnavailableException extends FeedEngineException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
