package com.contestfeed.domain.exception;

/**
 * A feed consumer asked to resume from a token that is malformed or not yet issued.
 */
public class InvalidTokenException extends FeedEngineException {

    public InvalidTokenException(String message) {
        super(message);
    }
}
