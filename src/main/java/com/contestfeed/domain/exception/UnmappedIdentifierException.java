package com.contestfeed.domain.exception;

/**
 * Raised when an external scoreboard identifier has no contest-package mapping.
 * Recoverable per record: the record is dropped and the tick continues.
 */
public class UnmappedIdentifierException extends FeedEngineException {

    private final String kind;
    private final String externalId;

    public UnmappedIdentifierException(String kind, String externalId) {
        super("No " + kind + " mapping for external id '" + externalId + "'");
        this.kind = kind;
        this.externalId = externalId;
    }

    public String getKind() {
        return kind;
    }

    public String getExternalId() {
        return externalId;
    }
}
