package com.acks.exception;

/**
 * A durable write failed. In-memory state has already been rolled back when this is thrown,
 * so the caller may simply retry.
 */
public class PersistenceFailureException extends CampaignException {

    public PersistenceFailureException(String message) {
        super(ErrorKind.PERSISTENCE_FAILURE, message);
    }

    public PersistenceFailureException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE_FAILURE, message, cause);
    }
}
