package com.acks.exception;

/**
 * Someone else changed the map since the caller last read it.
 */
public class ConcurrencyConflictException extends CampaignException {

    public ConcurrencyConflictException(String message) {
        super(ErrorKind.CONCURRENCY_CONFLICT, message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(ErrorKind.CONCURRENCY_CONFLICT, message, cause);
    }
}
