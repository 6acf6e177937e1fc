package com.acks.exception;

import lombok.Getter;

/**
 * Base class for every failure raised by the campaign engine.
 */
@Getter
public abstract class CampaignException extends RuntimeException {

    private final ErrorKind kind;

    protected CampaignException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CampaignException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
