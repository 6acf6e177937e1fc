package com.acks.exception;

/**
 * Malformed request parameters.
 */
public class ValidationException extends CampaignException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
