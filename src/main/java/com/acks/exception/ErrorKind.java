package com.acks.exception;

/**
 * The categories of failure the campaign engine reports to clients.
 */
public enum ErrorKind {
    NOT_FOUND,
    ILLEGAL_ACTION,
    CONCURRENCY_CONFLICT,
    PERSISTENCE_FAILURE,
    VALIDATION_ERROR
}
