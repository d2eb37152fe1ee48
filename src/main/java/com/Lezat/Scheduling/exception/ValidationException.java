package com.Lezat.Scheduling.exception;

/** Malformed or unroutable request. Nothing is persisted. */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
