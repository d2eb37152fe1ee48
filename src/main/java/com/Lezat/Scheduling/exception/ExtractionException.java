package com.Lezat.Scheduling.exception;

/** Task extraction failed or returned something unusable. */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
