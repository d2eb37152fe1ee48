package com.Lezat.Scheduling.exception;

/** The transcript source could not deliver a transcript. */
public class ProviderFetchException extends RuntimeException {

    public ProviderFetchException(String message) {
        super(message);
    }

    public ProviderFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
