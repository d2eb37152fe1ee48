package com.Lezat.Scheduling.exception;

/** A single destination call failed. Never fails sibling destinations. */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
