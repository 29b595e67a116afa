package com.fluentchecks.core;

/**
 * Thrown when a thread is interrupted while a check is sleeping between attempts,
 * delaying, or waiting for a background evaluation.
 * <p>
 * The interrupt flag of the thread is restored before this exception is thrown.
 */
public class CheckInterruptedException extends CheckException {

    public CheckInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
