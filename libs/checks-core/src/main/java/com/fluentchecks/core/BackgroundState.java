package com.fluentchecks.core;

/**
 * Lifecycle of a {@link BackgroundCheck}.
 * <p>
 * Transitions only move forward: {@code NOT_STARTED -> RUNNING -> FINISHED}.
 */
public enum BackgroundState {

    /** Created, {@link BackgroundCheck#start()} not yet called. */
    NOT_STARTED,

    /** The worker thread is evaluating the wrapped check. */
    RUNNING,

    /** The worker has stored a result or an error. */
    FINISHED
}
