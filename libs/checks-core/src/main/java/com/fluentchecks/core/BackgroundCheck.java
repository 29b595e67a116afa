package com.fluentchecks.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates a wrapped check exactly once on a dedicated worker thread.
 * <p>
 * Lifecycle: {@link BackgroundState#NOT_STARTED} until {@link #start()}, then
 * {@link BackgroundState#RUNNING} while the worker evaluates, then
 * {@link BackgroundState#FINISHED} once the worker has stored the result or the error it
 * caught. There is no cancellation; a started worker always runs to completion.
 * <p>
 * State, result and error are guarded by a single lock, and the worker publishes all three
 * in one critical section before releasing waiters, so a reader that observes
 * {@code FINISHED} also observes the stored outcome.
 * <p>
 * Example usage:
 * <pre>{@code
 * BackgroundCheck upload = Checks.of(uploader::upload).asBackground().start();
 * // ... do other work ...
 * upload.isFinished().waitUntilTrue().evaluate();
 * boolean uploaded = upload.result();
 * }</pre>
 */
public class BackgroundCheck extends Check {

    private static final Logger log = LoggerFactory.getLogger(BackgroundCheck.class);

    private static final AtomicInteger WORKER_COUNTER = new AtomicInteger();

    private final Check check;
    private final Object lock = new Object();
    private final CountDownLatch done = new CountDownLatch(1);

    private BackgroundState state = BackgroundState.NOT_STARTED;
    private boolean result;
    private Throwable failure;

    public BackgroundCheck(Check check) {
        this.check = Arguments.requireNonNull(check, "check");
    }

    /**
     * Starts the worker thread.
     *
     * @return this check, for chaining
     * @throws CheckStateException if the check was already started
     */
    public BackgroundCheck start() {
        synchronized (lock) {
            if (state != BackgroundState.NOT_STARTED) {
                throw new CheckStateException("start", BackgroundState.NOT_STARTED, state);
            }
            launch();
        }
        return this;
    }

    /**
     * Returns a check reflecting whether the worker has finished. The returned check can be
     * composed and polled like any other.
     */
    public Check isFinished() {
        return new FinishedCheck(this);
    }

    /**
     * Returns the stored result of the background evaluation.
     *
     * @return the wrapped check's outcome
     * @throws CheckStateException if the worker has not finished yet
     * @throws RuntimeException    the exception the wrapped check raised, if any
     */
    public boolean result() {
        synchronized (lock) {
            if (state != BackgroundState.FINISHED) {
                throw new CheckStateException("read result of", BackgroundState.FINISHED, state);
            }
            if (failure != null) {
                rethrow(failure);
            }
            return result;
        }
    }

    /**
     * Returns the current lifecycle state.
     */
    public BackgroundState state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Waits up to {@code timeout} for the worker to finish.
     *
     * @param timeout maximum wait; zero only samples the current state
     * @return whether the worker finished within the timeout
     * @throws CheckStateException if the check was never started
     */
    public boolean await(Duration timeout) {
        Arguments.requireNonNegative(timeout, "timeout");
        requireStarted("await");
        try {
            return done.await(Durations.toNanos(timeout), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CheckInterruptedException("Interrupted while waiting for " + check, e);
        }
    }

    /**
     * Blocks until the worker has finished.
     *
     * @throws CheckStateException if the check was never started
     */
    public void join() {
        requireStarted("join");
        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CheckInterruptedException("Interrupted while waiting for " + check, e);
        }
    }

    /**
     * Starts the worker if needed, waits for it and returns {@link #result()}. Every
     * evaluation after the first returns the same stored outcome.
     */
    @Override
    protected boolean check() {
        synchronized (lock) {
            if (state == BackgroundState.NOT_STARTED) {
                launch();
            }
        }
        join();
        return result();
    }

    @Override
    public BackgroundCheck onSuccess(Runnable callback) {
        super.onSuccess(callback);
        return this;
    }

    @Override
    public BackgroundCheck onFailure(Runnable callback) {
        super.onFailure(callback);
        return this;
    }

    // Caller holds lock.
    private void launch() {
        state = BackgroundState.RUNNING;
        Thread worker = new Thread(this::run, "fluent-check-bg-" + WORKER_COUNTER.incrementAndGet());
        worker.setDaemon(true);
        worker.start();
        log.debug("Started background evaluation of {} on {}", check, worker.getName());
    }

    private void run() {
        boolean value = false;
        Throwable error = null;
        try {
            value = check.evaluate();
        } catch (Throwable t) {
            error = t;
            log.warn("Background evaluation of {} raised {}", check, t.toString());
        }
        synchronized (lock) {
            result = value;
            failure = error;
            state = BackgroundState.FINISHED;
        }
        done.countDown();
        log.debug("Background evaluation of {} finished with {}", check, error == null ? value : "error");
    }

    private void requireStarted(String operation) {
        synchronized (lock) {
            if (state == BackgroundState.NOT_STARTED) {
                throw new CheckStateException(operation, BackgroundState.RUNNING, state);
            }
        }
    }

    private static void rethrow(Throwable failure) {
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        throw new CheckEvaluationException(failure);
    }

    @Override
    public String toString() {
        return "background(" + check + ")";
    }

    /**
     * Live view of {@link BackgroundCheck#state()} as a check.
     */
    private static final class FinishedCheck extends Check {

        private final BackgroundCheck background;

        FinishedCheck(BackgroundCheck background) {
            this.background = background;
        }

        @Override
        protected boolean check() {
            return background.state() == BackgroundState.FINISHED;
        }

        @Override
        public String toString() {
            return background + " finished";
        }
    }
}
