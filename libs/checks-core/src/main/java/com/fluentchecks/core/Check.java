package com.fluentchecks.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

/**
 * A repeatable boolean evaluation with success and failure callbacks.
 * <p>
 * Every check funnels through {@link #evaluate()}: the variant logic in {@link #check()}
 * runs first, then exactly one callback list fires (success callbacks on {@code true},
 * failure callbacks on {@code false}) in registration order. If the variant logic throws,
 * no callback fires and the error propagates to the caller.
 * <p>
 * Checks are combined structurally: {@link #and(Check)}, {@link #or(Check)},
 * {@link #negate()} and the timing/retry methods return new checks that hold a reference
 * to this one, so evaluating the result re-evaluates this check (and repeats its side
 * effects) every time. Nothing is cached except where a wrapper says so
 * ({@link BackgroundCheck}).
 * <p>
 * Example usage:
 * <pre>{@code
 * Check ready = Checks.of("service up", client::ping)
 *         .and(Checks.of("cache warm", cache::isWarm))
 *         .onFailure(() -> log.info("not ready yet"));
 *
 * boolean ok = ready.eventually(Duration.ofSeconds(5)).evaluate();
 * }</pre>
 */
public abstract class Check implements BooleanSupplier {

    private final List<Runnable> successCallbacks = new CopyOnWriteArrayList<>();
    private final List<Runnable> failureCallbacks = new CopyOnWriteArrayList<>();

    /**
     * Runs the variant logic once, fires the matching callbacks and returns the outcome.
     * <p>
     * Safe to call repeatedly; each call is an independent trial.
     *
     * @return the outcome of this evaluation
     * @throws RuntimeException any unchecked exception raised while evaluating
     */
    public final boolean evaluate() {
        boolean result = check();
        for (Runnable callback : result ? successCallbacks : failureCallbacks) {
            callback.run();
        }
        return result;
    }

    /**
     * Variant-specific evaluation logic. Callbacks are handled by {@link #evaluate()}.
     */
    protected abstract boolean check();

    /**
     * Same as {@link #evaluate()}, so a check can be used wherever a
     * {@link BooleanSupplier} is expected.
     */
    @Override
    public final boolean getAsBoolean() {
        return evaluate();
    }

    /**
     * Registers a callback run after every evaluation that returns {@code true}.
     *
     * @param callback the callback to append
     * @return this check, for chaining
     */
    public Check onSuccess(Runnable callback) {
        successCallbacks.add(Arguments.requireNonNull(callback, "callback"));
        return this;
    }

    /**
     * Registers a callback run after every evaluation that returns {@code false}.
     *
     * @param callback the callback to append
     * @return this check, for chaining
     */
    public Check onFailure(Runnable callback) {
        failureCallbacks.add(Arguments.requireNonNull(callback, "callback"));
        return this;
    }

    // ----------------------------------------------------------------
    // Combinators
    // ----------------------------------------------------------------

    /**
     * Returns a check that is {@code true} when both this check and {@code other} are.
     * {@code other} is only evaluated when this check is {@code true}.
     */
    public Check and(Check other) {
        return new AndCheck(this, other);
    }

    /**
     * Returns a check that is {@code true} when this check or {@code other} is.
     * {@code other} is only evaluated when this check is {@code false}.
     */
    public Check or(Check other) {
        return new OrCheck(this, other);
    }

    /**
     * Returns a check with the opposite outcome of this one.
     */
    public Check negate() {
        return new NotCheck(this);
    }

    // ----------------------------------------------------------------
    // Wrappers
    // ----------------------------------------------------------------

    /**
     * Returns a check that sleeps for {@code delay} before every evaluation of this one.
     *
     * @param delay time to wait; zero is allowed, negative is rejected
     */
    public DelayedCheck withDelay(Duration delay) {
        return new DelayedCheck(this, delay);
    }

    /**
     * Same as {@link #withDelay(Duration)}, sleeping on the given time source.
     */
    public DelayedCheck withDelay(Duration delay, TimeSource timeSource) {
        return new DelayedCheck(this, delay, timeSource);
    }

    /**
     * Returns a check that is {@code true} only when evaluating this check raises an
     * exception of type {@code exceptionType} (or a subtype). No exception gives
     * {@code false}; an exception of another type propagates.
     */
    public RaisesCheck raises(Class<? extends Throwable> exceptionType) {
        return new RaisesCheck(this, exceptionType);
    }

    /**
     * Returns a {@link BackgroundCheck} that evaluates this check once on its own thread.
     * The background check is not started.
     */
    public BackgroundCheck asBackground() {
        return new BackgroundCheck(this);
    }

    // ----------------------------------------------------------------
    // Repetition and polling
    // ----------------------------------------------------------------

    /**
     * Returns a check that polls this one until it is {@code true}. The returned check
     * always ends up {@code true}; evaluating it may block forever.
     */
    public Check waitUntilTrue() {
        return waitUntilTrue(PollingConfig.defaults());
    }

    /**
     * Same as {@link #waitUntilTrue()} with explicit polling settings.
     */
    public Check waitUntilTrue(PollingConfig config) {
        return new WaitForTrueCheck(this, config);
    }

    /**
     * Returns a check that evaluates this one up to {@code attempts} times and is
     * {@code true} only if every evaluation is. Stops at the first {@code false}.
     *
     * @param attempts number of evaluations; must be positive
     * @throws IllegalArgumentException if {@code attempts} is zero or negative
     */
    public Check isTrueForAttempts(int attempts) {
        return new RepeatingAndCheck(this, attempts);
    }

    /**
     * Returns a check that evaluates this one up to {@code attempts} times and is
     * {@code true} as soon as one evaluation is.
     *
     * @param attempts maximum number of evaluations; must be positive
     * @throws IllegalArgumentException if {@code attempts} is zero or negative
     */
    public Check succeedsWithinAttempts(int attempts) {
        return new RepeatingOrCheck(this, attempts);
    }

    /**
     * Returns a check that polls this one until it is {@code true} or {@code deadline}
     * passes. A deadline already in the past still allows one evaluation, but that
     * evaluation cannot succeed.
     */
    public Check succeedsBeforeDeadline(Instant deadline) {
        return succeedsBeforeDeadline(deadline, PollingConfig.defaults());
    }

    /**
     * Same as {@link #succeedsBeforeDeadline(Instant)} with explicit polling settings.
     */
    public Check succeedsBeforeDeadline(Instant deadline, PollingConfig config) {
        return new DeadlineCheck(this, deadline, config);
    }

    /**
     * Returns a check that polls this one for at most {@code timeout}, measured from the
     * moment the returned check starts evaluating.
     *
     * @param timeout polling budget; must be positive
     * @throws IllegalArgumentException if {@code timeout} is zero or negative
     */
    public Check succeedsWithinTimeout(Duration timeout) {
        return succeedsWithinTimeout(timeout, PollingConfig.defaults());
    }

    /**
     * Same as {@link #succeedsWithinTimeout(Duration)} with explicit polling settings.
     */
    public Check succeedsWithinTimeout(Duration timeout, PollingConfig config) {
        return new TimeoutCheck(this, timeout, config);
    }

    /**
     * Alias of {@link #succeedsWithinTimeout(Duration)}.
     */
    public Check eventually(Duration timeout) {
        return succeedsWithinTimeout(timeout);
    }

    /**
     * Alias of {@link #succeedsWithinTimeout(Duration, PollingConfig)}.
     */
    public Check eventually(Duration timeout, PollingConfig config) {
        return succeedsWithinTimeout(timeout, config);
    }

    // ----------------------------------------------------------------
    // Completion time
    // ----------------------------------------------------------------

    /**
     * Returns a check that evaluates this one in the background and is {@code true} if
     * the evaluation finishes, with any result, before {@code deadline}.
     */
    public Check finishesBeforeDeadline(Instant deadline) {
        return new FinishesBeforeDeadlineCheck(this, deadline);
    }

    /**
     * Returns a check that evaluates this one in the background and is {@code true} if
     * the evaluation finishes, with any result, within {@code timeout}.
     */
    public Check finishesWithinTimeout(Duration timeout) {
        return new FinishesBeforeTimeoutCheck(this, timeout);
    }

    /**
     * Returns a check that evaluates this one in the background and is {@code true} if
     * the evaluation finishes within {@code timeout} and returns {@code true}.
     */
    public Check isTrueBeforeTimeout(Duration timeout) {
        return new IsTrueBeforeTimeoutCheck(this, timeout);
    }

    /**
     * Describes the structure of this check without evaluating it.
     */
    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
