/**
 * Composable boolean checks.
 *
 * <p>A {@link com.fluentchecks.core.Check} wraps a repeatable evaluation. Checks combine
 * with {@code and}/{@code or}/{@code negate}, gain timing behaviour through
 * {@code withDelay}, {@code eventually}, {@code succeedsBeforeDeadline} and the attempt
 * counters, and can run on their own thread through {@code asBackground()}.
 *
 * <h2>Error taxonomy</h2>
 *
 * <ul>
 *   <li>Errors raised by a condition propagate unchanged (checked ones wrapped in
 *       {@link com.fluentchecks.core.CheckEvaluationException}); polling loops stop on the
 *       first error instead of treating it as a failed attempt.
 *   <li>{@link com.fluentchecks.core.CheckStateException}: invalid
 *       {@link com.fluentchecks.core.BackgroundCheck} transition.
 *   <li>{@link IllegalArgumentException}: null arguments, non-positive attempt counts or
 *       timeouts, negative delays; thrown when the check is built, before any evaluation.
 * </ul>
 *
 * @see com.fluentchecks.core.Checks
 */
package com.fluentchecks.core;
