package com.fluentchecks.core;

/**
 * The zero-argument operation wrapped by a {@link CustomCheck}.
 * <p>
 * A condition may have side effects and may throw. Unchecked exceptions and errors
 * propagate out of {@link Check#evaluate()} unchanged; checked exceptions are wrapped
 * in a {@link CheckEvaluationException}.
 * <p>
 * Example usage:
 * <pre>{@code
 * Condition drained = () -> queue.isEmpty();
 * Check check = Checks.of("queue drained", drained);
 * }</pre>
 */
@FunctionalInterface
public interface Condition {

    /**
     * Tests the condition once.
     *
     * @return whether the condition currently holds
     * @throws Exception if the condition cannot be tested
     */
    boolean test() throws Exception;
}
