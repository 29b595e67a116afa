package com.fluentchecks.core;

/**
 * Static factories for the common check shapes.
 */
public final class Checks {

    private Checks() {
        // utility class
    }

    /**
     * Wraps a condition as a check.
     */
    public static Check of(Condition condition) {
        return new CustomCheck(condition);
    }

    /**
     * Wraps a condition as a check described by {@code description} in logs and
     * {@code toString()}.
     */
    public static Check of(String description, Condition condition) {
        return new CustomCheck(description, condition);
    }

    /**
     * Returns a new check that is always {@code true}.
     */
    public static Check always() {
        return new CustomCheck("always", () -> true);
    }

    /**
     * Returns a new check that is always {@code false}.
     */
    public static Check never() {
        return new CustomCheck("never", () -> false);
    }

    public static Check all(Check... checks) {
        return new AllCheck(checks);
    }

    public static Check any(Check... checks) {
        return new AnyCheck(checks);
    }

    public static Check not(Check check) {
        return new NotCheck(check);
    }
}
