package com.fluentchecks.core;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Disjunction of any number of checks, evaluated left to right and stopping at the
 * first {@code true}. An empty {@code AnyCheck} is {@code false}.
 */
public class AnyCheck extends Check {

    private final List<Check> checks;

    public AnyCheck(Check... checks) {
        this(Arrays.asList(Arguments.requireNonNull(checks, "checks")));
    }

    public AnyCheck(List<? extends Check> checks) {
        Arguments.requireNonNull(checks, "checks");
        checks.forEach(check -> Arguments.requireNonNull(check, "check"));
        this.checks = List.copyOf(checks);
    }

    @Override
    protected boolean check() {
        for (Check check : checks) {
            if (check.evaluate()) {
                return true;
            }
        }
        return false;
    }

    public List<Check> checks() {
        return checks;
    }

    @Override
    public String toString() {
        return checks.stream().map(Check::toString).collect(Collectors.joining(" or ", "any(", ")"));
    }
}
