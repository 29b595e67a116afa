package com.fluentchecks.core;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Conjunction of any number of checks, evaluated left to right and stopping at the
 * first {@code false}. An empty {@code AllCheck} is {@code true}.
 */
public class AllCheck extends Check {

    private final List<Check> checks;

    public AllCheck(Check... checks) {
        this(Arrays.asList(Arguments.requireNonNull(checks, "checks")));
    }

    public AllCheck(List<? extends Check> checks) {
        Arguments.requireNonNull(checks, "checks");
        checks.forEach(check -> Arguments.requireNonNull(check, "check"));
        this.checks = List.copyOf(checks);
    }

    @Override
    protected boolean check() {
        for (Check check : checks) {
            if (!check.evaluate()) {
                return false;
            }
        }
        return true;
    }

    public List<Check> checks() {
        return checks;
    }

    @Override
    public String toString() {
        return checks.stream().map(Check::toString).collect(Collectors.joining(" and ", "all(", ")"));
    }
}
