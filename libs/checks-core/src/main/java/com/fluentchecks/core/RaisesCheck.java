package com.fluentchecks.core;

/**
 * Expected-failure check: {@code true} only when evaluating the wrapped check raises an
 * exception assignable to the expected type.
 * <p>
 * Matching is done against the condition's original exception, so a checked exception
 * carried by a {@link CheckEvaluationException} is matched by its own type. If the wrapped
 * check completes normally the result is {@code false}; an exception of any other type is
 * rethrown untouched.
 */
public class RaisesCheck extends Check {

    private final Check check;
    private final Class<? extends Throwable> exceptionType;

    public RaisesCheck(Check check, Class<? extends Throwable> exceptionType) {
        this.check = Arguments.requireNonNull(check, "check");
        this.exceptionType = Arguments.requireNonNull(exceptionType, "exceptionType");
    }

    @Override
    protected boolean check() {
        try {
            check.evaluate();
        } catch (RuntimeException | Error e) {
            if (matches(e)) {
                return true;
            }
            throw e;
        }
        return false;
    }

    private boolean matches(Throwable thrown) {
        if (exceptionType.isInstance(thrown)) {
            return true;
        }
        return thrown instanceof CheckEvaluationException
                && thrown.getCause() != null
                && exceptionType.isInstance(thrown.getCause());
    }

    public Class<? extends Throwable> exceptionType() {
        return exceptionType;
    }

    @Override
    public String toString() {
        return check + " raises " + exceptionType.getSimpleName();
    }
}
