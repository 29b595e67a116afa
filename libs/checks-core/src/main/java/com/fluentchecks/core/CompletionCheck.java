package com.fluentchecks.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Base for the checks that judge how long an evaluation takes. Each evaluation runs the
 * wrapped check on a fresh {@link BackgroundCheck} and waits, on real time, for at most
 * {@link #budget()}.
 * <p>
 * A worker that misses its budget is kept rather than abandoned. Until it finishes, further
 * evaluations report {@code false} without starting another worker, so at most one worker
 * per check is alive. Once it has finished it is drained and the next evaluation starts a
 * fresh one.
 */
abstract class CompletionCheck extends Check {

    private static final Logger log = LoggerFactory.getLogger(CompletionCheck.class);

    private final Check check;
    private final Object lock = new Object();
    private BackgroundCheck straggler;

    CompletionCheck(Check check) {
        this.check = Arguments.requireNonNull(check, "check");
    }

    /**
     * How long this evaluation may wait for the worker, measured from now.
     */
    abstract Duration budget();

    /**
     * Outcome for a worker that finished within its budget.
     */
    abstract boolean finished(BackgroundCheck background);

    @Override
    protected final boolean check() {
        BackgroundCheck background;
        synchronized (lock) {
            if (straggler != null) {
                if (straggler.state() != BackgroundState.FINISHED) {
                    log.debug("{} is still running past its budget", straggler);
                    return false;
                }
                straggler = null;
            }
            background = check.asBackground().start();
        }
        Duration budget = budget();
        if (!background.await(budget.isNegative() ? Duration.ZERO : budget)) {
            synchronized (lock) {
                if (straggler == null) {
                    straggler = background;
                }
            }
            return false;
        }
        return finished(background);
    }

    Check wrapped() {
        return check;
    }
}
