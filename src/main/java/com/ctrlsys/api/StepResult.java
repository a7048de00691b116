package com.ctrlsys.api;

/**
 * Outcome of a single block step or of a whole tick.
 *
 * STOP is advisory: the runtime completes the tick in which it was requested
 * and reports it to the caller, who decides whether to keep stepping.
 */
public enum StepResult {
    CONTINUE,
    STOP;

    /** Combines two results, STOP wins. */
    public StepResult and(StepResult other) {
        return this == STOP || other == STOP ? STOP : CONTINUE;
    }
}
