package com.ctrlsys.api;

/**
 * Timing information handed to every block on each tick.
 *
 * @param k  Step counter. The first tick of a freshly built system has k == 1.
 * @param t  Simulated time at the start of the tick, (k - 1) * dt.
 * @param dt Fixed time increment.
 */
public record StepInfo(long k, double t, double dt) {

    /** The state of a system that has not stepped yet. */
    public static StepInfo initial(double dt) {
        return new StepInfo(1, 0.0, dt);
    }

    /** The state of the following tick. */
    public StepInfo next() {
        return new StepInfo(k + 1, t + dt, dt);
    }
}
