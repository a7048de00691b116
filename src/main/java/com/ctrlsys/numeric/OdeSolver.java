package com.ctrlsys.numeric;

/**
 * Single-step integrator for ordinary differential equations.
 *
 * Plant blocks call it once per simulation step to propagate their state by
 * dt. Implementations never modify y0.
 */
public interface OdeSolver {

    /**
     * @param f  Right-hand side.
     * @param t0 Time at the start of the step.
     * @param dt Step length.
     * @param y0 State at t0.
     * @return State at t0 + dt.
     */
    double[] solve(OdeFunction f, double t0, double dt, double[] y0);

    /** {@code y + h * k}, element-wise, into a new array. */
    static double[] axpy(double[] y, double h, double[] k) {
        if (y.length != k.length)
            throw new IllegalArgumentException("Dimension mismatch: " + y.length + " vs " + k.length);
        double[] out = new double[y.length];
        for (int i = 0; i < y.length; i++)
            out[i] = y[i] + h * k[i];
        return out;
    }
}
