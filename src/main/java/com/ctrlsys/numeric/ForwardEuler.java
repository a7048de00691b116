package com.ctrlsys.numeric;

/**
 * Explicit Euler: {@code y1 = y0 + dt * f(t0, y0)}. First order.
 */
public final class ForwardEuler implements OdeSolver {
    public static final ForwardEuler INSTANCE = new ForwardEuler();

    @Override
    public double[] solve(OdeFunction f, double t0, double dt, double[] y0) {
        return OdeSolver.axpy(y0, dt, f.apply(t0, y0));
    }
}
