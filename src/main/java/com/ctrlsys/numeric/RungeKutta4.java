package com.ctrlsys.numeric;

/**
 * Classic fourth-order Runge-Kutta.
 * <p>
 * Formula:
 * <pre>
 * k1 = f(t0,        y0)
 * k2 = f(t0 + dt/2, y0 + dt/2 * k1)
 * k3 = f(t0 + dt/2, y0 + dt/2 * k2)
 * k4 = f(t0 + dt,   y0 + dt   * k3)
 * y1 = y0 + dt/6 * (k1 + 2 k2 + 2 k3 + k4)
 * </pre>
 */
public final class RungeKutta4 implements OdeSolver {
    public static final RungeKutta4 INSTANCE = new RungeKutta4();

    @Override
    public double[] solve(OdeFunction f, double t0, double dt, double[] y0) {
        double half = dt / 2.0;
        double[] k1 = f.apply(t0, y0);
        double[] k2 = f.apply(t0 + half, OdeSolver.axpy(y0, half, k1));
        double[] k3 = f.apply(t0 + half, OdeSolver.axpy(y0, half, k2));
        double[] k4 = f.apply(t0 + dt, OdeSolver.axpy(y0, dt, k3));

        double[] y1 = new double[y0.length];
        for (int i = 0; i < y0.length; i++)
            y1[i] = y0[i] + dt / 6.0 * (k1[i] + 2.0 * k2[i] + 2.0 * k3[i] + k4[i]);
        return y1;
    }
}
