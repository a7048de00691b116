package com.ctrlsys.numeric;

/** Right-hand side of {@code dy/dt = f(t, y)}. */
@FunctionalInterface
public interface OdeFunction {
    double[] apply(double t, double[] y);
}
