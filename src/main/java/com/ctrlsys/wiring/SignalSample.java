package com.ctrlsys.wiring;

/**
 * A mutable signal sample carried by the LMAX Disruptor RingBuffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is created and reused for
 * every sample, so probing a running simulation produces no garbage. The
 * signal name is a reference to the name held by the signal itself.
 */
public final class SignalSample {
    private String signal;
    private long k;
    private double t;
    private double value;

    public void set(String signal, long k, double t, double value) {
        this.signal = signal;
        this.k = k;
        this.t = t;
        this.value = value;
    }

    public String signal() {
        return signal;
    }

    public long k() {
        return k;
    }

    public double t() {
        return t;
    }

    public double value() {
        return value;
    }

    public void clear() {
        signal = null;
        k = 0;
        t = 0;
        value = 0;
    }
}
