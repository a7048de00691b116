package com.ctrlsys.block;

import com.ctrlsys.api.StepInfo;
import com.ctrlsys.api.StepResult;
import com.ctrlsys.io.ParameterStore;
import com.ctrlsys.signal.InputPort;
import com.ctrlsys.signal.OutputPort;

import java.util.ArrayList;
import java.util.List;

/**
 * Unit delay line: the output at step k is the input of step k - delay.
 * <p>
 * For the first {@code delay} steps the initial values are emitted, in order.
 * The input is latched in {@link #endStep}, after every block of the tick has
 * run, so the result does not depend on where the producer sits in the
 * execution order. The delay is the number of initial values, at least 1,
 * which makes this block a legal way to close a feedback loop.
 * <p>
 * Ports: input {@code u}, output {@code y}.
 */
public final class Delay<T> extends AbstractBlock {
    private final InputPort<T> u;
    private final OutputPort<T> y;

    // Ring buffer; buffer[index] is emitted next
    private final List<T> buffer;
    private int index;

    public Delay(String name, Class<T> type, List<T> initialValues) {
        super(name);
        if (initialValues == null || initialValues.isEmpty())
            throw new IllegalArgumentException("Delay '" + name + "' needs at least one initial value");
        this.buffer = new ArrayList<>(initialValues);
        this.u = input("u", type);
        this.y = output("y", type);
    }

    public static Delay<Double> of(String name, DelayParams params) {
        return new Delay<>(name, Double.class, params.getInitialValues());
    }

    public static Delay<Double> fromStore(String name, ParameterStore store, DelayParams defaults) {
        return of(name, store.getBlockParams(name, defaults));
    }

    @Override
    public int delay() {
        return buffer.size();
    }

    @Override
    public StepResult step(StepInfo info) {
        y.set(buffer.get(index));
        return StepResult.CONTINUE;
    }

    @Override
    public void endStep(StepInfo info) {
        buffer.set(index, u.get());
        index = (index + 1) % buffer.size();
    }
}
