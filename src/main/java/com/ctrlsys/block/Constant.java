package com.ctrlsys.block;

import com.ctrlsys.api.StepInfo;
import com.ctrlsys.api.StepResult;
import com.ctrlsys.io.ParameterStore;
import com.ctrlsys.signal.OutputPort;

import java.util.Objects;

/**
 * Writes the same value on every step.
 * <p>
 * Ports: output {@code y}.
 */
public final class Constant<T> extends AbstractBlock {
    private final OutputPort<T> y;
    private final T value;

    public Constant(String name, Class<T> type, T value) {
        super(name);
        this.value = Objects.requireNonNull(value, "value");
        this.y = output("y", type);
    }

    public static Constant<Double> of(String name, double value) {
        return new Constant<>(name, Double.class, value);
    }

    public static Constant<Double> fromStore(String name, ParameterStore store, ConstantParams defaults) {
        return of(name, store.getBlockParams(name, defaults).getC());
    }

    public T value() {
        return value;
    }

    @Override
    public StepResult step(StepInfo info) {
        y.set(value);
        return StepResult.CONTINUE;
    }
}
