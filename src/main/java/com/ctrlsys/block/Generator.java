package com.ctrlsys.block;

import com.ctrlsys.api.StepInfo;
import com.ctrlsys.api.StepResult;
import com.ctrlsys.signal.OutputPort;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Source block whose output is computed by a function of the step.
 * <p>
 * Ports: output {@code y}.
 */
public final class Generator<T> extends AbstractBlock {
    private final OutputPort<T> y;
    private final Function<StepInfo, T> fn;

    private Generator(String name, Class<T> type, Function<StepInfo, T> fn) {
        super(name);
        this.fn = fn;
        this.y = output("y", type);
    }

    /** Output depends on the step counter or simulated time, e.g. a sine reference. */
    public static <T> Generator<T> of(String name, Class<T> type, Function<StepInfo, T> fn) {
        return new Generator<>(name, type, fn);
    }

    /** Output pulled from a supplier on every step. */
    public static <T> Generator<T> from(String name, Class<T> type, Supplier<T> supplier) {
        return new Generator<>(name, type, info -> supplier.get());
    }

    @Override
    public StepResult step(StepInfo info) {
        y.set(fn.apply(info));
        return StepResult.CONTINUE;
    }
}
