package com.ctrlsys.block;

import com.ctrlsys.api.StepInfo;
import com.ctrlsys.api.StepResult;
import com.ctrlsys.io.ParameterStore;
import com.ctrlsys.signal.InputPort;
import com.ctrlsys.signal.OutputPort;

import java.util.Arrays;

/**
 * Weighted sum of n double inputs.
 * <p>
 * Formula: {@code y = gain1 * u1 + ... + gainN * uN}
 * <p>
 * Ports: inputs {@code u1 .. uN}, output {@code y}.
 */
public final class Add extends AbstractBlock {
    private final InputPort<Double>[] u;
    private final OutputPort<Double> y;
    private final double[] gains;

    /** Plain sum of n inputs. */
    public Add(String name, int n) {
        this(name, ones(n));
    }

    public Add(String name, AddParams params) {
        super(name);
        double[] g = params.getGains();
        if (g == null || g.length == 0)
            throw new IllegalArgumentException("Block '" + name + "' needs at least one gain");
        this.gains = g.clone();
        this.u = inputArray("u", Double.class, gains.length);
        this.y = output("y", Double.class);
    }

    public static Add fromStore(String name, ParameterStore store, AddParams defaults) {
        AddParams params = store.getBlockParams(name, defaults);
        if (params.getGains() == null || params.getGains().length != defaults.getGains().length)
            throw new IllegalArgumentException("Block '" + name + "' expects "
                    + defaults.getGains().length + " gains, store has " + Arrays.toString(params.getGains()));
        return new Add(name, params);
    }

    private static AddParams ones(int n) {
        if (n < 1)
            throw new IllegalArgumentException("Add needs at least one input, got " + n);
        double[] g = new double[n];
        Arrays.fill(g, 1.0);
        return new AddParams(g);
    }

    @Override
    public StepResult step(StepInfo info) {
        double sum = 0.0;
        for (int i = 0; i < u.length; i++)
            sum += gains[i] * u[i].get();
        y.set(sum);
        return StepResult.CONTINUE;
    }
}
