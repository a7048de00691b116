package com.ctrlsys.block;

import com.ctrlsys.api.StepInfo;
import com.ctrlsys.api.StepResult;
import com.ctrlsys.io.ParameterStore;
import com.ctrlsys.signal.InputPort;
import com.ctrlsys.signal.OutputPort;

/**
 * Discrete PID controller acting on an error signal.
 * <p>
 * Per step, with e the input:
 * <pre>
 * der = (e - lastE) / dt
 * int = acc + e * dt
 * y   = kp * e + kd * der + ki * int
 * </pre>
 * lastE starts at 0, acc at {@code acc0}.
 * <p>
 * Ports: input {@code u}, output {@code y}.
 */
public final class Pid extends AbstractBlock {
    private final InputPort<Double> u;
    private final OutputPort<Double> y;
    private final PidParams params;

    private double acc;
    private double lastErr;

    public Pid(String name, PidParams params) {
        super(name);
        this.params = params;
        this.acc = params.getAcc0();
        this.u = input("u", Double.class);
        this.y = output("y", Double.class);
    }

    public static Pid fromStore(String name, ParameterStore store, PidParams defaults) {
        return new Pid(name, store.getBlockParams(name, defaults));
    }

    @Override
    public StepResult step(StepInfo info) {
        double err = u.get();
        double der = (err - lastErr) / info.dt();
        double integral = acc + err * info.dt();

        y.set(params.getKp() * err + params.getKd() * der + params.getKi() * integral);

        lastErr = err;
        acc = integral;
        return StepResult.CONTINUE;
    }

    /** Current integrator state. */
    public double accumulator() {
        return acc;
    }
}
