package com.ctrlsys.block;

import com.ctrlsys.api.StepInfo;
import com.ctrlsys.api.StepResult;
import com.ctrlsys.signal.InputPort;
import com.ctrlsys.wiring.SignalPublisher;

/**
 * Forwards its input to a {@link SignalPublisher} on every step, tagged with
 * the signal name, k and t.
 * <p>
 * Ports: input {@code u}.
 */
public final class Probe extends AbstractBlock {
    private final InputPort<Double> u;
    private final SignalPublisher publisher;

    public Probe(String name, SignalPublisher publisher) {
        super(name);
        this.publisher = publisher;
        this.u = input("u", Double.class);
    }

    @Override
    public StepResult step(StepInfo info) {
        publisher.publish(u.signalName(), info.k(), info.t(), u.get());
        return StepResult.CONTINUE;
    }
}
