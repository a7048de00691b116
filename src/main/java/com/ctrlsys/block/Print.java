package com.ctrlsys.block;

import com.ctrlsys.api.StepInfo;
import com.ctrlsys.api.StepResult;
import com.ctrlsys.signal.InputPort;

import lombok.extern.log4j.Log4j2;

/**
 * Logs its input on every step.
 * <p>
 * Ports: input {@code u}.
 */
@Log4j2
public final class Print<T> extends AbstractBlock {
    private final InputPort<T> u;

    public Print(String name, Class<T> type) {
        super(name);
        this.u = input("u", type);
    }

    @Override
    public StepResult step(StepInfo info) {
        if (log.isInfoEnabled())
            log.info("t: {} {}->{} = {}", String.format("%.2f", info.t()), name(), u.signalName(), u.get());
        return StepResult.CONTINUE;
    }
}
