package com.ctrlsys.util;

import com.ctrlsys.api.StepListener;
import com.ctrlsys.api.StepResult;

import java.util.Arrays;

/**
 * Aggregates multiple {@link StepListener} instances with zero-allocation
 * iteration.
 */
public class CompositeStepListener implements StepListener {
    private StepListener[] listeners = new StepListener[0];

    public CompositeStepListener add(StepListener listener) {
        StepListener[] old = listeners;
        StepListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    @Override
    public void onStepStart(long k, double t) {
        for (StepListener l : listeners)
            l.onStepStart(k, t);
    }

    @Override
    public void onBlockStepped(long k, int index, String blockName, StepResult result, long durationNanos) {
        for (StepListener l : listeners)
            l.onBlockStepped(k, index, blockName, result, durationNanos);
    }

    @Override
    public void onBlockError(long k, int index, String blockName, Throwable error) {
        for (StepListener l : listeners)
            l.onBlockError(k, index, blockName, error);
    }

    @Override
    public void onStepEnd(long k, StepResult result) {
        for (StepListener l : listeners)
            l.onStepEnd(k, result);
    }
}
