package com.ctrlsys.engine;

import com.ctrlsys.api.Block;
import com.ctrlsys.api.StepInfo;
import com.ctrlsys.api.StepListener;
import com.ctrlsys.api.StepResult;
import com.ctrlsys.signal.Signal;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * A built control system: the blocks in execution order plus the step state.
 *
 * Instances are produced by the ControlSystemBuilder and are structurally
 * immutable; only the block state, the signal values and the step counter move.
 *
 * Algorithm of one tick (step()):
 *
 * 1. Run: every block's step() is invoked in topological order with the current
 * {k, t, dt}. A producer therefore always runs before its zero-delay consumers.
 *
 * 2. Aggregate: a STOP from any block is remembered, but the remaining blocks
 * still run so that the tick is complete.
 *
 * 3. Latch: endStep() is invoked on every block, in the same order.
 *
 * 4. Advance: k += 1, t += dt.
 *
 * 5. Report: STOP if a block asked for it or if maxIter > 0 and k now exceeds
 * it; CONTINUE otherwise.
 *
 * Failure:
 * An exception thrown by a block aborts the tick immediately. It is reported to
 * the listener, logged and rethrown unchanged. Signals already written during
 * the aborted tick keep their new values and k is not advanced.
 *
 * Thread Safety:
 * Single-threaded and non-reentrant. Signals are read and written without
 * synchronisation.
 */
@Log4j2
public final class ControlSystem {
    private final String name;
    private final TopologicalOrder topology;
    private final SignalGraph signalGraph;
    private final Map<String, Signal<?>> signals;
    private final ControlSystemParameters parameters;

    private StepInfo info;
    private StepListener listener;

    public ControlSystem(String name, TopologicalOrder topology, SignalGraph signalGraph,
            Map<String, Signal<?>> signals, ControlSystemParameters parameters) {
        if (parameters.getMaxIter() < 0)
            throw new IllegalArgumentException("maxIter must be >= 0, was " + parameters.getMaxIter());
        this.name = name;
        this.topology = topology;
        this.signalGraph = signalGraph;
        this.signals = Map.copyOf(signals);
        this.parameters = parameters;
        this.info = StepInfo.initial(parameters.getDt());
    }

    public void setListener(StepListener listener) {
        this.listener = listener;
    }

    /**
     * Executes one tick.
     *
     * @return STOP if a block requested it or the iteration limit was reached.
     * @throws RuntimeException whatever a block threw, unchanged.
     */
    public StepResult step() {
        final StepInfo current = this.info;
        final int n = topology.blockCount();
        final StepListener l = this.listener;
        final boolean hasListener = l != null;

        if (hasListener)
            l.onStepStart(current.k(), current.t());

        StepResult result = StepResult.CONTINUE;
        for (int i = 0; i < n; i++) {
            Block block = topology.block(i);
            long start = hasListener ? System.nanoTime() : 0;

            StepResult blockResult;
            try {
                blockResult = block.step(current);
            } catch (RuntimeException e) {
                fail(current, i, block, e);
                throw e;
            }
            if (blockResult == StepResult.STOP)
                log.debug("Block '{}' requested stop at k={}", block.name(), current.k());
            result = result.and(blockResult);

            if (hasListener)
                l.onBlockStepped(current.k(), i, block.name(), blockResult, System.nanoTime() - start);
        }

        for (int i = 0; i < n; i++) {
            Block block = topology.block(i);
            try {
                block.endStep(current);
            } catch (RuntimeException e) {
                fail(current, i, block, e);
                throw e;
            }
        }

        this.info = current.next();
        long maxIter = parameters.getMaxIter();
        if (maxIter > 0 && info.k() > maxIter)
            result = StepResult.STOP;

        if (hasListener)
            l.onStepEnd(current.k(), result);
        return result;
    }

    /**
     * Steps until a tick returns STOP or maxSteps ticks have run.
     *
     * @return the number of ticks executed.
     */
    public long run(long maxSteps) {
        long ticks = 0;
        while (ticks < maxSteps) {
            ticks++;
            if (step() == StepResult.STOP)
                break;
        }
        return ticks;
    }

    private void fail(StepInfo current, int index, Block block, RuntimeException e) {
        log.error("Block '{}' failed at k={} t={} in control system '{}'", block.name(), current.k(),
                current.t(), name, e);
        if (listener != null)
            listener.onBlockError(current.k(), index, block.name(), e);
    }

    public String name() {
        return name;
    }

    /** Step counter of the next tick. */
    public long k() {
        return info.k();
    }

    /** Simulated time of the next tick. */
    public double t() {
        return info.t();
    }

    public double dt() {
        return info.dt();
    }

    public StepInfo stepInfo() {
        return info;
    }

    public ControlSystemParameters parameters() {
        return parameters;
    }

    public TopologicalOrder topology() {
        return topology;
    }

    public SignalGraph signalGraph() {
        return signalGraph;
    }

    public List<String> executionOrder() {
        return topology.names();
    }

    public Map<String, Signal<?>> signals() {
        return signals;
    }

    /**
     * Looks up a signal by its global name.
     *
     * @throws IllegalArgumentException if no output produces that signal.
     */
    public Signal<?> signal(String signalName) {
        Signal<?> s = signals.get(signalName);
        if (s == null)
            throw new IllegalArgumentException("Unknown signal: " + signalName);
        return s;
    }

    /**
     * Typed read of a signal's current value; empty until first written.
     */
    public <T> Optional<T> value(String signalName, Class<T> type) {
        return signal(signalName).get(type);
    }
}
