package com.ctrlsys.api;

import com.ctrlsys.signal.InputPort;
import com.ctrlsys.signal.OutputPort;

import java.util.Map;

/**
 * A computational unit of the control system.
 *
 * Sources, plant models, controllers and sinks all implement this interface.
 * The builder and the runtime only ever talk to blocks through it and never
 * need the concrete type.
 *
 * Key Responsibilities:
 *
 * 1. Identity: name() is unique within a control system. It is the node key of
 * the dependency graph and appears in every wiring error.
 *
 * 2. Ports: inputPorts() and outputPorts() enumerate the named connection
 * points. Output ports own their signal from construction; input ports are
 * bound by the builder when the system is built.
 *
 * 3. Delay: delay() declares that the output of the current step does not
 * combinationally depend on the input of the current step. A block with a
 * positive delay breaks feedback loops.
 *
 * 4. Computation: step() reads inputs, writes outputs and advances private
 * state.
 */
public interface Block {

    /**
     * Returns the unique name of this block.
     */
    String name();

    /**
     * Enumerates the input ports by local name.
     *
     * The map is a live view of the ports: the builder binds the returned
     * instances in place.
     */
    Map<String, InputPort<?>> inputPorts();

    /**
     * Enumerates the output ports by local name.
     */
    Map<String, OutputPort<?>> outputPorts();

    /**
     * Number of steps by which the output lags the input.
     *
     * Zero means the block reads its inputs of the current step and must run
     * after their producers. Anything greater removes this block's incoming
     * edges from the scheduling graph.
     *
     * @return a non-negative delay, 0 by default.
     */
    default int delay() {
        return 0;
    }

    /**
     * Executes one step.
     *
     * Called exactly once per tick, in topological order. Every input fed
     * through a zero-delay edge has already been written for this tick.
     *
     * Errors are reported by throwing. The runtime aborts the rest of the tick
     * and rethrows the same exception to its caller.
     *
     * @param info Step counter and simulated time of this tick.
     * @return STOP to request the end of the simulation after this tick.
     */
    StepResult step(StepInfo info);

    /**
     * Called on every block once all blocks have completed step() for the
     * tick.
     *
     * All signals hold their values for this tick here. Blocks with a delay
     * latch their input at this point so that the result does not depend on
     * whether their producer ran before or after them.
     */
    default void endStep(StepInfo info) {
    }
}
