package com.ctrlsys;

import com.ctrlsys.dsl.ControlSystemBuilder;

/**
 * Discrete-time block diagram simulation.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Blocks</b> are named computational units with typed input and output
 * ports.</li>
 * <li><b>Signals</b> are named value slots; each is written by exactly one
 * output port and read by any number of input ports.</li>
 * <li><b>Steps</b> run every block once, producers before their zero-delay
 * consumers, and advance simulated time by dt.</li>
 * </ul>
 *
 * <h3>Guarantees</h3>
 * <ul>
 * <li><b>Checked wiring:</b> unconnected ports, duplicate producers, unknown
 * signals, type mismatches and cycles without a delay are rejected when the
 * system is built, never while it runs.</li>
 * <li><b>Deterministic:</b> the same blocks in the same state produce the same
 * outputs and the same next state.</li>
 * <li><b>Feedback:</b> loops are legal as long as one block on every loop
 * declares a delay, see {@link com.ctrlsys.block.Delay}.</li>
 * </ul>
 */
public final class ControlSystems {

    private ControlSystems() {
    }

    /**
     * Entry point: create a new builder.
     *
     * @return A new {@link ControlSystemBuilder}.
     */
    public static ControlSystemBuilder builder() {
        return ControlSystemBuilder.create();
    }
}
