package com.ctrlsys.api;

/**
 * Observability interface for monitoring the stepping loop.
 *
 * Implementations can be registered with the ControlSystem to receive
 * callbacks during each tick. This is the primary mechanism for:
 *
 * - Profiling: measuring how long a tick or a single block takes.
 * - Debugging: tracing the execution order and step results.
 * - Error reporting: a block failure is announced here before it is
 * rethrown to the caller.
 *
 * Performance Warning:
 * These callbacks run inside the stepping loop. Implementations must be
 * lightweight; blocking I/O here directly slows the simulation down.
 */
public interface StepListener {

    /**
     * Called immediately before the first block of a tick runs.
     *
     * @param k Step counter of the tick.
     * @param t Simulated time of the tick.
     */
    void onStepStart(long k, double t);

    /**
     * Called after a block has returned from step().
     *
     * @param k             Step counter of the tick.
     * @param index         Position of the block in the execution order.
     * @param blockName     Name of the block.
     * @param result        What the block returned.
     * @param durationNanos Wall-clock time spent in step().
     */
    void onBlockStepped(long k, int index, String blockName, StepResult result, long durationNanos);

    /**
     * Called when a block throws from step(). The tick is aborted afterwards.
     *
     * @param k         Step counter of the tick.
     * @param index     Position of the block in the execution order.
     * @param blockName Name of the failing block.
     * @param error     The exception that occurred.
     */
    void onBlockError(long k, int index, String blockName, Throwable error);

    /**
     * Called when the tick has completed.
     *
     * @param k      Step counter of the completed tick.
     * @param result Aggregated result of the tick, including max-iteration stops.
     */
    void onStepEnd(long k, StepResult result);
}
