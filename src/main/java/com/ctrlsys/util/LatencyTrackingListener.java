package com.ctrlsys.util;

import com.ctrlsys.api.StepListener;
import com.ctrlsys.api.StepResult;

/**
 * A listener that tracks timing of whole ticks.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Min, Max, Average wall-clock time per tick (in
 * nanoseconds).</li>
 * <li><b>Throughput:</b> Total number of completed ticks.</li>
 * <li><b>Failures:</b> Number of block errors, logged with throttling.</li>
 * </ul>
 */
public final class LatencyTrackingListener implements StepListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(LatencyTrackingListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private long stepStartNanos, lastLatencyNanos;
    private long totalSteps, totalLatencyNanos, totalErrors;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private long lastK;

    @Override
    public void onStepStart(long k, double t) {
        stepStartNanos = System.nanoTime();
    }

    @Override
    public void onBlockStepped(long k, int index, String blockName, StepResult result, long durationNanos) {
        // No-op to keep overhead minimal
    }

    @Override
    public void onBlockError(long k, int index, String blockName, Throwable error) {
        totalErrors++;
        errLimiter.log(String.format("Control system failure at block '%s' (k=%d): %s", blockName, k,
                error.getMessage()), null);
    }

    @Override
    public void onStepEnd(long k, StepResult result) {
        lastLatencyNanos = System.nanoTime() - stepStartNanos;
        lastK = k;
        totalSteps++;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public long lastK() {
        return lastK;
    }

    public long totalSteps() {
        return totalSteps;
    }

    public long totalErrors() {
        return totalErrors;
    }

    public double avgLatencyNanos() {
        return totalSteps > 0 ? (double) totalLatencyNanos / totalSteps : 0;
    }

    public double avgLatencyMicros() {
        return avgLatencyNanos() / 1000.0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        totalSteps = 0;
        totalErrors = 0;
        totalLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %10s | %10s | %10s | %10s | %8s%n", "Metric", "Steps", "Avg (us)",
                "Min (us)", "Max (us)", "Errors"));
        sb.append("--------------------------------------------------------------------------\n");
        sb.append(String.format("%-12s | %10d | %10.2f | %10.2f | %10.2f | %8d%n",
                "Tick",
                totalSteps,
                avgLatencyMicros(),
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0,
                totalErrors));
        return sb.toString();
    }
}
