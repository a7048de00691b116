package com.ctrlsys.util;

import com.ctrlsys.api.StepListener;
import com.ctrlsys.api.StepResult;

import java.util.Arrays;
import java.util.Comparator;

/** Aggregates per-block step timings to identify expensive blocks. */
public class BlockProfileListener implements StepListener {

    public static class BlockStats {
        public final String name;
        public long count;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public BlockStats(String name) {
            this.name = name;
        }

        void update(long duration) {
            count++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    // Indexed by execution order position
    private BlockStats[] statsArray = new BlockStats[0];

    /** @return the stats array, indexed by execution order. */
    public BlockStats[] getStatsArray() {
        return statsArray;
    }

    @Override
    public void onStepStart(long k, double t) {
        // No-op
    }

    @Override
    public void onBlockStepped(long k, int index, String blockName, StepResult result, long durationNanos) {
        stats(index, blockName).update(durationNanos);
    }

    @Override
    public void onBlockError(long k, int index, String blockName, Throwable error) {
        stats(index, blockName).errors++;
    }

    @Override
    public void onStepEnd(long k, StepResult result) {
        // No-op
    }

    private BlockStats stats(int index, String blockName) {
        if (index >= statsArray.length)
            statsArray = Arrays.copyOf(statsArray, Math.max(index + 1, statsArray.length * 2));
        BlockStats s = statsArray[index];
        if (s == null) {
            s = new BlockStats(blockName);
            statsArray[index] = s;
        }
        return s;
    }

    /** Table of all profiled blocks, most expensive first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-24s | %10s | %10s | %10s | %10s%n", "Block", "Count", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("--------------------------------------------------------------------------\n");
        Arrays.stream(statsArray)
                .filter(s -> s != null && s.count > 0)
                .sorted(Comparator.comparingDouble(BlockStats::avgMicros).reversed())
                .forEach(s -> sb.append(String.format("%-24s | %10d | %10.2f | %10.2f | %10.2f%n",
                        s.name, s.count, s.avgMicros(), s.minDurationNanos / 1000.0,
                        s.maxDurationNanos / 1000.0)));
        return sb.toString();
    }
}
