package com.ctrlsys.wiring;

import com.lmax.disruptor.EventHandler;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Disruptor EventHandler accumulating one time series per signal.
 *
 * Runs on the consumer thread. Readers on any other thread get copies through
 * {@link #series(String)}, which is what a plotting front end would poll.
 */
public final class SignalRecorder implements EventHandler<SignalSample> {
    private final Map<String, Series> series = new ConcurrentHashMap<>();
    private final AtomicLong received = new AtomicLong();

    @Override
    public void onEvent(SignalSample sample, long sequence, boolean endOfBatch) {
        series.computeIfAbsent(sample.signal(), Series::new).append(sample.k(), sample.t(), sample.value());
        received.incrementAndGet();
        sample.clear();
    }

    public long received() {
        return received.get();
    }

    public Set<String> signals() {
        return Set.copyOf(series.keySet());
    }

    /** Copy of everything recorded for the signal so far. */
    public Optional<Samples> series(String signal) {
        Series s = series.get(signal);
        return s == null ? Optional.empty() : Optional.of(s.snapshot());
    }

    /** Recorded values of one signal, index-aligned. */
    public record Samples(String signal, long[] k, double[] t, double[] values) {
        public int size() {
            return values.length;
        }
    }

    private static final class Series {
        private final String name;
        private long[] k = new long[256];
        private double[] t = new double[256];
        private double[] v = new double[256];
        private int size;

        Series(String name) {
            this.name = name;
        }

        synchronized void append(long step, double time, double value) {
            if (size == v.length) {
                int cap = size * 2;
                k = Arrays.copyOf(k, cap);
                t = Arrays.copyOf(t, cap);
                v = Arrays.copyOf(v, cap);
            }
            k[size] = step;
            t[size] = time;
            v[size] = value;
            size++;
        }

        synchronized Samples snapshot() {
            return new Samples(name, Arrays.copyOf(k, size), Arrays.copyOf(t, size), Arrays.copyOf(v, size));
        }
    }
}
