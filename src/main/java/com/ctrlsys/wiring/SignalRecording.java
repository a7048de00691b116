package com.ctrlsys.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import lombok.extern.log4j.Log4j2;

/**
 * Owns the Disruptor that moves probe samples from the simulation thread to a
 * {@link SignalRecorder} on a daemon consumer thread.
 *
 * <pre>
 * try (var rec = SignalRecording.start(1024)) {
 *     builder.addSink(new Probe("p", rec.publisher()), Map.of("u", "/cart/pos"));
 *     ...
 * }
 * </pre>
 *
 * close() drains every published sample before returning.
 */
@Log4j2
public final class SignalRecording implements AutoCloseable {
    private final Disruptor<SignalSample> disruptor;
    private final SignalRecorder recorder;
    private final SignalPublisher publisher;

    private SignalRecording(int bufferSize) {
        this.recorder = new SignalRecorder();
        this.disruptor = new Disruptor<>(
                SignalSample::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(recorder);
        RingBuffer<SignalSample> ringBuffer = disruptor.start();
        this.publisher = new SignalPublisher(ringBuffer);
    }

    /**
     * @param bufferSize Ring buffer size, a power of two.
     */
    public static SignalRecording start(int bufferSize) {
        if (Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("bufferSize must be a power of 2, was " + bufferSize);
        return new SignalRecording(bufferSize);
    }

    public SignalPublisher publisher() {
        return publisher;
    }

    public SignalRecorder recorder() {
        return recorder;
    }

    @Override
    public void close() {
        disruptor.shutdown();
        log.debug("Signal recording stopped after {} samples", recorder.received());
    }
}
