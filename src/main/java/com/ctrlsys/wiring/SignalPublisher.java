package com.ctrlsys.wiring;

import com.lmax.disruptor.RingBuffer;

/**
 * Producer side of signal recording: claims a slot in the ring buffer, fills
 * it and publishes it.
 *
 * Must be used from the simulation thread only (single producer).
 */
public final class SignalPublisher {
    private final RingBuffer<SignalSample> ringBuffer;

    public SignalPublisher(RingBuffer<SignalSample> ringBuffer) {
        this.ringBuffer = ringBuffer;
    }

    public void publish(String signal, long k, double t, double value) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(signal, k, t, value);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /** Slots currently free; a full buffer makes publish() wait for the consumer. */
    public long remainingCapacity() {
        return ringBuffer.remainingCapacity();
    }
}
