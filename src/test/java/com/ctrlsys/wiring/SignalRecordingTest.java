package com.ctrlsys.wiring;

import com.ctrlsys.ControlSystems;
import com.ctrlsys.block.Generator;
import com.ctrlsys.block.Probe;
import com.ctrlsys.engine.ControlSystem;
import com.ctrlsys.engine.ControlSystemParameters;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class SignalRecordingTest {

    @Test
    public void testProbeSamplesReachRecorder() {
        SignalRecording recording = SignalRecording.start(16);
        SignalRecorder recorder = recording.recorder();
        assertEquals(16, recording.publisher().remainingCapacity());
        try (recording) {
            ControlSystem cs = ControlSystems.builder()
                    .addSource(Generator.of("ramp", Double.class, info -> info.k() * 1.5), Map.of("y", "/ramp"))
                    .addSink(new Probe("probe", recording.publisher()), Map.of("u", "/ramp"))
                    .build("recorded", ControlSystemParameters.of(0.5));
            // More samples than slots: the producer waits for the consumer
            cs.run(40);
        }

        assertEquals(40, recorder.received());
        assertEquals(java.util.Set.of("/ramp"), recorder.signals());
        SignalRecorder.Samples s = recorder.series("/ramp").get();
        assertEquals(40, s.size());
        assertEquals(1, s.k()[0]);
        assertEquals(0.0, s.t()[0], 0.0);
        assertEquals(1.5, s.values()[0], 0.0);
        assertEquals(40, s.k()[39]);
        assertEquals(19.5, s.t()[39], 1e-9);
        assertEquals(60.0, s.values()[39], 0.0);
        assertFalse(recorder.series("/other").isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBufferSizeMustBePowerOfTwo() {
        SignalRecording.start(1000);
    }

    @Test
    public void testSampleFlyweight() {
        SignalSample sample = new SignalSample();
        sample.set("/x", 3, 0.2, 4.0);
        assertEquals("/x", sample.signal());
        assertEquals(3, sample.k());
        sample.clear();
        assertNull(sample.signal());
        assertEquals(0.0, sample.value(), 0.0);
    }
}
