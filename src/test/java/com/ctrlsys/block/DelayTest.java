package com.ctrlsys.block;

import com.ctrlsys.ControlSystems;
import com.ctrlsys.engine.ControlSystem;
import com.ctrlsys.engine.ControlSystemParameters;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class DelayTest {

    private ControlSystem delayedRamp(Delay<Double> delay) {
        return ControlSystems.builder()
                .addSource(Generator.of("ramp", Double.class, info -> 10.0 * info.k()), Map.of("y", "ramp"))
                .addBlock(delay, Map.of("u", "ramp"), Map.of("y", "out"))
                .build("delay", ControlSystemParameters.of(1.0));
    }

    @Test
    public void testDelayIsNumberOfInitialValues() {
        assertEquals(1, Delay.of("d", DelayParams.of(0.0)).delay());
        assertEquals(3, Delay.of("d", DelayParams.of(1.0, 2.0, 3.0)).delay());
    }

    @Test
    public void testSingleStep() {
        ControlSystem cs = delayedRamp(Delay.of("d", DelayParams.of(-1.0)));
        double[] expected = { -1.0, 10.0, 20.0, 30.0 };
        for (double e : expected) {
            cs.step();
            assertEquals(e, cs.value("out", Double.class).get(), 0.0);
        }
    }

    @Test
    public void testMultiStepEmitsInitialValuesInOrder() {
        ControlSystem cs = delayedRamp(Delay.of("d", DelayParams.of(1.0, 2.0, 3.0)));
        double[] expected = { 1.0, 2.0, 3.0, 10.0, 20.0, 30.0 };
        for (double e : expected) {
            cs.step();
            assertEquals(e, cs.value("out", Double.class).get(), 0.0);
        }
    }

    @Test
    public void testGenericPayload() {
        Delay<String> d = new Delay<>("d", String.class, List.of("init"));
        ControlSystem cs = ControlSystems.builder()
                .addSource(Generator.of("name", String.class, info -> "k" + info.k()), Map.of("y", "in"))
                .addBlock(d, Map.of("u", "in"), Map.of("y", "out"))
                .build("strings", ControlSystemParameters.of(1.0));
        cs.step();
        assertEquals("init", cs.value("out", String.class).get());
        cs.step();
        assertEquals("k1", cs.value("out", String.class).get());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoInitialValues() {
        new Delay<>("d", Double.class, List.of());
    }
}
