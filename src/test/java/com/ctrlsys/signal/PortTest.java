package com.ctrlsys.signal;

import com.ctrlsys.api.ControlSystemException;
import org.junit.Test;

import static org.junit.Assert.*;

public class PortTest {

    @Test
    public void testOutputOwnsTypedSignal() {
        OutputPort<Integer> out = new OutputPort<>("y", Integer.class);
        assertEquals(Integer.class, out.type());
        assertEquals(Integer.class, out.signal().type());
        assertFalse(out.isConnected());

        out.connect("/count");
        assertTrue(out.isConnected());
        assertEquals("/count", out.signalName());
    }

    @Test(expected = IllegalStateException.class)
    public void testOutputConnectsOnce() {
        OutputPort<Double> out = new OutputPort<>("y", Double.class);
        out.connect("/a");
        out.connect("/b");
    }

    @Test(expected = IllegalStateException.class)
    public void testSetBeforeConnect() {
        new OutputPort<>("y", Double.class).set(1.0);
    }

    @Test
    public void testInputTypeChecked() {
        OutputPort<Integer> out = new OutputPort<>("y", Integer.class);
        out.connect("/i");
        InputPort<Double> in = new InputPort<>("u", Double.class);
        try {
            in.connect(out.signal());
            fail("Expected type error");
        } catch (ControlSystemException e) {
            assertEquals(ControlSystemException.Kind.TYPE_ERROR, e.getKind());
            assertEquals("/i", e.getSignal());
        }
        assertFalse(in.isConnected());
    }

    @Test(expected = IllegalStateException.class)
    public void testInputBindsOnce() {
        OutputPort<Double> out = new OutputPort<>("y", Double.class);
        out.connect("/a");
        InputPort<Double> in = new InputPort<>("u", Double.class);
        in.connect(out.signal());
        in.connect(out.signal());
    }

    @Test(expected = IllegalStateException.class)
    public void testReadUnbound() {
        new InputPort<>("u", Double.class).get();
    }

    @Test
    public void testReadBeforeFirstWrite() {
        OutputPort<Double> out = new OutputPort<>("y", Double.class);
        out.connect("/a");
        InputPort<Double> in = new InputPort<>("u", Double.class);
        in.connect(out.signal());

        assertFalse(in.tryGet().isPresent());
        try {
            in.get();
            fail("Expected unwritten signal to be rejected");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("/a"));
        }
        out.set(3.0);
        assertEquals(3.0, in.tryGet().get(), 0.0);
        assertEquals("/a", in.signalName());
    }
}
