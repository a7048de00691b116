package com.ctrlsys.util;

import com.ctrlsys.ControlSystems;
import com.ctrlsys.api.StepInfo;
import com.ctrlsys.api.StepResult;
import com.ctrlsys.block.AbstractBlock;
import com.ctrlsys.block.Constant;
import com.ctrlsys.engine.ControlSystem;
import com.ctrlsys.engine.ControlSystemParameters;
import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class ListenerTest {

    private ControlSystem failingOnThirdStep() {
        return ControlSystems.builder()
                .addSource(Constant.of("c", 1.0), Map.of("y", "c"))
                .addSink(new AbstractBlock("flaky") {
                    @Override
                    public StepResult step(StepInfo info) {
                        if (info.k() == 3)
                            throw new IllegalStateException("flaky");
                        return StepResult.CONTINUE;
                    }
                }, Map.of())
                .build("listeners", new ControlSystemParameters(1.0, 10));
    }

    @Test
    public void testCompositeFansOut() {
        ControlSystem cs = failingOnThirdStep();
        LatencyTrackingListener latency = new LatencyTrackingListener();
        BlockProfileListener profile = new BlockProfileListener();
        cs.setListener(new CompositeStepListener().add(latency).add(profile));

        cs.run(2);
        try {
            cs.step();
            fail("Expected failure");
        } catch (IllegalStateException expected) {
            // ok
        }

        assertEquals(2, latency.totalSteps());
        assertEquals(1, latency.totalErrors());
        assertEquals(2, latency.lastK());
        assertTrue(latency.maxLatencyNanos() >= latency.minLatencyNanos());

        BlockProfileListener.BlockStats[] stats = profile.getStatsArray();
        int flaky = cs.topology().topoIndex("flaky");
        assertEquals("flaky", stats[flaky].name);
        assertEquals(2, stats[flaky].count);
        assertEquals(1, stats[flaky].errors);
        assertEquals(3, stats[cs.topology().topoIndex("c")].count);
        assertTrue(profile.dump().contains("flaky"));
        assertTrue(latency.dump().contains("Tick"));
    }

    @Test
    public void testLatencyReset() {
        ControlSystem cs = failingOnThirdStep();
        LatencyTrackingListener latency = new LatencyTrackingListener();
        cs.setListener(latency);
        cs.run(2);
        latency.reset();
        assertEquals(0, latency.totalSteps());
        assertEquals(0.0, latency.avgLatencyNanos(), 0.0);
    }

    @Test
    public void testErrorRateLimiterThrottles() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ListenerTest.class), 60_000);
        assertTrue(limiter.log("first", null));
        assertFalse(limiter.log("second", null));
        assertFalse(limiter.log("third", null));
        assertEquals(2, limiter.suppressedCount());
    }
}
