package com.ctrlsys.api;

import org.junit.Test;

import static org.junit.Assert.*;

public class StepResultTest {

    @Test
    public void testStopWins() {
        assertEquals(StepResult.CONTINUE, StepResult.CONTINUE.and(StepResult.CONTINUE));
        assertEquals(StepResult.STOP, StepResult.CONTINUE.and(StepResult.STOP));
        assertEquals(StepResult.STOP, StepResult.STOP.and(StepResult.CONTINUE));
    }

    @Test
    public void testStepInfoAdvances() {
        StepInfo first = StepInfo.initial(0.25);
        assertEquals(1, first.k());
        assertEquals(0.0, first.t(), 0.0);
        StepInfo second = first.next();
        assertEquals(2, second.k());
        assertEquals(0.25, second.t(), 0.0);
        assertEquals(0.25, second.dt(), 0.0);
    }
}
