package com.synclab.laddersim.engine.fault;

import com.synclab.laddersim.engine.state.SimulationState;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FaultInjectorTest {

    private SimulationState state;
    private FaultInjector injector;

    @Before
    public void setUp() {
        state = new SimulationState();
        injector = new FaultInjector(42L);
    }

    @Test
    public void noFaultsSampleNothing() {
        assertTrue(injector.sample(state, 0).isEmpty());
        assertTrue(injector.isEmpty());
    }

    @Test
    public void stuckAndInvertedFaults() {
        state.setTag("A", false);
        state.setTag("B", true);
        state.setTag("C", true);
        injector.injectFault("A", FaultConfig.of(FaultType.STUCK_ON));
        injector.injectFault("B", FaultConfig.of(FaultType.STUCK_OFF));
        injector.injectFault("C", FaultConfig.of(FaultType.INVERTED));

        Map<String, Boolean> sampled = injector.sample(state, 0);

        assertEquals(Boolean.TRUE, sampled.get("A"));
        assertEquals(Boolean.FALSE, sampled.get("B"));
        assertEquals(Boolean.FALSE, sampled.get("C"));
        assertFalse("the stored value is untouched", state.tag("A"));
    }

    @Test
    public void intermittentWithExtremeProbabilities() {
        state.setTag("A", true);
        injector.injectFault("A", FaultConfig.intermittent(0.0));
        for (int i = 0; i < 20; i++) {
            assertTrue(injector.sample(state, i).get("A"));
        }
        injector.injectFault("A", FaultConfig.intermittent(1.0));
        for (int i = 0; i < 20; i++) {
            assertFalse(injector.sample(state, i).get("A"));
        }
    }

    @Test
    public void sameSeedReplaysIntermittentFaults() {
        FaultInjector other = new FaultInjector(42L);
        injector.injectFault("A", FaultConfig.intermittent(0.5));
        other.injectFault("A", FaultConfig.intermittent(0.5));

        List<Boolean> first = run(injector, 50);
        assertEquals(first, run(other, 50));

        injector.reset();
        assertEquals("reset reseeds", first, run(injector, 50));
    }

    private List<Boolean> run(FaultInjector faults, int scans) {
        List<Boolean> values = new ArrayList<>();
        for (int i = 0; i < scans; i++) {
            values.add(faults.sample(state, i * 100L).get("A"));
        }
        return values;
    }

    @Test
    public void delayedFaultLagsTheRealValue() {
        injector.injectFault("A", FaultConfig.delayed(500));
        state.setTag("A", false);
        assertFalse(injector.sample(state, 0).get("A"));

        state.setTag("A", true);
        assertFalse(injector.sample(state, 100).get("A"));
        assertFalse(injector.sample(state, 500).get("A"));
        assertTrue(injector.sample(state, 600).get("A"));

        state.setTag("A", false);
        assertTrue(injector.sample(state, 700).get("A"));
        assertFalse(injector.sample(state, 1200).get("A"));
    }

    @Test
    public void clearingFaults() {
        injector.injectFault("A", FaultConfig.of(FaultType.STUCK_ON));
        injector.injectFault("B", FaultConfig.of(FaultType.STUCK_OFF));
        assertTrue(injector.hasFault("A"));
        assertEquals(FaultType.STUCK_ON, injector.getFault("A").getType());

        injector.clearFault("A");
        assertFalse(injector.hasFault("A"));
        assertEquals(1, injector.getFaults().size());

        injector.clearAllFaults();
        assertTrue(injector.isEmpty());
    }

    @Test
    public void parsesFaultTypeSpellings() {
        assertEquals(FaultType.STUCK_ON, FaultType.parse("stuck-on"));
        assertEquals(FaultType.STUCK_OFF, FaultType.parse("stuckOff"));
        assertEquals(FaultType.INVERTED, FaultType.parse("inverted"));
        assertEquals(FaultType.DELAYED, FaultType.parse("DELAYED"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsUnknownFaultType() {
        FaultType.parse("melted");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsProbabilityOutOfRange() {
        FaultConfig.intermittent(1.5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeDelay() {
        FaultConfig.delayed(-1);
    }
}
