package com.synclab.laddersim.simulation;

import com.synclab.laddersim.config.SimulationProperties;
import com.synclab.laddersim.engine.model.Instruction;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

public class SimulationSessionRegistryTest {

    private SimulationSessionRegistry registry;

    @Before
    public void setUp() {
        registry = new SimulationSessionRegistry(new SimulationProperties());
    }

    @After
    public void tearDown() {
        registry.shutdown();
    }

    @Test
    public void createsIndependentSessions() {
        List<Instruction> rung = Arrays.asList(Instruction.of("XIC", "A"), Instruction.of("OTE", "B"));
        SimulationSession first = registry.create("r1", rung);
        SimulationSession second = registry.create("r1", rung);

        assertEquals("S1", first.getId());
        assertEquals("S2", second.getId());
        assertNotSame(first, second);

        first.setTag("A", true);
        first.scan(100);
        second.scan(100);
        assertTrue(first.displayedBoolean("B"));
        assertFalse(second.displayedBoolean("B"));
        assertEquals(2, registry.getSessions().size());
    }

    @Test
    public void nullInstructionsGiveAnEmptyRung() {
        SimulationSession session = registry.create("empty", null);
        assertFalse(session.scan(100).isRungEnergized());
    }

    @Test
    public void removeDiscardsTheSession() {
        SimulationSession session = registry.create("r1", Arrays.asList(Instruction.of("OTE", "B")));
        assertTrue(registry.find(session.getId()).isPresent());

        assertTrue(registry.remove(session.getId()));
        assertFalse(registry.find(session.getId()).isPresent());
        assertFalse(registry.remove(session.getId()));
        assertFalse(registry.find(null).isPresent());
    }

    @Test
    public void listenersSeeCreationAndRemoval() {
        List<String> events = new ArrayList<>();
        registry.addListener(new SessionListener() {
            @Override
            public void sessionCreated(SimulationSession session) {
                events.add("created " + session.getId());
            }

            @Override
            public void sessionRemoved(SimulationSession session) {
                events.add("removed " + session.getId());
            }
        });
        SimulationSession session = registry.create("r1", Arrays.asList(Instruction.of("OTE", "B")));
        registry.remove(session.getId());
        assertEquals(Arrays.asList("created S1", "removed S1"), events);
    }

    @Test
    public void shutdownRemovesEverySession() {
        registry.create("a", Arrays.asList(Instruction.of("OTE", "B")));
        registry.create("b", Arrays.asList(Instruction.of("OTE", "C")));
        registry.shutdown();
        assertTrue(registry.getSessions().isEmpty());
    }
}
