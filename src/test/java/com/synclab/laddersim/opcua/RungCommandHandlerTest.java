package com.synclab.laddersim.opcua;

import com.synclab.laddersim.config.SimulationProperties;
import com.synclab.laddersim.engine.model.Instruction;
import com.synclab.laddersim.simulation.SimulationSession;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RungCommandHandlerTest {

    private final RungCommandHandler handler = new RungCommandHandler(100L);
    private SimulationSession session;

    @Before
    public void setUp() {
        session = new SimulationSession("S1", "r1",
                Arrays.asList(Instruction.of("XIC", "Start"), Instruction.of("OTE", "Lamp")),
                new SimulationProperties());
    }

    @After
    public void tearDown() {
        session.shutdown();
    }

    @Test
    public void scanUsesGivenOrDefaultElapsedTime() {
        assertTrue(handler.handle(session, "SCAN"));
        assertTrue(handler.handle(session, "scan:250"));
        assertEquals(2, session.getScanCount());
        assertEquals(350, session.getSimulatedMillis());
    }

    @Test
    public void toggleRescansImmediately() {
        assertTrue(handler.handle(session, "TOGGLE:Start"));
        assertTrue(session.displayedBoolean("Lamp"));
        assertEquals(0, session.getSimulatedMillis());
    }

    @Test
    public void forceCommandsRescanSoOutputsFollow() {
        assertTrue(handler.handle(session, "FORCE_ON:Start"));
        assertTrue(session.isForced("Start"));
        assertTrue(session.displayedBoolean("Lamp"));
        assertTrue(handler.handle(session, "FORCE_OFF:Start"));
        assertFalse(session.displayedBoolean("Start"));
        assertFalse(session.displayedBoolean("Lamp"));
        assertTrue(handler.handle(session, "UNFORCE:Start"));
        assertFalse(session.isForced("Start"));
        assertEquals(3, session.getScanCount());
        assertEquals(0, session.getSimulatedMillis());
    }

    @Test
    public void setWritesBooleansAndNumbers() {
        assertTrue(handler.handle(session, "SET:Start:on"));
        assertTrue(session.copyState().tag("Start"));
        assertTrue(session.displayedBoolean("Lamp"));
        assertTrue(handler.handle(session, "SET:Speed:12.5"));
        assertEquals(12.5, session.copyState().numeric("Speed"), 0.0);
        assertEquals(2, session.getScanCount());
    }

    @Test
    public void resetAndAutoScan() {
        handler.handle(session, "SCAN");
        assertTrue(handler.handle(session, "RESET"));
        assertEquals(0, session.getScanCount());

        assertTrue(handler.handle(session, "AUTO_START"));
        assertTrue(session.isAutoScanning());
        assertTrue(handler.handle(session, "AUTO_STOP"));
        assertFalse(session.isAutoScanning());
    }

    @Test
    public void rejectsUnknownAndMalformedCommands() {
        assertFalse(handler.handle(session, "EXPLODE"));
        assertFalse(handler.handle(session, "SCAN:soon"));
        assertFalse(handler.handle(session, "SET:Start"));
        assertFalse(handler.handle(session, "SET:Start:maybe"));
        assertFalse(handler.handle(session, "TOGGLE:"));
        assertFalse(handler.handle(session, "  "));
        assertFalse(handler.handle(session, null));
        assertEquals(0, session.getScanCount());
    }
}
