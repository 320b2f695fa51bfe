package com.synclab.laddersim.controller;

import com.synclab.laddersim.config.SimulationProperties;
import com.synclab.laddersim.engine.trend.TrendPoint;
import com.synclab.laddersim.simulation.SessionSnapshot;
import com.synclab.laddersim.simulation.SimulationSessionRegistry;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SimulationControllerTest {

    private SimulationSessionRegistry registry;
    private SimulationController controller;

    @Before
    public void setUp() {
        SimulationProperties properties = new SimulationProperties();
        properties.setFaultSeed(1L);
        registry = new SimulationSessionRegistry(properties);
        controller = new SimulationController(registry, properties);
    }

    @After
    public void tearDown() {
        registry.shutdown();
    }

    private static SimulationController.InstructionRequest instruction(String type, String... operands) {
        SimulationController.InstructionRequest request = new SimulationController.InstructionRequest();
        request.setType(type);
        request.setOperands(Arrays.asList(operands));
        return request;
    }

    private SessionSnapshot createMotorRung() {
        SimulationController.InstructionRequest start = instruction("XIC", "Start");
        start.setBranchLeg(1);
        start.setBranchLevel(1);
        start.setBranchStart(true);
        // older parser output for the seal-in leg
        SimulationController.InstructionRequest seal = instruction("XIC", "Motor");
        seal.setLegacyBranchLevel(1);
        seal.setParallelIndex(1);

        List<SimulationController.InstructionRequest> instructions = new ArrayList<>();
        instructions.add(start);
        instructions.add(seal);
        instructions.add(instruction("XIO", "Stop"));
        instructions.add(instruction("OTE", "Motor"));

        SimulationController.CreateSessionRequest request = new SimulationController.CreateSessionRequest();
        request.setRungId("rung-7");
        request.setInstructions(instructions);
        return controller.create(request);
    }

    @Test
    public void createScanAndToggle() {
        SessionSnapshot created = createMotorRung();
        assertEquals("rung-7", created.getRungId());
        assertEquals(0, created.getScanCount());

        SessionSnapshot toggled = controller.toggle(created.getId(), "Start");
        assertEquals(Boolean.TRUE, toggled.getTags().get("Motor"));

        controller.toggle(created.getId(), "Start");
        SessionSnapshot scanned = controller.scan(created.getId(), 100L);
        assertEquals(Boolean.TRUE, scanned.getTags().get("Motor"));
        assertEquals(100L, scanned.getSimulatedMillis());

        SessionSnapshot defaultScan = controller.scan(created.getId(), null);
        assertEquals(100L + 100L, defaultScan.getSimulatedMillis());
    }

    @Test
    public void forcesAndFaults() {
        String id = createMotorRung().getId();

        SessionSnapshot forced = controller.force(id, "Start", "on");
        assertEquals("on", forced.getForces().get("Start"));
        assertEquals(Boolean.TRUE, forced.getTags().get("Motor"));

        SessionSnapshot released = controller.unforce(id, "Start");
        assertTrue(released.getForces().isEmpty());

        SimulationController.FaultRequest fault = new SimulationController.FaultRequest();
        fault.setType("stuck-on");
        SessionSnapshot faulted = controller.injectFault(id, "Stop", fault);
        assertEquals("STUCK_ON", faulted.getFaults().get("Stop"));

        SessionSnapshot scanned = controller.scan(id, 100L);
        assertEquals(Boolean.FALSE, scanned.getTags().get("Motor"));

        assertTrue(controller.clearFault(id, "Stop").getFaults().isEmpty());
    }

    @Test
    public void intermittentFaultTakesProbability() {
        String id = createMotorRung().getId();
        SimulationController.FaultRequest fault = new SimulationController.FaultRequest();
        fault.setType("intermittent");
        fault.setProbability(0.25);
        assertEquals("INTERMITTENT(0.25)", controller.injectFault(id, "Start", fault).getFaults().get("Start"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void badForceValueIsRejected() {
        controller.force(createMotorRung().getId(), "Start", "sideways");
    }

    @Test
    public void badArgumentMapsToBadRequest() {
        ResponseEntity<String> response = controller.handleBadArgument(new IllegalArgumentException("nope"));
        assertEquals(HttpStatus.BAD_REQUEST.value(), response.getStatusCode().value());
        assertEquals("nope", response.getBody());
    }

    @Test
    public void numericAndTimerEdits() {
        String id = createMotorRung().getId();
        assertEquals(3.5, controller.setNumeric(id, "Speed", 3.5).getNumerics().get("Speed"), 0.0);
        assertEquals(700L, controller.editTimer(id, "T1", 700L).getTimers().get("T1").getAcc());
        assertEquals(2, controller.editCounter(id, "C1", 2).getCounters().get("C1").getAcc());
    }

    @Test
    public void trendEndpoints() {
        String id = createMotorRung().getId();
        controller.track(id, "Motor");
        controller.setTag(id, "Start", true);
        controller.scan(id, 100L);

        SimulationController.TrendResponse trend = controller.trend(id);
        assertTrue(trend.isRecording());
        List<TrendPoint> points = trend.getSeries().get("Motor");
        assertFalse(points.isEmpty());

        assertFalse(controller.trendControl(id, "pause").isRecording());
        assertTrue(controller.trendControl(id, "clear").getSeries().get("Motor").isEmpty());
        assertTrue(controller.untrack(id, "Motor").getSeries().isEmpty());
    }

    @Test
    public void autoScanEndpoint() {
        String id = createMotorRung().getId();
        assertTrue(controller.autoScan(id, "start").isAutoScanning());
        assertFalse(controller.autoScan(id, "stop").isAutoScanning());
        expectStatus(HttpStatus.BAD_REQUEST, () -> controller.autoScan(id, "sideways"));
    }

    @Test
    public void resetAndDelete() {
        String id = createMotorRung().getId();
        controller.scan(id, 100L);
        assertEquals(0, controller.reset(id).getScanCount());

        assertEquals(HttpStatus.NO_CONTENT.value(), controller.delete(id).getStatusCode().value());
        expectStatus(HttpStatus.NOT_FOUND, () -> controller.get(id));
        expectStatus(HttpStatus.NOT_FOUND, () -> controller.delete(id));
    }

    @Test
    public void rejectsNegativeElapsedAndMissingInstructions() {
        String id = createMotorRung().getId();
        expectStatus(HttpStatus.BAD_REQUEST, () -> controller.scan(id, -1L));
        expectStatus(HttpStatus.BAD_REQUEST, () -> controller.create(new SimulationController.CreateSessionRequest()));
    }

    private static void expectStatus(HttpStatus status, Runnable call) {
        try {
            call.run();
            fail("expected " + status);
        } catch (ResponseStatusException e) {
            assertEquals(status.value(), e.getStatusCode().value());
        }
    }
}
