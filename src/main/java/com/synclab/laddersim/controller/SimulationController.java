package com.synclab.laddersim.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.synclab.laddersim.config.SimulationProperties;
import com.synclab.laddersim.engine.fault.FaultConfig;
import com.synclab.laddersim.engine.fault.FaultType;
import com.synclab.laddersim.engine.force.ForceValue;
import com.synclab.laddersim.engine.model.Instruction;
import com.synclab.laddersim.engine.trend.TrendPoint;
import com.synclab.laddersim.simulation.SessionSnapshot;
import com.synclab.laddersim.simulation.SimulationSession;
import com.synclab.laddersim.simulation.SimulationSessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/simulation/sessions")
public class SimulationController {
    private static final Logger log = LoggerFactory.getLogger(SimulationController.class);
    private final SimulationSessionRegistry registry;
    private final long defaultScanMillis;

    public SimulationController(SimulationSessionRegistry registry,
                                SimulationProperties properties) {
        this.registry = registry;
        this.defaultScanMillis = properties.getScanIntervalMs();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SessionSnapshot create(@RequestBody CreateSessionRequest request) {
        if (request == null || request.getInstructions() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "instructions are required");
        }
        List<Instruction> instructions = new ArrayList<>(request.getInstructions().size());
        for (InstructionRequest item : request.getInstructions()) {
            instructions.add(item.toInstruction());
        }
        return registry.create(request.getRungId(), instructions).snapshot();
    }

    @GetMapping("/{id}")
    public SessionSnapshot get(@PathVariable String id) {
        return session(id).snapshot();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (!registry.remove(id)) {
            throw notFound(id);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/scan")
    public SessionSnapshot scan(@PathVariable String id, @RequestParam(required = false) Long elapsedMs) {
        SimulationSession session = session(id);
        long elapsed = elapsedMs != null ? elapsedMs : defaultScanMillis;
        if (elapsed < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "elapsedMs must not be negative");
        }
        session.scan(elapsed);
        return session.snapshot();
    }

    @PostMapping("/{id}/reset")
    public SessionSnapshot reset(@PathVariable String id) {
        SimulationSession session = session(id);
        session.reset();
        return session.snapshot();
    }

    /** Toggle then rescan, the way a click on a contact re-evaluates the rung. Forced tags are left alone. */
    @PostMapping("/{id}/tags/{tag}/toggle")
    public SessionSnapshot toggle(@PathVariable String id, @PathVariable String tag) {
        SimulationSession session = session(id);
        if (session.toggleTag(tag)) {
            session.scan(0L);
        }
        return session.snapshot();
    }

    @PutMapping("/{id}/tags/{tag}")
    public SessionSnapshot setTag(@PathVariable String id, @PathVariable String tag, @RequestParam boolean value) {
        SimulationSession session = session(id);
        session.setTag(tag, value);
        session.scan(0L);
        return session.snapshot();
    }

    @PutMapping("/{id}/numerics/{tag}")
    public SessionSnapshot setNumeric(@PathVariable String id, @PathVariable String tag, @RequestParam double value) {
        SimulationSession session = session(id);
        session.setNumeric(tag, value);
        session.scan(0L);
        return session.snapshot();
    }

    @PutMapping("/{id}/timers/{tag}/acc")
    public SessionSnapshot editTimer(@PathVariable String id, @PathVariable String tag, @RequestParam long value) {
        SimulationSession session = session(id);
        session.editTimerAccumulator(tag, value);
        return session.snapshot();
    }

    @PutMapping("/{id}/counters/{tag}/acc")
    public SessionSnapshot editCounter(@PathVariable String id, @PathVariable String tag, @RequestParam int value) {
        SimulationSession session = session(id);
        session.editCounterAccumulator(tag, value);
        return session.snapshot();
    }

    @PostMapping("/{id}/forces/{tag}")
    public SessionSnapshot force(@PathVariable String id, @PathVariable String tag, @RequestParam String value) {
        SimulationSession session = session(id);
        session.force(tag, ForceValue.parse(value));
        session.scan(0L);
        return session.snapshot();
    }

    @DeleteMapping("/{id}/forces/{tag}")
    public SessionSnapshot unforce(@PathVariable String id, @PathVariable String tag) {
        SimulationSession session = session(id);
        session.removeForce(tag);
        session.scan(0L);
        return session.snapshot();
    }

    @PostMapping("/{id}/faults/{tag}")
    public SessionSnapshot injectFault(@PathVariable String id, @PathVariable String tag, @RequestBody FaultRequest request) {
        if (request == null || request.getType() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "type is required");
        }
        SimulationSession session = session(id);
        session.injectFault(tag, request.toConfig());
        return session.snapshot();
    }

    @DeleteMapping("/{id}/faults/{tag}")
    public SessionSnapshot clearFault(@PathVariable String id, @PathVariable String tag) {
        SimulationSession session = session(id);
        session.clearFault(tag);
        return session.snapshot();
    }

    @PostMapping("/{id}/trend/tags/{tag}")
    public TrendResponse track(@PathVariable String id, @PathVariable String tag) {
        SimulationSession session = session(id);
        session.trackTag(tag);
        return trend(session);
    }

    @DeleteMapping("/{id}/trend/tags/{tag}")
    public TrendResponse untrack(@PathVariable String id, @PathVariable String tag) {
        SimulationSession session = session(id);
        session.untrackTag(tag);
        return trend(session);
    }

    @GetMapping("/{id}/trend")
    public TrendResponse trend(@PathVariable String id) {
        return trend(session(id));
    }

    @PostMapping("/{id}/trend/{action}")
    public TrendResponse trendControl(@PathVariable String id, @PathVariable String action) {
        SimulationSession session = session(id);
        switch (action.toLowerCase()) {
            case "pause" -> session.pauseTrend();
            case "resume" -> session.resumeTrend();
            case "clear" -> session.clearTrend();
            default -> throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown trend action: " + action);
        }
        return trend(session);
    }

    @PostMapping("/{id}/auto-scan/{action}")
    public SessionSnapshot autoScan(@PathVariable String id, @PathVariable String action) {
        SimulationSession session = session(id);
        switch (action.toLowerCase()) {
            case "start" -> session.startAutoScan();
            case "stop" -> session.stopAutoScan();
            default -> throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown auto-scan action: " + action);
        }
        return session.snapshot();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadArgument(IllegalArgumentException e) {
        log.warn("Rejected simulation request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    private SimulationSession session(String id) {
        return registry.find(id).orElseThrow(() -> notFound(id));
    }

    private static ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, String.format("Session not found: %s", id));
    }

    private static TrendResponse trend(SimulationSession session) {
        return new TrendResponse(session.isTrendRecording(), session.trendSeries());
    }

    public static class CreateSessionRequest {
        private String rungId;
        private List<InstructionRequest> instructions;

        public String getRungId() {
            return rungId;
        }

        public void setRungId(String rungId) {
            this.rungId = rungId;
        }

        public List<InstructionRequest> getInstructions() {
            return instructions;
        }

        public void setInstructions(List<InstructionRequest> instructions) {
            this.instructions = instructions;
        }
    }

    /**
     * One parsed instruction. Accepts either {@code branchLeg}/{@code branchLevel}/{@code branchStart}
     * or the older {@code branch_level}/{@code parallel_index} pair.
     */
    public static class InstructionRequest {
        private String type;
        private List<String> operands;
        private Integer branchLeg;
        private Integer branchLevel;
        private Boolean branchStart;
        @JsonProperty("branch_level")
        private Integer legacyBranchLevel;
        @JsonProperty("parallel_index")
        private Integer parallelIndex;

        Instruction toInstruction() {
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("instruction type is required");
            }
            Instruction.Builder builder = Instruction.builder(type);
            if (operands != null) {
                builder.operands(operands);
            }
            if (branchLeg != null || branchLevel != null || branchStart != null) {
                builder.branch(branchLeg, branchLevel, branchStart);
            } else if (legacyBranchLevel != null || parallelIndex != null) {
                builder.legacyBranch(legacyBranchLevel, parallelIndex);
            }
            return builder.build();
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public List<String> getOperands() {
            return operands;
        }

        public void setOperands(List<String> operands) {
            this.operands = operands;
        }

        public Integer getBranchLeg() {
            return branchLeg;
        }

        public void setBranchLeg(Integer branchLeg) {
            this.branchLeg = branchLeg;
        }

        public Integer getBranchLevel() {
            return branchLevel;
        }

        public void setBranchLevel(Integer branchLevel) {
            this.branchLevel = branchLevel;
        }

        public Boolean getBranchStart() {
            return branchStart;
        }

        public void setBranchStart(Boolean branchStart) {
            this.branchStart = branchStart;
        }

        public Integer getLegacyBranchLevel() {
            return legacyBranchLevel;
        }

        public void setLegacyBranchLevel(Integer legacyBranchLevel) {
            this.legacyBranchLevel = legacyBranchLevel;
        }

        public Integer getParallelIndex() {
            return parallelIndex;
        }

        public void setParallelIndex(Integer parallelIndex) {
            this.parallelIndex = parallelIndex;
        }
    }

    public static class FaultRequest {
        private String type;
        private Double probability;
        private Long delayMs;

        FaultConfig toConfig() {
            FaultType faultType = FaultType.parse(type);
            return switch (faultType) {
                case INTERMITTENT -> FaultConfig.intermittent(probability != null ? probability : FaultConfig.DEFAULT_PROBABILITY);
                case DELAYED -> FaultConfig.delayed(delayMs != null ? delayMs : FaultConfig.DEFAULT_DELAY_MILLIS);
                default -> FaultConfig.of(faultType);
            };
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Double getProbability() {
            return probability;
        }

        public void setProbability(Double probability) {
            this.probability = probability;
        }

        public Long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(Long delayMs) {
            this.delayMs = delayMs;
        }
    }

    public static class TrendResponse {
        private final boolean recording;
        private final Map<String, List<TrendPoint>> series;

        public TrendResponse(boolean recording, Map<String, List<TrendPoint>> series) {
            this.recording = recording;
            this.series = series;
        }

        public boolean isRecording() {
            return recording;
        }

        public Map<String, List<TrendPoint>> getSeries() {
            return series;
        }
    }
}
