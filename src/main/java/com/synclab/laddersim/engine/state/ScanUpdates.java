package com.synclab.laddersim.engine.state;

import com.synclab.laddersim.engine.model.InstructionSite;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sparse next-state writes produced by one scan. Applied as a single batch by
 * {@link SimulationState#apply(ScanUpdates)}.
 */
public class ScanUpdates {

    private final Map<String, Boolean> tagUpdates;
    private final Map<String, TimerState> timerUpdates;
    private final Map<String, CounterState> counterUpdates;
    private final Map<String, Double> numericUpdates;
    private final Map<InstructionSite, Boolean> edgeUpdates;

    public ScanUpdates(Map<String, Boolean> tagUpdates,
                       Map<String, TimerState> timerUpdates,
                       Map<String, CounterState> counterUpdates,
                       Map<String, Double> numericUpdates,
                       Map<InstructionSite, Boolean> edgeUpdates) {
        this.tagUpdates = Collections.unmodifiableMap(new LinkedHashMap<>(tagUpdates));
        this.timerUpdates = Collections.unmodifiableMap(new LinkedHashMap<>(timerUpdates));
        this.counterUpdates = Collections.unmodifiableMap(new LinkedHashMap<>(counterUpdates));
        this.numericUpdates = Collections.unmodifiableMap(new LinkedHashMap<>(numericUpdates));
        this.edgeUpdates = Collections.unmodifiableMap(new LinkedHashMap<>(edgeUpdates));
    }

    public static ScanUpdates empty() {
        return new ScanUpdates(Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap(),
                Collections.emptyMap(), Collections.emptyMap());
    }

    public Map<String, Boolean> getTagUpdates() {
        return tagUpdates;
    }

    public Map<String, TimerState> getTimerUpdates() {
        return timerUpdates;
    }

    public Map<String, CounterState> getCounterUpdates() {
        return counterUpdates;
    }

    public Map<String, Double> getNumericUpdates() {
        return numericUpdates;
    }

    public Map<InstructionSite, Boolean> getEdgeUpdates() {
        return edgeUpdates;
    }

    public boolean isEmpty() {
        return tagUpdates.isEmpty() && timerUpdates.isEmpty() && counterUpdates.isEmpty()
                && numericUpdates.isEmpty() && edgeUpdates.isEmpty();
    }

    @Override
    public String toString() {
        return "ScanUpdates{tags=" + tagUpdates + ", timers=" + timerUpdates + ", counters=" + counterUpdates
                + ", numerics=" + numericUpdates + ", edges=" + edgeUpdates.size() + "}";
    }
}
