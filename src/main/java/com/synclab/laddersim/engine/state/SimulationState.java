package com.synclab.laddersim.engine.state;

import com.synclab.laddersim.engine.force.ForceTable;
import com.synclab.laddersim.engine.model.InstructionSite;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything one simulation session owns: tag, numeric, timer and counter values, operator
 * forces and the per-site edge memory used by counters. Created empty and never shared
 * between sessions.
 */
public class SimulationState implements StateView {

    private final Map<String, Boolean> tags = new LinkedHashMap<>();
    private final Map<String, Double> numerics = new LinkedHashMap<>();
    private final Map<String, TimerState> timers = new LinkedHashMap<>();
    private final Map<String, CounterState> counters = new LinkedHashMap<>();
    private final Map<InstructionSite, Boolean> previousEnergized = new HashMap<>();
    private final ForceTable forces = new ForceTable();

    @Override
    public Boolean tag(String name) {
        return tags.get(name);
    }

    @Override
    public Double numeric(String name) {
        return numerics.get(name);
    }

    @Override
    public TimerState timer(String name) {
        return timers.get(name);
    }

    @Override
    public CounterState counter(String name) {
        return counters.get(name);
    }

    public boolean previousEnergized(InstructionSite site) {
        return Boolean.TRUE.equals(previousEnergized.get(site));
    }

    public ForceTable getForces() {
        return forces;
    }

    public Map<String, Boolean> getTags() {
        return Collections.unmodifiableMap(tags);
    }

    public Map<String, Double> getNumerics() {
        return Collections.unmodifiableMap(numerics);
    }

    public Map<String, TimerState> getTimers() {
        return Collections.unmodifiableMap(timers);
    }

    public Map<String, CounterState> getCounters() {
        return Collections.unmodifiableMap(counters);
    }

    public Map<InstructionSite, Boolean> getPreviousEnergized() {
        return Collections.unmodifiableMap(previousEnergized);
    }

    public void setTag(String name, boolean value) {
        tags.put(name, value);
    }

    public void setNumeric(String name, double value) {
        numerics.put(name, value);
    }

    public void putTimer(String name, TimerState timer) {
        timers.put(name, timer.copy());
    }

    public void putCounter(String name, CounterState counter) {
        counters.put(name, counter.copy());
    }

    /** Commits one scan's writes. Nothing else mutates values between two evaluations. */
    public void apply(ScanUpdates updates) {
        tags.putAll(updates.getTagUpdates());
        numerics.putAll(updates.getNumericUpdates());
        updates.getTimerUpdates().forEach((name, timer) -> timers.put(name, timer.copy()));
        updates.getCounterUpdates().forEach((name, counter) -> counters.put(name, counter.copy()));
        previousEnergized.putAll(updates.getEdgeUpdates());
    }

    /** Drops all values and edge memory. Forces are kept. */
    public void clearValues() {
        tags.clear();
        numerics.clear();
        timers.clear();
        counters.clear();
        previousEnergized.clear();
    }

    public void clear() {
        clearValues();
        forces.clear();
    }

    public SimulationState copy() {
        SimulationState copy = new SimulationState();
        copy.tags.putAll(tags);
        copy.numerics.putAll(numerics);
        timers.forEach((name, timer) -> copy.timers.put(name, timer.copy()));
        counters.forEach((name, counter) -> copy.counters.put(name, counter.copy()));
        copy.previousEnergized.putAll(previousEnergized);
        forces.snapshot().forEach(copy.forces::force);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimulationState)) return false;
        SimulationState that = (SimulationState) o;
        return tags.equals(that.tags)
                && numerics.equals(that.numerics)
                && timers.equals(that.timers)
                && counters.equals(that.counters)
                && previousEnergized.equals(that.previousEnergized)
                && forces.snapshot().equals(that.forces.snapshot());
    }

    @Override
    public int hashCode() {
        int result = tags.hashCode();
        result = 31 * result + numerics.hashCode();
        result = 31 * result + timers.hashCode();
        result = 31 * result + counters.hashCode();
        return result;
    }
}
