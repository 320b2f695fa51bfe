package com.synclab.laddersim.engine.update;

import com.synclab.laddersim.engine.model.InstructionSite;
import com.synclab.laddersim.engine.state.CounterState;
import com.synclab.laddersim.engine.state.ScanUpdates;
import com.synclab.laddersim.engine.state.SimulationState;
import com.synclab.laddersim.engine.state.StateView;
import com.synclab.laddersim.engine.state.TimerState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pending writes of one scan layered over the committed state. Later instructions of the rung
 * read what earlier ones wrote; the committed state is left alone until the caller applies the
 * resulting {@link ScanUpdates}.
 */
class WorkingState implements StateView {

    private final SimulationState base;
    private final Map<String, Boolean> tags = new LinkedHashMap<>();
    private final Map<String, Double> numerics = new LinkedHashMap<>();
    private final Map<String, TimerState> timers = new LinkedHashMap<>();
    private final Map<String, CounterState> counters = new LinkedHashMap<>();
    private final Map<InstructionSite, Boolean> edges = new LinkedHashMap<>();

    WorkingState(SimulationState base) {
        this.base = base;
    }

    @Override
    public Boolean tag(String name) {
        Boolean pending = tags.get(name);
        return pending != null ? pending : base.tag(name);
    }

    @Override
    public Double numeric(String name) {
        Double pending = numerics.get(name);
        return pending != null ? pending : base.numeric(name);
    }

    @Override
    public TimerState timer(String name) {
        TimerState pending = timers.get(name);
        return pending != null ? pending : base.timer(name);
    }

    @Override
    public CounterState counter(String name) {
        CounterState pending = counters.get(name);
        return pending != null ? pending : base.counter(name);
    }

    boolean previousEnergized(InstructionSite site) {
        return base.previousEnergized(site);
    }

    /** Pending copy of the timer, created with {@code preset} on first observation. */
    TimerState timerForWrite(String name, long preset) {
        TimerState pending = timers.get(name);
        if (pending == null) {
            TimerState committed = base.timer(name);
            pending = committed != null ? committed.copy() : new TimerState(preset);
            timers.put(name, pending);
        }
        return pending;
    }

    CounterState counterForWrite(String name, int preset) {
        CounterState pending = counters.get(name);
        if (pending == null) {
            CounterState committed = base.counter(name);
            pending = committed != null ? committed.copy() : new CounterState(preset);
            counters.put(name, pending);
        }
        return pending;
    }

    void putTag(String name, boolean value) {
        tags.put(name, value);
    }

    void putNumeric(String name, double value) {
        numerics.put(name, value);
    }

    void putEdge(InstructionSite site, boolean energized) {
        edges.put(site, energized);
    }

    ScanUpdates toUpdates() {
        return new ScanUpdates(tags, timers, counters, numerics, edges);
    }
}
