package com.synclab.laddersim.simulation;

import com.synclab.laddersim.engine.state.CounterState;
import com.synclab.laddersim.engine.state.TimerState;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of a session, as returned over REST. Nothing in it is shared with the live
 * session.
 */
public class SessionSnapshot {

    private final String id;
    private final String rungId;
    private final long scanCount;
    private final long simulatedMillis;
    private final boolean rungEnergized;
    private final boolean autoScanning;
    private final List<Boolean> instructionEnergized;
    private final List<List<Boolean>> wireEnergized;
    private final Map<String, Boolean> tags;
    private final Map<String, Double> numerics;
    private final Map<String, TimerState> timers;
    private final Map<String, CounterState> counters;
    private final Map<String, String> forces;
    private final Map<String, String> faults;

    SessionSnapshot(String id,
                    String rungId,
                    long scanCount,
                    long simulatedMillis,
                    boolean rungEnergized,
                    boolean autoScanning,
                    List<Boolean> instructionEnergized,
                    List<List<Boolean>> wireEnergized,
                    Map<String, Boolean> tags,
                    Map<String, Double> numerics,
                    Map<String, TimerState> timers,
                    Map<String, CounterState> counters,
                    Map<String, String> forces,
                    Map<String, String> faults) {
        this.id = id;
        this.rungId = rungId;
        this.scanCount = scanCount;
        this.simulatedMillis = simulatedMillis;
        this.rungEnergized = rungEnergized;
        this.autoScanning = autoScanning;
        this.instructionEnergized = instructionEnergized;
        this.wireEnergized = wireEnergized;
        this.tags = tags;
        this.numerics = numerics;
        this.timers = timers;
        this.counters = counters;
        this.forces = forces;
        this.faults = faults;
    }

    public String getId() {
        return id;
    }

    public String getRungId() {
        return rungId;
    }

    public long getScanCount() {
        return scanCount;
    }

    public long getSimulatedMillis() {
        return simulatedMillis;
    }

    public boolean isRungEnergized() {
        return rungEnergized;
    }

    public boolean isAutoScanning() {
        return autoScanning;
    }

    public List<Boolean> getInstructionEnergized() {
        return instructionEnergized;
    }

    public List<List<Boolean>> getWireEnergized() {
        return wireEnergized;
    }

    public Map<String, Boolean> getTags() {
        return tags;
    }

    public Map<String, Double> getNumerics() {
        return numerics;
    }

    public Map<String, TimerState> getTimers() {
        return timers;
    }

    public Map<String, CounterState> getCounters() {
        return counters;
    }

    public Map<String, String> getForces() {
        return forces;
    }

    public Map<String, String> getFaults() {
        return faults;
    }
}
