package com.synclab.laddersim.simulation;

import com.synclab.laddersim.config.SimulationProperties;
import com.synclab.laddersim.engine.branch.BranchOrganizer;
import com.synclab.laddersim.engine.branch.OrganizedRung;
import com.synclab.laddersim.engine.eval.OperandResolver;
import com.synclab.laddersim.engine.eval.PowerFlowEvaluator;
import com.synclab.laddersim.engine.eval.PowerFlowResult;
import com.synclab.laddersim.engine.fault.FaultConfig;
import com.synclab.laddersim.engine.fault.FaultInjector;
import com.synclab.laddersim.engine.force.ForceValue;
import com.synclab.laddersim.engine.model.Instruction;
import com.synclab.laddersim.engine.model.Operand;
import com.synclab.laddersim.engine.state.CounterState;
import com.synclab.laddersim.engine.state.ScanUpdates;
import com.synclab.laddersim.engine.state.SimulationState;
import com.synclab.laddersim.engine.state.TimerState;
import com.synclab.laddersim.engine.trend.RetentionPolicy;
import com.synclab.laddersim.engine.trend.TrendPoint;
import com.synclab.laddersim.engine.trend.TrendRecorder;
import com.synclab.laddersim.engine.update.OutputUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One simulated rung. Owns its state outright; two sessions never share anything mutable.
 * Every public method holds the session lock, so a scan (sample, evaluate, compute, commit) is
 * never interleaved with an operator change.
 */
public class SimulationSession {

    private static final Logger log = LoggerFactory.getLogger(SimulationSession.class);

    private final String id;
    private final String rungId;
    private final List<Instruction> instructions;
    private final OrganizedRung rung;
    private final SimulationState state = new SimulationState();
    private final PowerFlowEvaluator evaluator = new PowerFlowEvaluator();
    private final OutputUpdater updater;
    private final FaultInjector faults;
    private final TrendRecorder trend;
    private final long scanIntervalMs;
    private final long defaultTimerPreset;
    private final int defaultCounterPreset;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService scanExecutor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r);
                t.setDaemon(true);
                t.setName("ladder-scan");
                return t;
            });
    private ScheduledFuture<?> scanTask;

    private long scanCount;
    private long simulatedMillis;
    private PowerFlowResult lastPowerFlow;
    private ScanUpdates lastUpdates = ScanUpdates.empty();

    public SimulationSession(String id, String rungId, List<Instruction> instructions, SimulationProperties properties) {
        this.id = id;
        this.rungId = rungId;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.rung = new BranchOrganizer().organize(this.instructions);
        this.updater = new OutputUpdater(properties.getDefaultTimerPresetMs(),
                properties.getDefaultCounterPreset(),
                properties.getMaxBlockLength());
        Long seed = properties.getFaultSeed();
        this.faults = new FaultInjector(seed != null ? seed : System.nanoTime());
        this.trend = new TrendRecorder(RetentionPolicy.of(properties.getTrend().getMaxPoints(),
                properties.getTrend().getWindowSeconds()));
        this.scanIntervalMs = Math.max(1L, properties.getScanIntervalMs());
        this.defaultTimerPreset = properties.getDefaultTimerPresetMs();
        this.defaultCounterPreset = properties.getDefaultCounterPreset();
        this.lastPowerFlow = evaluator.evaluate(rung.getRows(), state);
    }

    public String getId() {
        return id;
    }

    public String getRungId() {
        return rungId;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public OrganizedRung getRung() {
        return rung;
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    /**
     * One scan: sample faulted inputs, evaluate power flow, compute the next state and commit it
     * in one step, then record trends.
     */
    public synchronized PowerFlowResult scan(long elapsedMillis) {
        long elapsed = Math.max(0L, elapsedMillis);
        simulatedMillis += elapsed;
        Map<String, Boolean> sampled = faults.sample(state, simulatedMillis);
        PowerFlowResult powerFlow = evaluator.evaluate(rung.getRows(), state, state.getForces(), sampled);
        ScanUpdates updates = updater.computeUpdates(instructions, powerFlow, state, elapsed);
        state.apply(updates);
        scanCount++;
        trend.sample(state, state.getForces(), simulatedMillis / 1000.0);
        lastPowerFlow = powerFlow;
        lastUpdates = updates;
        log.debug("[{}] scan {} (+{}ms) rung={} updates={}", id, scanCount, elapsed, powerFlow.isRungEnergized(), updates);
        for (SessionListener listener : listeners) {
            listener.sessionScanned(this, powerFlow);
        }
        return powerFlow;
    }

    /** Power flow against the current state and forces, without faults and without committing. */
    public synchronized PowerFlowResult evaluate() {
        return evaluator.evaluate(rung.getRows(), state);
    }

    /**
     * Flips a boolean tag. Forced tags ignore the click and keep their value.
     *
     * @return {@code false} when the tag is forced and nothing changed
     */
    public synchronized boolean toggleTag(String tag) {
        String address = requireTag(tag);
        if (state.getForces().isForced(address)) {
            log.warn("[{}] toggle of forced tag {} ignored", id, address);
            return false;
        }
        state.setTag(address, !OperandResolver.readBit(address, state));
        changed();
        return true;
    }

    public synchronized void setTag(String tag, boolean value) {
        state.setTag(requireTag(tag), value);
        changed();
    }

    public synchronized void setNumeric(String tag, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("value must be finite: " + value);
        }
        state.setNumeric(requireTag(tag), value);
        changed();
    }

    /** Sets a timer accumulator, creating the timer with the default preset if it is new. */
    public synchronized void editTimerAccumulator(String tag, long acc) {
        String address = requireTag(tag);
        TimerState existing = state.timer(address);
        TimerState timer = existing != null ? existing.copy() : new TimerState(defaultTimerPreset);
        timer.setAcc(acc);
        timer.setDn(timer.getAcc() >= timer.getPre());
        state.putTimer(address, timer);
        changed();
    }

    public synchronized void editCounterAccumulator(String tag, int acc) {
        String address = requireTag(tag);
        CounterState existing = state.counter(address);
        CounterState counter = existing != null ? existing.copy() : new CounterState(defaultCounterPreset);
        counter.setAcc(acc);
        state.putCounter(address, counter);
        changed();
    }

    public synchronized void forceOn(String tag) {
        state.getForces().forceOn(requireTag(tag));
        log.info("[{}] force {} ON", id, tag);
        changed();
    }

    public synchronized void forceOff(String tag) {
        state.getForces().forceOff(requireTag(tag));
        log.info("[{}] force {} OFF", id, tag);
        changed();
    }

    public synchronized void force(String tag, ForceValue value) {
        if (value == ForceValue.ON) {
            forceOn(tag);
        } else {
            forceOff(tag);
        }
    }

    public synchronized void removeForce(String tag) {
        state.getForces().removeForce(requireTag(tag));
        log.info("[{}] force {} removed", id, tag);
        changed();
    }

    public synchronized boolean isForced(String tag) {
        return state.getForces().isForced(tag);
    }

    public synchronized void injectFault(String tag, FaultConfig config) {
        faults.injectFault(requireTag(tag), config);
        log.info("[{}] fault {} injected on {}", id, config, tag);
        changed();
    }

    public synchronized void clearFault(String tag) {
        faults.clearFault(requireTag(tag));
        log.info("[{}] fault cleared on {}", id, tag);
        changed();
    }

    public synchronized void clearAllFaults() {
        faults.clearAllFaults();
        changed();
    }

    public synchronized void trackTag(String tag) {
        trend.addTag(requireTag(tag));
    }

    public synchronized void untrackTag(String tag) {
        trend.removeTag(tag);
    }

    public synchronized void pauseTrend() {
        trend.pause();
    }

    public synchronized void resumeTrend() {
        trend.resume();
    }

    public synchronized void clearTrend() {
        trend.clear();
    }

    public synchronized boolean isTrendRecording() {
        return trend.isRecording();
    }

    public synchronized Map<String, List<TrendPoint>> trendSeries() {
        return trend.getSeries();
    }

    /**
     * Back to the first scan: values, edge memory, trend points and simulated time are dropped.
     * Forces, faults and tracked tags stay.
     */
    public synchronized void reset() {
        state.clearValues();
        faults.reset();
        trend.clear();
        scanCount = 0;
        simulatedMillis = 0;
        lastUpdates = ScanUpdates.empty();
        lastPowerFlow = evaluator.evaluate(rung.getRows(), state);
        log.info("[{}] reset", id);
        changed();
    }

    /** What a contact or coil shows: the forced value when forced, else the stored bit. */
    public synchronized boolean displayedBoolean(String tag) {
        String address = Operand.strip(tag);
        ForceValue forced = state.getForces().get(address);
        if (forced != null) {
            return forced.booleanValue();
        }
        return OperandResolver.readBit(address, state);
    }

    public synchronized long getScanCount() {
        return scanCount;
    }

    public synchronized long getSimulatedMillis() {
        return simulatedMillis;
    }

    public synchronized PowerFlowResult getLastPowerFlow() {
        return lastPowerFlow;
    }

    public synchronized ScanUpdates getLastUpdates() {
        return lastUpdates;
    }

    /** Independent copy of the session's state. */
    public synchronized SimulationState copyState() {
        return state.copy();
    }

    public synchronized SessionSnapshot snapshot() {
        List<Boolean> energized = new ArrayList<>();
        for (boolean value : lastPowerFlow.getInstructionEnergized()) {
            energized.add(value);
        }
        List<List<Boolean>> wires = new ArrayList<>();
        for (boolean[] row : lastPowerFlow.getWireEnergized()) {
            List<Boolean> values = new ArrayList<>(row.length);
            for (boolean value : row) {
                values.add(value);
            }
            wires.add(values);
        }
        Map<String, TimerState> timers = new LinkedHashMap<>();
        state.getTimers().forEach((name, timer) -> timers.put(name, timer.copy()));
        Map<String, CounterState> counters = new LinkedHashMap<>();
        state.getCounters().forEach((name, counter) -> counters.put(name, counter.copy()));
        Map<String, String> forces = new LinkedHashMap<>();
        state.getForces().snapshot().forEach((name, value) -> forces.put(name, value.toString()));
        Map<String, String> faultView = new LinkedHashMap<>();
        faults.getFaults().forEach((name, config) -> faultView.put(name, config.toString()));
        return new SessionSnapshot(id, rungId, scanCount, simulatedMillis, lastPowerFlow.isRungEnergized(),
                isAutoScanning(), energized, wires,
                new LinkedHashMap<>(state.getTags()), new LinkedHashMap<>(state.getNumerics()),
                timers, counters, forces, faultView);
    }

    /** Scans every configured interval on a background thread until stopped. */
    public synchronized void startAutoScan() {
        if (scanTask == null || scanTask.isCancelled() || scanTask.isDone()) {
            scanTask = scanExecutor.scheduleAtFixedRate(() -> {
                try {
                    scan(scanIntervalMs);
                } catch (Exception e) {
                    log.warn("[{}] auto-scan iteration failed", id, e);
                }
            }, 0, scanIntervalMs, TimeUnit.MILLISECONDS);
            log.info("[{}] auto-scan started every {}ms", id, scanIntervalMs);
        }
    }

    public synchronized void stopAutoScan() {
        if (scanTask != null) {
            scanTask.cancel(false);
            scanTask = null;
            log.info("[{}] auto-scan stopped", id);
        }
    }

    public synchronized boolean isAutoScanning() {
        return scanTask != null && !scanTask.isCancelled() && !scanTask.isDone();
    }

    public void shutdown() {
        stopAutoScan();
        scanExecutor.shutdownNow();
    }

    private void changed() {
        for (SessionListener listener : listeners) {
            listener.sessionChanged(this);
        }
    }

    private static String requireTag(String tag) {
        String address = Operand.strip(tag);
        if (address.isEmpty()) {
            throw new IllegalArgumentException("tag is required");
        }
        return address;
    }
}
