package com.synclab.laddersim.simulation;

import com.synclab.laddersim.config.SimulationProperties;
import com.synclab.laddersim.engine.model.Instruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates, finds and discards simulation sessions. Listeners registered here are attached to every
 * session created afterwards.
 */
public class SimulationSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SimulationSessionRegistry.class);

    private final SimulationProperties properties;
    private final Map<String, SimulationSession> sessions = new ConcurrentHashMap<>();
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public SimulationSessionRegistry(SimulationProperties properties) {
        this.properties = properties;
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public SimulationSession create(String rungId, List<Instruction> instructions) {
        String id = "S" + sequence.incrementAndGet();
        SimulationSession session = new SimulationSession(id, rungId,
                instructions != null ? instructions : Collections.emptyList(), properties);
        listeners.forEach(session::addListener);
        sessions.put(id, session);
        log.info("Simulation session {} created for rung {} ({} instructions, branches={})",
                id, rungId, session.getInstructions().size(), session.getRung().hasBranches());
        for (SessionListener listener : listeners) {
            listener.sessionCreated(session);
        }
        return session;
    }

    public Optional<SimulationSession> find(String id) {
        return Optional.ofNullable(id == null ? null : sessions.get(id));
    }

    public Collection<SimulationSession> getSessions() {
        return Collections.unmodifiableList(new ArrayList<>(sessions.values()));
    }

    /** Stops and drops the session; its state is discarded, never persisted. */
    public boolean remove(String id) {
        SimulationSession session = id == null ? null : sessions.remove(id);
        if (session == null) {
            return false;
        }
        session.shutdown();
        for (SessionListener listener : listeners) {
            listener.sessionRemoved(session);
        }
        log.info("Simulation session {} discarded after {} scans", id, session.getScanCount());
        return true;
    }

    public void shutdown() {
        new ArrayList<>(sessions.keySet()).forEach(this::remove);
    }
}
