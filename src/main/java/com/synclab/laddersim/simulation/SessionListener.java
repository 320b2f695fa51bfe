package com.synclab.laddersim.simulation;

import com.synclab.laddersim.engine.eval.PowerFlowResult;

/**
 * Callbacks for code that mirrors sessions elsewhere (the OPC UA address space). Called on the
 * thread that made the change, while the session lock is held.
 */
public interface SessionListener {

    default void sessionCreated(SimulationSession session) {
    }

    default void sessionScanned(SimulationSession session, PowerFlowResult powerFlow) {
    }

    /** Operator change outside a scan: toggle, force, edit, reset. */
    default void sessionChanged(SimulationSession session) {
    }

    default void sessionRemoved(SimulationSession session) {
    }
}
