package com.synclab.laddersim.opcua;

import org.eclipse.milo.opcua.sdk.server.nodes.UaVariableNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Variable nodes by qualified name ({@code S1.Motor}, {@code S1.T1.ACC}).
 */
public class UaNodeManager {
    private final Map<String, UaVariableNode> nodes = new ConcurrentHashMap<>();

    public void register(String name, UaVariableNode node) {
        nodes.put(name, node);
    }

    public UaVariableNode find(String name) {
        return nodes.get(name);
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    /** Removes every node of a session and returns them so the caller can drop them from the address space. */
    public List<UaVariableNode> unregisterSession(String sessionId) {
        String prefix = sessionId + ".";
        List<UaVariableNode> removed = new ArrayList<>();
        nodes.entrySet().removeIf(entry -> {
            if (entry.getKey().startsWith(prefix)) {
                removed.add(entry.getValue());
                return true;
            }
            return false;
        });
        return removed;
    }
}
