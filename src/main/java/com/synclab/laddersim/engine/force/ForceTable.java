package com.synclab.laddersim.engine.force;

import com.synclab.laddersim.engine.model.Operand;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator forces. A force pins what the evaluator reads for a tag; it never writes the tag
 * itself, so a forced coil is still recomputed from power flow every scan.
 */
public class ForceTable {

    private final Map<String, ForceValue> forces = new LinkedHashMap<>();

    public void forceOn(String tag) {
        forces.put(key(tag), ForceValue.ON);
    }

    public void forceOff(String tag) {
        forces.put(key(tag), ForceValue.OFF);
    }

    public void force(String tag, ForceValue value) {
        forces.put(key(tag), value);
    }

    public void removeForce(String tag) {
        forces.remove(key(tag));
    }

    public void clear() {
        forces.clear();
    }

    public boolean isForced(String tag) {
        return lookup(Operand.strip(tag), forces) != null;
    }

    public ForceValue get(String tag) {
        return lookup(Operand.strip(tag), forces);
    }

    public boolean isEmpty() {
        return forces.isEmpty();
    }

    public Map<String, ForceValue> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(forces));
    }

    public ForceTable copy() {
        ForceTable copy = new ForceTable();
        copy.forces.putAll(forces);
        return copy;
    }

    public boolean effectiveBoolean(String tag, Map<String, Boolean> tagState) {
        return effectiveBoolean(tag, tagState, forces);
    }

    /**
     * Forced value if present (exact name first, then the base tag with member/index stripped),
     * else the tag state, else {@code false}.
     */
    public static boolean effectiveBoolean(String tag, Map<String, Boolean> tagState, Map<String, ForceValue> forcedTags) {
        String address = Operand.strip(tag);
        ForceValue forced = lookup(address, forcedTags);
        if (forced != null) {
            return forced.booleanValue();
        }
        return tagState != null && Boolean.TRUE.equals(tagState.get(address));
    }

    static ForceValue lookup(String address, Map<String, ForceValue> forcedTags) {
        if (forcedTags == null || forcedTags.isEmpty() || address.isEmpty()) {
            return null;
        }
        ForceValue exact = forcedTags.get(address);
        if (exact != null) {
            return exact;
        }
        String base = Operand.baseTag(address);
        return base.equals(address) ? null : forcedTags.get(base);
    }

    private static String key(String tag) {
        String address = Operand.strip(tag);
        if (address.isEmpty()) {
            throw new IllegalArgumentException("tag is required");
        }
        return address;
    }
}
