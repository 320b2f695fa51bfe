package com.synclab.laddersim.engine.fault;

import com.synclab.laddersim.engine.eval.OperandResolver;
import com.synclab.laddersim.engine.model.Operand;
import com.synclab.laddersim.engine.state.StateView;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Simulated field-device faults. At input sampling each faulted tag gets the value a contact
 * will read this scan; operator forces still win over it. The random source is seeded so an
 * intermittent fault replays the same way for the same seed.
 */
public class FaultInjector {

    private final Map<String, FaultConfig> faults = new LinkedHashMap<>();
    private final Map<String, Deque<Sample>> history = new HashMap<>();
    private final long seed;
    private Random random;

    public FaultInjector(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public void injectFault(String tag, FaultConfig config) {
        String address = key(tag);
        faults.put(address, config);
        history.remove(address);
    }

    public void clearFault(String tag) {
        String address = key(tag);
        faults.remove(address);
        history.remove(address);
    }

    public void clearAllFaults() {
        faults.clear();
        history.clear();
    }

    /** Drops delay history and reseeds, so a reset session replays identically. */
    public void reset() {
        history.clear();
        random = new Random(seed);
    }

    public boolean hasFault(String tag) {
        return faults.containsKey(Operand.strip(tag));
    }

    public FaultConfig getFault(String tag) {
        return faults.get(Operand.strip(tag));
    }

    public Map<String, FaultConfig> getFaults() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(faults));
    }

    public boolean isEmpty() {
        return faults.isEmpty();
    }

    /**
     * Values faulted contacts read this scan.
     *
     * @param nowMillis simulated time since the session started
     */
    public Map<String, Boolean> sample(StateView view, long nowMillis) {
        if (faults.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Boolean> sampled = new LinkedHashMap<>();
        for (Map.Entry<String, FaultConfig> entry : faults.entrySet()) {
            String tag = entry.getKey();
            FaultConfig config = entry.getValue();
            boolean actual = OperandResolver.readBit(tag, view);
            boolean value = switch (config.getType()) {
                case STUCK_ON -> true;
                case STUCK_OFF -> false;
                case INVERTED -> !actual;
                case INTERMITTENT -> random.nextDouble() < config.getProbability() ? !actual : actual;
                case DELAYED -> delayed(tag, actual, nowMillis, config.getDelayMillis());
            };
            sampled.put(tag, value);
        }
        return sampled;
    }

    private boolean delayed(String tag, boolean actual, long nowMillis, long delayMillis) {
        Deque<Sample> samples = history.computeIfAbsent(tag, k -> new ArrayDeque<>());
        if (samples.isEmpty() || samples.peekLast().value != actual) {
            samples.addLast(new Sample(nowMillis, actual));
        }
        long cutoff = nowMillis - delayMillis;
        // keep the newest sample at or before the cutoff; it is the value visible now
        while (samples.size() > 1) {
            Sample first = samples.pollFirst();
            Sample second = samples.peekFirst();
            if (second.time > cutoff) {
                samples.addFirst(first);
                break;
            }
        }
        return samples.peekFirst().value;
    }

    private static String key(String tag) {
        String address = Operand.strip(tag);
        if (address.isEmpty()) {
            throw new IllegalArgumentException("tag is required");
        }
        return address;
    }

    private static final class Sample {
        private final long time;
        private final boolean value;

        private Sample(long time, boolean value) {
            this.time = time;
            this.value = value;
        }
    }
}
