package com.synclab.laddersim.engine.trend;

import com.synclab.laddersim.engine.eval.OperandResolver;
import com.synclab.laddersim.engine.force.ForceTable;
import com.synclab.laddersim.engine.force.ForceValue;
import com.synclab.laddersim.engine.model.Operand;
import com.synclab.laddersim.engine.state.StateView;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bounded per-tag time series sampled once per scan from the post-update state. Oldest points go
 * first when the retention policy is exceeded.
 */
public class TrendRecorder {

    private final Map<String, Deque<TrendPoint>> series = new LinkedHashMap<>();
    private RetentionPolicy policy;
    private boolean recording = true;

    public TrendRecorder(RetentionPolicy policy) {
        this.policy = policy != null ? policy : RetentionPolicy.unbounded();
    }

    public void addTag(String tag) {
        series.computeIfAbsent(key(tag), k -> new ArrayDeque<>());
    }

    public void removeTag(String tag) {
        series.remove(Operand.strip(tag));
    }

    public Set<String> getTrackedTags() {
        return Collections.unmodifiableSet(series.keySet());
    }

    public boolean isTracked(String tag) {
        return series.containsKey(Operand.strip(tag));
    }

    public void pause() {
        recording = false;
    }

    public void resume() {
        recording = true;
    }

    public boolean isRecording() {
        return recording;
    }

    /** Discards every point of every tracked tag; the tags stay tracked. */
    public void clear() {
        series.values().forEach(Deque::clear);
    }

    public RetentionPolicy getPolicy() {
        return policy;
    }

    public void setPolicy(RetentionPolicy policy) {
        this.policy = policy != null ? policy : RetentionPolicy.unbounded();
        series.values().forEach(points -> {
            if (!points.isEmpty()) {
                evict(points, points.peekLast().getTime());
            }
        });
    }

    public void sample(StateView view, double elapsedSeconds) {
        sample(view, null, elapsedSeconds);
    }

    /**
     * Appends one point per tracked tag, unless recording is paused. A forced tag is recorded at
     * its forced value, matching what the session displays.
     */
    public void sample(StateView view, ForceTable forces, double elapsedSeconds) {
        if (!recording) {
            return;
        }
        for (Map.Entry<String, Deque<TrendPoint>> entry : series.entrySet()) {
            Deque<TrendPoint> points = entry.getValue();
            ForceValue forced = forces != null ? forces.get(entry.getKey()) : null;
            double value = forced != null ? (forced.booleanValue() ? 1.0 : 0.0) : valueOf(entry.getKey(), view);
            points.addLast(new TrendPoint(elapsedSeconds, value));
            evict(points, elapsedSeconds);
        }
    }

    public List<TrendPoint> getPoints(String tag) {
        Deque<TrendPoint> points = series.get(Operand.strip(tag));
        return points == null ? Collections.emptyList() : new ArrayList<>(points);
    }

    public Map<String, List<TrendPoint>> getSeries() {
        Map<String, List<TrendPoint>> copy = new LinkedHashMap<>();
        series.forEach((tag, points) -> copy.put(tag, new ArrayList<>(points)));
        return copy;
    }

    /** Numeric value, timer/counter ACC, member values and booleans as 1/0; unknown is 0. */
    static double valueOf(String tag, StateView view) {
        Double value = OperandResolver.lookup(tag, view);
        return value == null ? 0.0 : value;
    }

    private void evict(Deque<TrendPoint> points, double now) {
        if (policy.hasWindow()) {
            double oldest = now - policy.getWindowSeconds();
            while (!points.isEmpty() && points.peekFirst().getTime() < oldest) {
                points.pollFirst();
            }
        }
        if (policy.hasPointLimit()) {
            while (points.size() > policy.getMaxPoints()) {
                points.pollFirst();
            }
        }
    }

    private static String key(String tag) {
        String address = Operand.strip(tag);
        if (address.isEmpty()) {
            throw new IllegalArgumentException("tag is required");
        }
        return address;
    }
}
