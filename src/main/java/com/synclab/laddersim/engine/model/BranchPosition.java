package com.synclab.laddersim.engine.model;

import java.util.Objects;

/**
 * Where an instruction sits in the rung's branch topology. Leg 0 is the main series path,
 * legs 1..N are parallel legs; level is the nesting depth (0 = outermost).
 */
public final class BranchPosition {

    public static final BranchPosition MAIN = new BranchPosition(0, 0, false);

    private final int leg;
    private final int level;
    private final boolean start;

    private BranchPosition(int leg, int level, boolean start) {
        this.leg = leg;
        this.level = level;
        this.start = start;
    }

    public static BranchPosition of(Integer leg, Integer level, Boolean start) {
        int safeLeg = leg != null ? Math.max(0, leg) : 0;
        int safeLevel = level != null ? Math.max(0, level) : 0;
        boolean safeStart = Boolean.TRUE.equals(start);
        if (safeLeg == 0 && safeLevel == 0 && !safeStart) {
            return MAIN;
        }
        return new BranchPosition(safeLeg, safeLevel, safeStart);
    }

    /**
     * Older parser output carried {@code branch_level} (depth) and a 0-based {@code parallel_index}
     * instead of the leg/level/start triple. Index n of a branch becomes leg n + 1; an instruction
     * at level 0 with index 0 (or none) is on the main path.
     */
    public static BranchPosition legacy(Integer branchLevel, Integer parallelIndex) {
        int level = branchLevel != null ? Math.max(0, branchLevel) : 0;
        int index = parallelIndex != null ? Math.max(0, parallelIndex) : 0;
        if (level == 0 && index == 0) {
            return MAIN;
        }
        return of(index + 1, Math.max(1, level), false);
    }

    public int getLeg() {
        return leg;
    }

    public int getLevel() {
        return level;
    }

    public boolean isStart() {
        return start;
    }

    public boolean isMainPath() {
        return leg == 0 && level == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BranchPosition)) return false;
        BranchPosition that = (BranchPosition) o;
        return leg == that.leg && level == that.level && start == that.start;
    }

    @Override
    public int hashCode() {
        return Objects.hash(leg, level, start);
    }

    @Override
    public String toString() {
        return "leg=" + leg + ", level=" + level + (start ? ", start" : "");
    }
}
