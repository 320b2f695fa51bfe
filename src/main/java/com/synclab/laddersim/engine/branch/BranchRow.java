package com.synclab.laddersim.engine.branch;

import com.synclab.laddersim.engine.model.Instruction;

import java.util.Collections;
import java.util.List;

/**
 * One horizontal row of a rung: the main path (leg 0) or one parallel leg.
 * {@code positions} holds the index of each instruction in the organizer's input list.
 */
public final class BranchRow {

    private final List<Instruction> instructions;
    private final List<Integer> positions;
    private final int branchLeg;
    private final int branchLevel;
    private final boolean startsNewBranch;

    public BranchRow(List<Instruction> instructions,
                     List<Integer> positions,
                     int branchLeg,
                     int branchLevel,
                     boolean startsNewBranch) {
        if (instructions.size() != positions.size()) {
            throw new IllegalArgumentException("positions must match instructions: "
                    + positions.size() + " != " + instructions.size());
        }
        this.instructions = Collections.unmodifiableList(instructions);
        this.positions = Collections.unmodifiableList(positions);
        this.branchLeg = branchLeg;
        this.branchLevel = branchLevel;
        this.startsNewBranch = startsNewBranch;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public List<Integer> getPositions() {
        return positions;
    }

    public int getBranchLeg() {
        return branchLeg;
    }

    public int getBranchLevel() {
        return branchLevel;
    }

    public boolean isStartsNewBranch() {
        return startsNewBranch;
    }

    public int size() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    /** Lowest input position in this row, or {@link Integer#MAX_VALUE} for an empty row. */
    public int firstPosition() {
        return positions.isEmpty() ? Integer.MAX_VALUE : positions.get(0);
    }

    @Override
    public String toString() {
        return "BranchRow{leg=" + branchLeg + ", level=" + branchLevel + ", " + instructions + "}";
    }
}
