package com.synclab.laddersim.engine.branch;

import com.synclab.laddersim.engine.model.Instruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of {@link BranchOrganizer#organize(List)}.
 */
public final class OrganizedRung {

    private final List<BranchRow> rows;
    private final boolean hasBranches;
    private final int instructionCount;

    OrganizedRung(List<BranchRow> rows, boolean hasBranches) {
        this.rows = Collections.unmodifiableList(rows);
        this.hasBranches = hasBranches;
        int count = 0;
        for (BranchRow row : rows) {
            count += row.size();
        }
        this.instructionCount = count;
    }

    public List<BranchRow> getRows() {
        return rows;
    }

    public boolean hasBranches() {
        return hasBranches;
    }

    public int getInstructionCount() {
        return instructionCount;
    }

    public BranchRow getMainRow() {
        return rows.get(0);
    }

    /** All instructions, row by row in leg order. */
    public List<Instruction> flatten() {
        List<Instruction> flat = new ArrayList<>(instructionCount);
        for (BranchRow row : rows) {
            flat.addAll(row.getInstructions());
        }
        return flat;
    }
}
