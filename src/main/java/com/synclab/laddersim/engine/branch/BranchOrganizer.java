package com.synclab.laddersim.engine.branch;

import com.synclab.laddersim.engine.model.Instruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups a flat instruction list into one row per branch leg. Leg 0 (the main path) is always
 * the first row, even when no instruction lives on it; the remaining rows follow in ascending
 * leg order. Within a row instructions keep their input order.
 */
public class BranchOrganizer {

    public OrganizedRung organize(List<Instruction> instructions) {
        if (instructions == null || instructions.isEmpty()) {
            BranchRow empty = new BranchRow(Collections.emptyList(), Collections.emptyList(), 0, 0, false);
            return new OrganizedRung(Collections.singletonList(empty), false);
        }

        boolean branched = false;
        for (Instruction instruction : instructions) {
            if (instruction.getBranchLeg() != 0 || instruction.getBranchLevel() != 0) {
                branched = true;
                break;
            }
        }

        if (!branched) {
            List<Integer> positions = new ArrayList<>(instructions.size());
            for (int i = 0; i < instructions.size(); i++) {
                positions.add(i);
            }
            BranchRow row = new BranchRow(new ArrayList<>(instructions), positions, 0, 0, false);
            return new OrganizedRung(Collections.singletonList(row), false);
        }

        Map<Integer, List<Integer>> legs = new TreeMap<>();
        for (int i = 0; i < instructions.size(); i++) {
            legs.computeIfAbsent(instructions.get(i).getBranchLeg(), k -> new ArrayList<>()).add(i);
        }
        int distinctLegs = legs.size();
        legs.putIfAbsent(0, new ArrayList<>());

        List<BranchRow> rows = new ArrayList<>(legs.size());
        for (Map.Entry<Integer, List<Integer>> entry : legs.entrySet()) {
            rows.add(buildRow(entry.getKey(), entry.getValue(), instructions));
        }
        return new OrganizedRung(rows, distinctLegs > 1);
    }

    private BranchRow buildRow(int leg, List<Integer> positions, List<Instruction> instructions) {
        List<Instruction> members = new ArrayList<>(positions.size());
        boolean startsNewBranch = false;
        for (int position : positions) {
            Instruction instruction = instructions.get(position);
            members.add(instruction);
            startsNewBranch |= instruction.isBranchStart();
        }
        int level;
        if (leg == 0) {
            level = 0;
        } else {
            // a parallel leg is at least one level deep even when the parser left the level out
            level = Math.max(1, members.get(0).getBranchLevel());
        }
        return new BranchRow(members, positions, leg, level, startsNewBranch);
    }
}
