package com.synclab.laddersim.engine.eval;

import com.synclab.laddersim.engine.branch.BranchRow;
import com.synclab.laddersim.engine.force.ForceTable;
import com.synclab.laddersim.engine.force.ForceValue;
import com.synclab.laddersim.engine.model.Instruction;
import com.synclab.laddersim.engine.model.Operand;
import com.synclab.laddersim.engine.state.SimulationState;
import com.synclab.laddersim.engine.state.StateView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes which wires and instructions of a rung carry power.
 *
 * <p>Each row is a series path. Parallel legs hang off a parent row: a leg of level {@code L}
 * belongs to the nearest preceding row of level {@code L - 1} (the main row for level 1), and
 * legs with the same parent that start at the same point of that parent form one group. The
 * group is spliced into the parent before the first parent instruction that comes after the
 * group in source order, is fed by the parent's wire at that point, and outputs the OR of its
 * legs' ends.
 *
 * <p>Evaluation only reads: the state, the force table and optional sampled inputs are never
 * modified, and the same inputs always give the same result.
 */
public class PowerFlowEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PowerFlowEvaluator.class);

    public PowerFlowResult evaluate(List<BranchRow> rows, SimulationState state) {
        return evaluate(rows, state, state.getForces(), Collections.emptyMap());
    }

    /**
     * @param sampledInputs contact reads already decided at input sampling (fault injection);
     *                      forces still take precedence over them
     */
    public PowerFlowResult evaluate(List<BranchRow> rows,
                                    StateView state,
                                    ForceTable forces,
                                    Map<String, Boolean> sampledInputs) {
        if (rows == null || rows.isEmpty()) {
            return PowerFlowResult.empty();
        }
        Pass pass = new Pass(rows, state, forces, sampledInputs != null ? sampledInputs : Collections.emptyMap());
        boolean rung = pass.evaluateRow(0, true) && pass.energized.length > 0;
        return new PowerFlowResult(rung, pass.energized, pass.powerIn, pass.wires);
    }

    /** State of one evaluation. */
    private static final class Pass {

        private final List<BranchRow> rows;
        private final StateView state;
        private final ForceTable forces;
        private final Map<String, Boolean> sampled;
        private final boolean[] energized;
        private final boolean[] powerIn;
        private final boolean[][] wires;
        /** Per parent row: splice index to the legs (row indices) of the group inserted there. */
        private final List<TreeMap<Integer, List<Integer>>> groups = new ArrayList<>();

        Pass(List<BranchRow> rows, StateView state, ForceTable forces, Map<String, Boolean> sampled) {
            this.rows = rows;
            this.state = state;
            this.forces = forces;
            this.sampled = sampled;
            int count = 0;
            for (BranchRow row : rows) {
                for (int position : row.getPositions()) {
                    count = Math.max(count, position + 1);
                }
            }
            this.energized = new boolean[count];
            this.powerIn = new boolean[count];
            this.wires = new boolean[rows.size()][];
            for (int i = 0; i < rows.size(); i++) {
                wires[i] = new boolean[rows.get(i).size() + 1];
                groups.add(new TreeMap<>());
            }
            buildGroups();
        }

        private void buildGroups() {
            Map<Integer, Integer> parents = new LinkedHashMap<>();
            for (int i = 1; i < rows.size(); i++) {
                int level = Math.max(1, rows.get(i).getBranchLevel());
                int parent = 0;
                for (int j = i - 1; j > 0; j--) {
                    if (rows.get(j).getBranchLevel() == level - 1) {
                        parent = j;
                        break;
                    }
                }
                parents.put(i, parent);
            }
            for (Map.Entry<Integer, Integer> entry : parents.entrySet()) {
                int leg = entry.getKey();
                int parent = entry.getValue();
                int splice = spliceIndex(rows.get(parent), rows.get(leg).firstPosition());
                groups.get(parent).computeIfAbsent(splice, k -> new ArrayList<>()).add(leg);
            }
        }

        private static int spliceIndex(BranchRow parent, int firstPosition) {
            int index = 0;
            for (int position : parent.getPositions()) {
                if (position < firstPosition) {
                    index++;
                }
            }
            return index;
        }

        boolean evaluateRow(int rowIndex, boolean rail) {
            BranchRow row = rows.get(rowIndex);
            TreeMap<Integer, List<Integer>> spliced = groups.get(rowIndex);
            boolean power = rail;
            int n = row.size();
            for (int i = 0; i <= n; i++) {
                List<Integer> legs = spliced.get(i);
                if (legs != null) {
                    boolean joined = false;
                    for (int leg : legs) {
                        // every leg is evaluated so its wires are filled in
                        joined |= evaluateRow(leg, power);
                    }
                    power = joined;
                }
                if (i == n) {
                    break;
                }
                wires[rowIndex][i] = power;
                int position = row.getPositions().get(i);
                Instruction instruction = row.getInstructions().get(i);
                powerIn[position] = power;
                if (instruction.getOpcode().isGating()) {
                    boolean passes = power && test(instruction);
                    energized[position] = passes;
                    power = passes;
                } else {
                    energized[position] = power;
                }
            }
            wires[rowIndex][n] = power;
            return power;
        }

        private boolean test(Instruction instruction) {
            try {
                return switch (instruction.getOpcode()) {
                    case XIC -> read(instruction.getOperand(0));
                    case XIO -> !read(instruction.getOperand(0));
                    // storage bit holds last scan's input; pass only on a rising edge
                    case ONS -> !OperandResolver.readBit(instruction.getOperand(0), state);
                    case EQU -> value(instruction, 0) == value(instruction, 1);
                    case NEQ -> value(instruction, 0) != value(instruction, 1);
                    case LES -> value(instruction, 0) < value(instruction, 1);
                    case LEQ -> value(instruction, 0) <= value(instruction, 1);
                    case GRT -> value(instruction, 0) > value(instruction, 1);
                    case GEQ -> value(instruction, 0) >= value(instruction, 1);
                    case LIM -> limit(value(instruction, 0), value(instruction, 1), value(instruction, 2));
                    case CMP -> ExpressionEvaluator.evaluate(instruction.getOperand(0), state) != 0.0;
                    case OSR, OSF, OTE, OTL, OTU, TON, TOF, RTO, TONR, TOFR, CTU, CTD, CTUD, RES,
                            ADD, SUB, MUL, DIV, MOD, NEG, ABS, CPT, MOV, MVM, COP, FLL, CLR, UNSUPPORTED -> true;
                };
            } catch (RuntimeException e) {
                log.warn("Instruction {} evaluated as false: {}", instruction, e.getMessage());
                return false;
            }
        }

        private static boolean limit(double low, double test, double high) {
            if (low <= high) {
                return low <= test && test <= high;
            }
            return test >= low || test <= high;
        }

        private double value(Instruction instruction, int operand) {
            return OperandResolver.resolve(instruction.getOperand(operand), state);
        }

        /** Contact read: force, then sampled input, then the stored bit. */
        private boolean read(String operand) {
            String address = Operand.strip(operand);
            if (forces != null) {
                ForceValue forced = forces.get(address);
                if (forced != null) {
                    return forced.booleanValue();
                }
            }
            Boolean sample = sampled.get(address);
            if (sample != null) {
                return sample;
            }
            return OperandResolver.readBit(address, state);
        }
    }
}
