package com.synclab.laddersim.engine.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One parsed ladder instruction. Immutable; supplied by the rung text parser.
 */
public final class Instruction {

    private final Opcode opcode;
    private final String mnemonic;
    private final List<String> operands;
    private final BranchPosition position;

    private Instruction(Opcode opcode, String mnemonic, List<String> operands, BranchPosition position) {
        this.opcode = opcode;
        this.mnemonic = mnemonic;
        this.operands = operands;
        this.position = position;
    }

    public static Instruction of(String mnemonic, String... operands) {
        return builder(mnemonic).operands(operands).build();
    }

    public static Builder builder(String mnemonic) {
        return new Builder(mnemonic);
    }

    public Opcode getOpcode() {
        return opcode;
    }

    /** The mnemonic as received, upper-cased. Kept for opcodes this engine does not simulate. */
    public String getMnemonic() {
        return mnemonic;
    }

    public List<String> getOperands() {
        return operands;
    }

    /** Operand address with the display suffix removed, or an empty string when absent. */
    public String getOperand(int index) {
        if (index < 0 || index >= operands.size()) {
            return "";
        }
        return Operand.strip(operands.get(index));
    }

    public int getOperandCount() {
        return operands.size();
    }

    public BranchPosition getPosition() {
        return position;
    }

    public int getBranchLeg() {
        return position.getLeg();
    }

    public int getBranchLevel() {
        return position.getLevel();
    }

    public boolean isBranchStart() {
        return position.isStart();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction that = (Instruction) o;
        return opcode == that.opcode
                && mnemonic.equals(that.mnemonic)
                && operands.equals(that.operands)
                && position.equals(that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opcode, mnemonic, operands, position);
    }

    @Override
    public String toString() {
        String text = mnemonic + "(" + String.join(",", operands) + ")";
        return position.isMainPath() ? text : text + "{" + position + "}";
    }

    public static final class Builder {
        private final String mnemonic;
        private final List<String> operands = new ArrayList<>();
        private BranchPosition position = BranchPosition.MAIN;

        private Builder(String mnemonic) {
            this.mnemonic = mnemonic != null ? mnemonic.trim().toUpperCase() : "";
        }

        public Builder operands(String... values) {
            if (values != null) {
                operands.addAll(Arrays.asList(values));
            }
            return this;
        }

        public Builder operands(List<String> values) {
            if (values != null) {
                operands.addAll(values);
            }
            return this;
        }

        public Builder branch(Integer leg, Integer level, Boolean start) {
            this.position = BranchPosition.of(leg, level, start);
            return this;
        }

        public Builder leg(int leg) {
            return branch(leg, leg > 0 ? Math.max(1, position.getLevel()) : position.getLevel(), position.isStart());
        }

        public Builder legacyBranch(Integer branchLevel, Integer parallelIndex) {
            this.position = BranchPosition.legacy(branchLevel, parallelIndex);
            return this;
        }

        public Instruction build() {
            List<String> copy = new ArrayList<>(operands.size());
            for (String operand : operands) {
                copy.add(operand != null ? operand : "");
            }
            return new Instruction(Opcode.parse(mnemonic), mnemonic, Collections.unmodifiableList(copy), position);
        }
    }
}
