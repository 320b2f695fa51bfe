package com.synclab.laddersim.engine.model;

import java.util.Objects;

/**
 * Identity of one instruction occurrence in a rung, used to remember its previous-scan
 * energized state for edge detection. Two CTU instructions on the same counter tag are
 * distinct sites.
 */
public final class InstructionSite {

    private final int index;
    private final Opcode opcode;
    private final String tag;

    public InstructionSite(int index, Opcode opcode, String tag) {
        this.index = index;
        this.opcode = opcode;
        this.tag = tag != null ? tag : "";
    }

    public static InstructionSite of(int index, Instruction instruction) {
        return new InstructionSite(index, instruction.getOpcode(), instruction.getOperand(0));
    }

    public int getIndex() {
        return index;
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public String getTag() {
        return tag;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstructionSite)) return false;
        InstructionSite that = (InstructionSite) o;
        return index == that.index && opcode == that.opcode && tag.equals(that.tag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, opcode, tag);
    }

    @Override
    public String toString() {
        return index + ":" + opcode + "(" + tag + ")";
    }
}
