package com.synclab.laddersim.engine.eval;

import java.util.Arrays;

/**
 * Energized state of one rung evaluation. Instruction arrays are indexed by the instruction's
 * position in the rung's source list; wire arrays by row, where wire {@code i} feeds the row's
 * instruction {@code i} and the last wire is the row's output.
 */
public final class PowerFlowResult {

    private static final PowerFlowResult EMPTY =
            new PowerFlowResult(false, new boolean[0], new boolean[0], new boolean[][]{{false}});

    private final boolean rungEnergized;
    private final boolean[] instructionEnergized;
    private final boolean[] instructionPowerIn;
    private final boolean[][] wireEnergized;

    PowerFlowResult(boolean rungEnergized,
                    boolean[] instructionEnergized,
                    boolean[] instructionPowerIn,
                    boolean[][] wireEnergized) {
        this.rungEnergized = rungEnergized;
        this.instructionEnergized = instructionEnergized;
        this.instructionPowerIn = instructionPowerIn;
        this.wireEnergized = wireEnergized;
    }

    public static PowerFlowResult empty() {
        return EMPTY;
    }

    public boolean isRungEnergized() {
        return rungEnergized;
    }

    public int getInstructionCount() {
        return instructionEnergized.length;
    }

    public boolean isInstructionEnergized(int position) {
        return position >= 0 && position < instructionEnergized.length && instructionEnergized[position];
    }

    /** Power on the wire feeding the instruction, before its own test. */
    public boolean isPowerIn(int position) {
        return position >= 0 && position < instructionPowerIn.length && instructionPowerIn[position];
    }

    public boolean[] getInstructionEnergized() {
        return instructionEnergized.clone();
    }

    public boolean[][] getWireEnergized() {
        boolean[][] copy = new boolean[wireEnergized.length][];
        for (int i = 0; i < wireEnergized.length; i++) {
            copy[i] = wireEnergized[i].clone();
        }
        return copy;
    }

    public boolean isWireEnergized(int row, int wire) {
        return row >= 0 && row < wireEnergized.length
                && wire >= 0 && wire < wireEnergized[row].length
                && wireEnergized[row][wire];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PowerFlowResult)) return false;
        PowerFlowResult that = (PowerFlowResult) o;
        return rungEnergized == that.rungEnergized
                && Arrays.equals(instructionEnergized, that.instructionEnergized)
                && Arrays.equals(instructionPowerIn, that.instructionPowerIn)
                && Arrays.deepEquals(wireEnergized, that.wireEnergized);
    }

    @Override
    public int hashCode() {
        int result = Boolean.hashCode(rungEnergized);
        result = 31 * result + Arrays.hashCode(instructionEnergized);
        result = 31 * result + Arrays.deepHashCode(wireEnergized);
        return result;
    }

    @Override
    public String toString() {
        return "PowerFlowResult{rung=" + rungEnergized + ", instructions=" + Arrays.toString(instructionEnergized) + "}";
    }
}
