package com.synclab.laddersim.engine.eval;

import com.synclab.laddersim.engine.branch.BranchOrganizer;
import com.synclab.laddersim.engine.model.Instruction;
import com.synclab.laddersim.engine.state.SimulationState;
import com.synclab.laddersim.engine.state.TimerState;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PowerFlowEvaluatorTest {

    private final BranchOrganizer organizer = new BranchOrganizer();
    private final PowerFlowEvaluator evaluator = new PowerFlowEvaluator();
    private SimulationState state;

    @Before
    public void setUp() {
        state = new SimulationState();
    }

    private PowerFlowResult evaluate(List<Instruction> rung) {
        return evaluator.evaluate(organizer.organize(rung).getRows(), state);
    }

    private static Instruction leg(String mnemonic, String operand, int leg, int level) {
        return Instruction.builder(mnemonic).operands(operand).branch(leg, level, true).build();
    }

    @Test
    public void emptyRungIsNotEnergized() {
        PowerFlowResult result = evaluate(Collections.emptyList());
        assertFalse(result.isRungEnergized());
        assertEquals(0, result.getInstructionCount());
    }

    @Test
    public void seriesContactsAreAnded() {
        List<Instruction> rung = Arrays.asList(Instruction.of("XIC", "A"), Instruction.of("XIC", "B"),
                Instruction.of("OTE", "C"));
        boolean[] values = {false, true};
        for (boolean a : values) {
            for (boolean b : values) {
                state.setTag("A", a);
                state.setTag("B", b);
                PowerFlowResult result = evaluate(rung);
                assertEquals("A=" + a + " B=" + b, a && b, result.isRungEnergized());
                assertEquals(a, result.isInstructionEnergized(0));
                assertEquals(a && b, result.isInstructionEnergized(1));
                assertEquals(a && b, result.isInstructionEnergized(2));
                assertEquals(a, result.isPowerIn(1));
            }
        }
    }

    @Test
    public void examineOpenPassesWhenBitIsClear() {
        List<Instruction> rung = Arrays.asList(Instruction.of("XIO", "Stop"), Instruction.of("OTE", "Run"));
        assertTrue(evaluate(rung).isRungEnergized());
        state.setTag("Stop", true);
        assertFalse(evaluate(rung).isRungEnergized());
    }

    @Test
    public void parallelLegsAreOred() {
        List<Instruction> rung = Arrays.asList(leg("XIC", "A", 1, 1), leg("XIC", "B", 2, 1),
                Instruction.of("OTE", "C"));
        boolean[] values = {false, true};
        for (boolean a : values) {
            for (boolean b : values) {
                state.setTag("A", a);
                state.setTag("B", b);
                PowerFlowResult result = evaluate(rung);
                assertEquals("A=" + a + " B=" + b, a || b, result.isRungEnergized());
                assertEquals(a || b, result.isInstructionEnergized(2));
                assertEquals(a, result.isInstructionEnergized(0));
                assertEquals(b, result.isInstructionEnergized(1));
            }
        }
    }

    @Test
    public void legacyParallelIndexLegsAreOred() {
        List<Instruction> rung = Arrays.asList(
                Instruction.builder("XIC").operands("A").legacyBranch(1, 0).build(),
                Instruction.builder("XIC").operands("B").legacyBranch(1, 1).build(),
                Instruction.of("OTE", "C"));
        assertEquals(3, organizer.organize(rung).getRows().size());
        boolean[] values = {false, true};
        for (boolean a : values) {
            for (boolean b : values) {
                state.setTag("A", a);
                state.setTag("B", b);
                assertEquals("A=" + a + " B=" + b, a || b, evaluate(rung).isRungEnergized());
            }
        }
    }

    @Test
    public void wiresFollowThePowerAlongEachRow() {
        state.setTag("A", true);
        PowerFlowResult result = evaluate(Arrays.asList(leg("XIC", "A", 1, 1), leg("XIC", "B", 2, 1),
                Instruction.of("OTE", "C")));
        // main row: wire into OTE, wire after OTE
        assertTrue(result.isWireEnergized(0, 0));
        assertTrue(result.isWireEnergized(0, 1));
        assertTrue(result.isWireEnergized(1, 0));
        assertTrue(result.isWireEnergized(1, 1));
        assertTrue(result.isWireEnergized(2, 0));
        assertFalse(result.isWireEnergized(2, 1));
    }

    @Test
    public void nestedBranchesCombineSeriesAndParallel() {
        // Y = A AND (B OR (C AND (D OR E)))
        List<Instruction> rung = Arrays.asList(
                Instruction.of("XIC", "A"),
                leg("XIC", "B", 1, 1),
                leg("XIC", "C", 2, 1),
                leg("XIC", "D", 3, 2),
                leg("XIC", "E", 4, 2),
                Instruction.of("OTE", "Y"));

        // expected, then A B C D E
        assertRung(rung, true, true, true, false, false, false);
        assertRung(rung, true, true, false, true, false, true);
        assertRung(rung, true, true, false, true, true, false);
        assertRung(rung, false, true, false, true, false, false);
        assertRung(rung, false, true, false, false, true, true);
        assertRung(rung, false, false, true, true, true, true);
    }

    private void assertRung(List<Instruction> rung, boolean expected, boolean a, boolean b, boolean c,
                            boolean d, boolean e) {
        state.setTag("A", a);
        state.setTag("B", b);
        state.setTag("C", c);
        state.setTag("D", d);
        state.setTag("E", e);
        PowerFlowResult result = evaluate(rung);
        assertEquals(expected, result.isRungEnergized());
        assertEquals(expected, result.isInstructionEnergized(5));
    }

    @Test
    public void comparisonsUseResolvedValues() {
        state.setNumeric("Level", 42.0);
        assertTrue(evaluate(Collections.singletonList(Instruction.of("EQU", "Level", "42"))).isRungEnergized());
        assertFalse(evaluate(Collections.singletonList(Instruction.of("NEQ", "Level", "42"))).isRungEnergized());
        assertTrue(evaluate(Collections.singletonList(Instruction.of("GRT", "Level", "40"))).isRungEnergized());
        assertTrue(evaluate(Collections.singletonList(Instruction.of("GEQ", "Level", "42"))).isRungEnergized());
        assertFalse(evaluate(Collections.singletonList(Instruction.of("LES", "Level", "42"))).isRungEnergized());
        assertTrue(evaluate(Collections.singletonList(Instruction.of("LEQ", "Level", "42"))).isRungEnergized());
        assertTrue(evaluate(Collections.singletonList(Instruction.of("LES", "Missing", "1"))).isRungEnergized());
    }

    @Test
    public void comparisonAgainstTimerMember() {
        state.putTimer("T1", new TimerState(750L, 1000L, true, true, false));
        assertTrue(evaluate(Collections.singletonList(Instruction.of("GRT", "T1.ACC", "500"))).isRungEnergized());
        assertFalse(evaluate(Collections.singletonList(Instruction.of("XIC", "T1.DN"))).isRungEnergized());
        assertTrue(evaluate(Collections.singletonList(Instruction.of("XIC", "T1.TT"))).isRungEnergized());
    }

    @Test
    public void limitTestsInsideAndWrappedRanges() {
        state.setNumeric("N", 5.0);
        assertTrue(evaluate(Collections.singletonList(Instruction.of("LIM", "0", "N", "10"))).isRungEnergized());
        assertFalse(evaluate(Collections.singletonList(Instruction.of("LIM", "6", "N", "10"))).isRungEnergized());
        // low above high passes outside the gap
        assertFalse(evaluate(Collections.singletonList(Instruction.of("LIM", "10", "N", "0"))).isRungEnergized());
        state.setNumeric("N", 15.0);
        assertTrue(evaluate(Collections.singletonList(Instruction.of("LIM", "10", "N", "0"))).isRungEnergized());
    }

    @Test
    public void computeCompareEvaluatesExpression() {
        state.setNumeric("Pressure", 4.0);
        assertTrue(evaluate(Collections.singletonList(Instruction.of("CMP", "Pressure * 2 > 7"))).isRungEnergized());
        assertFalse(evaluate(Collections.singletonList(Instruction.of("CMP", "Pressure * 2 > 9"))).isRungEnergized());
    }

    @Test
    public void malformedExpressionEvaluatesFalse() {
        assertFalse(evaluate(Collections.singletonList(Instruction.of("CMP", "Pressure >"))).isRungEnergized());
    }

    @Test
    public void forcesOverrideStoredValues() {
        List<Instruction> rung = Arrays.asList(Instruction.of("XIC", "A"), Instruction.of("OTE", "B"));
        assertFalse(evaluate(rung).isRungEnergized());

        state.getForces().forceOn("A");
        assertTrue(evaluate(rung).isRungEnergized());

        state.getForces().removeForce("A");
        assertFalse(evaluate(rung).isRungEnergized());

        state.setTag("A", true);
        state.getForces().forceOff("A");
        assertFalse(evaluate(rung).isRungEnergized());
    }

    @Test
    public void forceWinsOverSampledInput() {
        List<Instruction> rung = Arrays.asList(Instruction.of("XIC", "A"), Instruction.of("OTE", "B"));
        state.getForces().forceOff("A");
        PowerFlowResult result = evaluator.evaluate(organizer.organize(rung).getRows(), state, state.getForces(),
                Collections.singletonMap("A", true));
        assertFalse(result.isRungEnergized());

        state.getForces().removeForce("A");
        result = evaluator.evaluate(organizer.organize(rung).getRows(), state, state.getForces(),
                Collections.singletonMap("A", true));
        assertTrue(result.isRungEnergized());
    }

    @Test
    public void evaluationIsDeterministicAndReadOnly() {
        state.setTag("A", true);
        state.setNumeric("N", 3.0);
        List<Instruction> rung = Arrays.asList(Instruction.of("XIC", "A"), leg("GRT", "N", 1, 1),
                leg("XIO", "B", 2, 1), Instruction.of("OTE", "C"), Instruction.of("ADD", "N", "1", "N"));
        SimulationState before = state.copy();

        PowerFlowResult first = evaluate(rung);
        PowerFlowResult second = evaluate(rung);

        assertEquals(first, second);
        assertEquals(before, state);
    }

    @Test
    public void outputInstructionsPassPowerThrough() {
        state.setTag("A", true);
        PowerFlowResult result = evaluate(Arrays.asList(Instruction.of("XIC", "A"), Instruction.of("OTE", "B"),
                Instruction.of("OTE", "C")));
        assertTrue(result.isInstructionEnergized(1));
        assertTrue(result.isInstructionEnergized(2));
        assertTrue(result.isRungEnergized());
    }

    @Test
    public void oneShotPassesOnlyWhenStorageBitIsClear() {
        List<Instruction> rung = Arrays.asList(Instruction.of("XIC", "A"), Instruction.of("ONS", "Store"),
                Instruction.of("OTE", "Pulse"));
        state.setTag("A", true);
        assertTrue(evaluate(rung).isRungEnergized());
        state.setTag("Store", true);
        assertFalse(evaluate(rung).isRungEnergized());
    }
}
