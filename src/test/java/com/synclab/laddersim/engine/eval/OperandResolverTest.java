package com.synclab.laddersim.engine.eval;

import com.synclab.laddersim.engine.state.CounterState;
import com.synclab.laddersim.engine.state.SimulationState;
import com.synclab.laddersim.engine.state.TimerState;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class OperandResolverTest {

    private SimulationState state;

    @Before
    public void setUp() {
        state = new SimulationState();
        state.putTimer("T1", new TimerState(300L, 1000L, true, true, false));
        state.putCounter("C1", new CounterState(4, 4, true, false, true, false, false));
        state.setNumeric("Word", 5.0);
        state.setNumeric("Speed", 3.0);
        state.setTag("Flag", true);
    }

    @Test
    public void literalsAndUnknownTags() {
        assertEquals(12.5, OperandResolver.resolve("12.5", state), 0.0);
        assertEquals(0.0, OperandResolver.resolve("Missing", state), 0.0);
        assertEquals(0.0, OperandResolver.resolve("", state), 0.0);
        assertNull(OperandResolver.lookup("Missing", state));
    }

    @Test
    public void descriptionSuffixIsIgnored() {
        assertEquals(3.0, OperandResolver.resolve("Speed§Belt speed", state), 0.0);
    }

    @Test
    public void timerAndCounterMembers() {
        assertEquals(300.0, OperandResolver.resolve("T1.ACC", state), 0.0);
        assertEquals(1000.0, OperandResolver.resolve("T1.PRE", state), 0.0);
        assertEquals(300.0, OperandResolver.resolve("T1", state), 0.0);
        assertEquals(4.0, OperandResolver.resolve("C1.ACC", state), 0.0);
        assertTrue(OperandResolver.readBit("T1.TT", state));
        assertFalse(OperandResolver.readBit("T1.DN", state));
        assertTrue(OperandResolver.readBit("C1.DN", state));
        assertTrue(OperandResolver.readBit("C1.CU", state));
    }

    @Test
    public void bitsOfNumericWords() {
        assertTrue(OperandResolver.readBit("Word.0", state));
        assertFalse(OperandResolver.readBit("Word.1", state));
        assertTrue(OperandResolver.readBit("Word.2", state));
        assertEquals(1.0, OperandResolver.lookup("Word.2", state), 0.0);
    }

    @Test
    public void booleanTagsReadAsOneOrZero() {
        assertEquals(1.0, OperandResolver.resolve("Flag", state), 0.0);
        assertTrue(OperandResolver.readBit("Flag", state));
        assertFalse(OperandResolver.readBit("Other", state));
    }

    @Test
    public void nonFiniteValuesReadAsZero() {
        state.setNumeric("Bad", Double.NaN);
        assertEquals(0.0, OperandResolver.resolve("Bad", state), 0.0);
    }
}
