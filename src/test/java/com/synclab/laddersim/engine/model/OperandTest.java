package com.synclab.laddersim.engine.model;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class OperandTest {

    @Test
    public void stripsDisplayDescription() {
        assertEquals("Motor", Operand.strip("Motor§Main conveyor motor"));
        assertEquals("Motor", Operand.strip("  Motor "));
        assertEquals("", Operand.strip(null));
    }

    @Test
    public void recognisesNumericLiterals() {
        assertTrue(Operand.isLiteral("10"));
        assertTrue(Operand.isLiteral("-2.5"));
        assertTrue(Operand.isLiteral("1e3"));
        assertFalse(Operand.isLiteral("T1.PRE"));
        assertFalse(Operand.isLiteral(""));
        assertEquals(1000.0, Operand.parseLiteral("1e3"), 0.0);
        assertTrue(Double.isNaN(Operand.parseLiteral("Tag")));
    }

    @Test
    public void splitsAddresses() {
        assertEquals("Arr", Operand.baseTag("Arr[2].DN"));
        assertEquals("Timer1", Operand.parentOf("Timer1.DN"));
        assertEquals("DN", Operand.memberOf("Timer1.dn"));
        assertNull(Operand.memberOf("Timer1"));
        assertNull(Operand.parentOf("Timer1"));
    }

    @Test
    public void addressesBlockElements() {
        assertEquals("Arr[5]", Operand.element("Arr[2]", 3));
        assertEquals("Arr[3]", Operand.element("Arr", 3));
        assertEquals("Arr[Idx]", Operand.element("Arr[Idx]", 1));
    }

    @Test
    public void questionMarkIsUnspecified() {
        assertTrue(Operand.isUnspecified("?"));
        assertTrue(Operand.isUnspecified(" "));
        assertFalse(Operand.isUnspecified("0"));
    }
}
