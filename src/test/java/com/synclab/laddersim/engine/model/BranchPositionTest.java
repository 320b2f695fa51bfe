package com.synclab.laddersim.engine.model;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class BranchPositionTest {

    @Test
    public void missingFieldsMeanMainPath() {
        assertSame(BranchPosition.MAIN, BranchPosition.of(null, null, null));
        assertSame(BranchPosition.MAIN, BranchPosition.of(-1, -3, false));
        assertTrue(BranchPosition.of(0, 0, false).isMainPath());
        assertFalse(BranchPosition.of(2, 1, true).isMainPath());
    }

    @Test
    public void legacyParallelIndexIsZeroBased() {
        BranchPosition first = BranchPosition.legacy(1, 0);
        BranchPosition second = BranchPosition.legacy(1, 1);
        assertEquals(1, first.getLeg());
        assertEquals(2, second.getLeg());
        assertEquals(1, first.getLevel());
        assertEquals(1, second.getLevel());
        assertEquals(BranchPosition.of(3, 2, false), BranchPosition.legacy(2, 2));
    }

    @Test
    public void legacyFieldsOutsideABranch() {
        assertTrue(BranchPosition.legacy(0, 0).isMainPath());
        assertTrue(BranchPosition.legacy(null, null).isMainPath());
        // an index without a level still names a parallel leg
        assertEquals(BranchPosition.of(2, 1, false), BranchPosition.legacy(0, 1));
        assertEquals(BranchPosition.of(1, 1, false), BranchPosition.legacy(1, null));
    }
}
