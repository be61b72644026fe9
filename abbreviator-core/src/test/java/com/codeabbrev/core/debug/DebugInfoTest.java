package com.codeabbrev.core.debug;

import com.codeabbrev.core.syntax.BlockKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DebugInfoTest {

    @Test
    void summaryListsTotalsAndNodes() {
        DebugInfo debug = new DebugInfo(true);
        debug.consider(BlockKind.CLASS_DEF, 1);
        debug.consider(BlockKind.FUNCTION_DEF, 2);
        debug.consider(BlockKind.IF, 2);
        debug.recordAbbreviated(BlockKind.FUNCTION_DEF, 2, 40);
        debug.recordSkipped(BlockKind.IF, 2, "no character reduction");

        String summary = debug.summary();
        assertTrue(summary.contains("Nodes considered: 3"));
        assertTrue(summary.contains("Total characters saved: 40"));
        assertTrue(summary.contains("Maximum depth reached: 2"));
        assertTrue(summary.contains("  Depth 2: 2 nodes"));
        assertTrue(summary.contains("  FunctionDef at depth 2 (saved 40 chars)"));
        assertTrue(summary.contains("  If at depth 2 - no character reduction"));
        assertFalse(summary.contains("No nodes were abbreviated"));
    }

    @Test
    void summaryHintsWhenNothingWasEligible() {
        DebugInfo debug = new DebugInfo(true);
        debug.consider(BlockKind.WITH, 1);
        assertTrue(debug.summary().contains("Decreasing the --depth parameter"));
    }

    @Test
    void disabledCollectorRecordsNothing() {
        DebugInfo debug = DebugInfo.disabled();
        debug.consider(BlockKind.FOR, 3);
        debug.recordAbbreviated(BlockKind.FOR, 3, 10);
        assertEquals(0, debug.getNodesConsidered());
        assertEquals(0, debug.getCharsSaved());
        assertEquals("", debug.summary());
    }
}
