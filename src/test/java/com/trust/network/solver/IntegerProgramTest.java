package com.trust.network.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.BitSet;

import static org.junit.jupiter.api.Assertions.*;

class IntegerProgramTest {

    @Test
    @DisplayName("Repeated terms should merge and zero coefficients should drop")
    void mergesTerms() {
        IntegerProgram.Builder b = IntegerProgram.builder("merge");
        int x = b.addVariable("x", 1);
        int y = b.addVariable("y", 1);
        b.constraint("row").term(x, 2).term(y, 1).term(x, 3).term(y, -1).atMost(4);

        IntegerProgram program = b.build();
        IntegerProgram.LinearConstraint row = program.getConstraints().get(0);

        assertEquals(1, row.size());
        assertEquals(x, row.variable(0));
        assertEquals(5.0, row.coefficient(0));
    }

    @Test
    @DisplayName("Evaluate and feasibility should follow the rows")
    void evaluateAndFeasibility() {
        IntegerProgram.Builder b = IntegerProgram.builder("eval");
        int x = b.addVariable("x", 3);
        int y = b.addVariable("y", 4);
        b.constraint("cap").term(x, 2).term(y, 2).atMost(3);
        IntegerProgram program = b.build();

        BitSet both = new BitSet();
        both.set(x);
        both.set(y);
        BitSet onlyY = new BitSet();
        onlyY.set(y);

        assertEquals(7.0, program.evaluate(both));
        assertFalse(program.isFeasible(both, 1e-9));
        assertTrue(program.isFeasible(onlyY, 1e-9));
    }

    @Test
    @DisplayName("Unknown variables and non-finite coefficients should be rejected")
    void rejectsBadTerms() {
        IntegerProgram.Builder b = IntegerProgram.builder("bad");
        int x = b.addVariable("x", 1);

        assertThrows(IllegalArgumentException.class, () -> b.constraint("r").term(x + 1, 1));
        assertThrows(IllegalArgumentException.class, () -> b.constraint("r").term(x, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> b.addVariable("y", Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("Warm start should be copied on build")
    void warmStartCopied() {
        BitSet start = new BitSet();
        start.set(0);
        IntegerProgram.Builder b = IntegerProgram.builder("copy");
        b.addVariable("x", 1);
        b.warmStart(start);
        IntegerProgram program = b.build();

        start.clear();

        assertTrue(program.getWarmStart().orElseThrow().get(0));
    }
}
