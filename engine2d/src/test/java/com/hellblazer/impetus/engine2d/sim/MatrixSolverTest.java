/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.engine2d.sim;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class MatrixSolverTest {

    private static final double TOL = 1e-9;

    @Test
    void solvesWellConditionedSystem() {
        // 2x + y - z = 8, -3x - y + 2z = -11, -2x + y + 2z = -3
        double[][] a = { { 2, 1, -1, 8 }, { -3, -1, 2, -11 }, { -2, 1, 2, -3 } };
        var x = new double[3];
        var nrow = new int[3];
        assertEquals(-1, MatrixSolver.solve(a, x, 1e-12, nrow));
        assertEquals(2, x[0], TOL);
        assertEquals(3, x[1], TOL);
        assertEquals(-1, x[2], TOL);
    }

    @Test
    void needsPivoting() {
        double[][] a = { { 0, 1, 3 }, { 1, 0, 4 } };
        var x = new double[2];
        assertEquals(-1, MatrixSolver.solve(a, x, 1e-12, new int[2]));
        assertEquals(4, x[0], TOL);
        assertEquals(3, x[1], TOL);
    }

    @Test
    void redundantConsistentRowZeroesFreeVariable() {
        double[][] a = { { 1, 1, 2 }, { 1, 1, 2 } };
        var x = new double[2];
        assertEquals(-1, MatrixSolver.solve(a, x, 1e-12, new int[2]));
        assertEquals(2, x[0] + x[1], TOL);
        assertEquals(0, x[1], TOL);
    }

    @Test
    void reportsInconsistentRow() {
        double[][] a = { { 1, 1, 2 }, { 1, 1, 3 } };
        var x = new double[2];
        assertEquals(1, MatrixSolver.solve(a, x, 1e-12, new int[2]));
    }

    @Test
    void reportsZeroRow() {
        double[][] a = { { 0, 0, 1 }, { 1, 0, 1 } };
        assertEquals(0, MatrixSolver.solve(a, new double[2], 1e-12, new int[2]));
    }

    @Test
    void rejectsUndersizedMatrix() {
        double[][] a = { { 1, 2 } };
        assertThrows(IllegalArgumentException.class, () -> MatrixSolver.solve(a, new double[2], 1e-12, new int[2]));
    }

    @Test
    void vectorHelpers() {
        double[][] a = { { 1, 2 }, { 3, 4 } };
        assertArrayEquals(new double[] { 5, 11 }, MatrixSolver.multiply(a, new double[] { 1, 2 }), TOL);
        assertArrayEquals(new double[] { 4, 6 }, MatrixSolver.add(new double[] { 1, 2 }, new double[] { 3, 4 }), TOL);
        assertEquals(7, MatrixSolver.maxSize(new double[] { 1, -7, 3 }), TOL);
        assertEquals(0, MatrixSolver.maxSize(new double[0]), TOL);
    }
}
