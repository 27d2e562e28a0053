/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.simulation;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integrates a unit harmonic oscillator with each solver and compares with the exact solution.
 *
 * @author hal.hildebrand
 */
class DiffEqSolverTest {

    private static final double STEP = 0.01;

    /**
     * x'' = -x, starting at x = 1, v = 0; the energy slot is computed.
     */
    static class Oscillator implements ODESim {
        final VarsList vars = new VarsList();
        final int      x;
        final int      energy;
        boolean        failing;
        private double[] saved;
        private double[] initial;

        Oscillator() {
            x = vars.addVariables("x", "v");
            energy = vars.addVariables("energy");
            vars.setComputed(energy, true);
            vars.setValue(x, 1.0);
            saveInitialState();
        }

        @Override
        public VarsList getVarsList() {
            return vars;
        }

        @Override
        public Optional<StepError> evaluate(double[] values, double[] change, double timeStep) {
            if (failing) {
                return Optional.of(StepError.of("broken"));
            }
            change[0] = 1;
            change[x] = values[x + 1];
            change[x + 1] = -values[x];
            change[energy] = 1000;
            return Optional.empty();
        }

        @Override
        public void modifyObjects() {
            var xv = vars.getValue(x);
            var v = vars.getValue(x + 1);
            vars.setValue(energy, 0.5 * (xv * xv + v * v));
        }

        @Override
        public void saveState() {
            saved = vars.getValues();
        }

        @Override
        public void restoreState() {
            vars.setValues(saved);
        }

        @Override
        public void reset() {
            vars.setValues(initial, false);
        }

        @Override
        public void saveInitialState() {
            initial = vars.getValues();
        }
    }

    @Test
    void rungeKuttaIsFourthOrderAccurate() {
        var error = integrate(RungeKutta::new);
        assertTrue(error < 1e-9, "error " + error);
    }

    @Test
    void modifiedEulerIsSecondOrderAccurate() {
        var error = integrate(ModifiedEuler::new);
        assertTrue(error < 1e-4, "error " + error);
        assertTrue(error > 1e-9, "error " + error);
    }

    @Test
    void eulerIsFirstOrderAccurate() {
        var error = integrate(EulersMethod::new);
        assertTrue(error < 0.02, "error " + error);
        assertTrue(error > 1e-4, "error " + error);
    }

    @Test
    void computedVariablesAreNotIntegrated() {
        var sim = new Oscillator();
        var solver = new RungeKutta(sim);
        assertTrue(solver.step(STEP).isEmpty());
        assertEquals(0.0, sim.vars.getValue(sim.energy));
        assertEquals(STEP, sim.getTime(), 1e-15);
    }

    @Test
    void errorLeavesVariablesUnchanged() {
        var sim = new Oscillator();
        sim.failing = true;
        var before = sim.vars.getValues();
        var error = new RungeKutta(sim).step(STEP);
        assertTrue(error.isPresent());
        assertFalse(error.get().hasCollisions());
        assertArrayEquals(before, sim.vars.getValues());
    }

    @Test
    void simpleAdvanceMemorizesEachStep() {
        var sim = new Oscillator();
        var advance = new SimpleAdvance(sim);
        var memo = new MemoList();
        int[] count = { 0 };
        memo.addMemo(() -> count[0]++);
        for (int i = 0; i < 10; i++) {
            advance.advance(advance.getTimeStep(), memo);
        }
        assertEquals(10, count[0]);
        assertEquals(0.25, advance.getTime(), 1e-12);
        assertEquals(0.5, sim.vars.getValue(sim.energy), 1e-8);

        advance.reset();
        assertEquals(0.0, advance.getTime());

        sim.failing = true;
        var result = advance.tryAdvance(0.1, null);
        assertFalse(result.isSuccess());
        assertEquals(AdvanceException.Kind.SOLVER_ERROR, result.error().getKind());
    }

    private double integrate(Function<ODESim, DiffEqSolver> factory) {
        var sim = new Oscillator();
        var solver = factory.apply(sim);
        for (int i = 0; i < 100; i++) {
            assertTrue(solver.step(STEP).isEmpty());
        }
        var t = sim.getTime();
        assertEquals(1.0, t, 1e-12);
        return Math.abs(sim.vars.getValue(sim.x) - Math.cos(t));
    }
}
