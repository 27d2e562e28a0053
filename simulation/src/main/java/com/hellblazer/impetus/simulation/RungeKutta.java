package com.hellblazer.impetus.simulation;

import java.util.Optional;

/**
 * Classic fourth order Runge-Kutta integration.
 *
 * @author hal.hildebrand
 */
public class RungeKutta implements DiffEqSolver {

    private final ODESim sim;

    public RungeKutta(ODESim sim) {
        this.sim = sim;
    }

    @Override
    public String getName() {
        return "RUNGE_KUTTA";
    }

    @Override
    public Optional<StepError> step(double stepSize) {
        var varsList = sim.getVarsList();
        var vars = varsList.getValues();
        int n = vars.length;
        var inp = new double[n];
        var k1 = new double[n];
        var k2 = new double[n];
        var k3 = new double[n];
        var k4 = new double[n];

        var error = sim.evaluate(vars, k1, 0);
        if (error.isPresent()) {
            return error;
        }
        offset(varsList, vars, k1, stepSize / 2, inp);
        error = sim.evaluate(inp, k2, stepSize / 2);
        if (error.isPresent()) {
            return error;
        }
        offset(varsList, vars, k2, stepSize / 2, inp);
        error = sim.evaluate(inp, k3, stepSize / 2);
        if (error.isPresent()) {
            return error;
        }
        offset(varsList, vars, k3, stepSize, inp);
        error = sim.evaluate(inp, k4, stepSize);
        if (error.isPresent()) {
            return error;
        }
        for (int i = 0; i < n; i++) {
            if (!varsList.isComputed(i)) {
                vars[i] += (k1[i] + 2 * k2[i] + 2 * k3[i] + k4[i]) * stepSize / 6;
            }
        }
        return DiffEqSolver.commit(varsList, vars, getName());
    }

    static void offset(VarsList varsList, double[] vars, double[] change, double h, double[] result) {
        for (int i = 0; i < vars.length; i++) {
            result[i] = varsList.isComputed(i) ? vars[i] : vars[i] + change[i] * h;
        }
    }

    @Override
    public String toString() {
        return "RungeKutta{" + getName() + "}";
    }
}
