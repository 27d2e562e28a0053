package com.hellblazer.impetus.simulation;

import java.util.Optional;

/**
 * Second order midpoint method.
 *
 * @author hal.hildebrand
 */
public class ModifiedEuler implements DiffEqSolver {

    private final ODESim sim;

    public ModifiedEuler(ODESim sim) {
        this.sim = sim;
    }

    @Override
    public String getName() {
        return "MODIFIED_EULER";
    }

    @Override
    public Optional<StepError> step(double stepSize) {
        var varsList = sim.getVarsList();
        var vars = varsList.getValues();
        int n = vars.length;
        var k1 = new double[n];
        var k2 = new double[n];
        var mid = new double[n];

        var error = sim.evaluate(vars, k1, 0);
        if (error.isPresent()) {
            return error;
        }
        RungeKutta.offset(varsList, vars, k1, stepSize / 2, mid);
        error = sim.evaluate(mid, k2, stepSize / 2);
        if (error.isPresent()) {
            return error;
        }
        for (int i = 0; i < n; i++) {
            if (!varsList.isComputed(i)) {
                vars[i] += k2[i] * stepSize;
            }
        }
        return DiffEqSolver.commit(varsList, vars, getName());
    }
}
