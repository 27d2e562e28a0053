package com.hellblazer.impetus.simulation;

import java.util.Optional;

/**
 * First order Euler integration. Mostly useful for comparison in tests.
 *
 * @author hal.hildebrand
 */
public class EulersMethod implements DiffEqSolver {

    private final ODESim sim;

    public EulersMethod(ODESim sim) {
        this.sim = sim;
    }

    @Override
    public String getName() {
        return "EULERS_METHOD";
    }

    @Override
    public Optional<StepError> step(double stepSize) {
        var varsList = sim.getVarsList();
        var vars = varsList.getValues();
        var change = new double[vars.length];
        var error = sim.evaluate(vars, change, 0);
        if (error.isPresent()) {
            return error;
        }
        RungeKutta.offset(varsList, vars, change, stepSize, vars);
        return DiffEqSolver.commit(varsList, vars, getName());
    }
}
