package com.hellblazer.impetus.simulation;

import com.hellblazer.impetus.common.Util;

import java.util.Optional;

/**
 * Numerical integrator that advances an {@link ODESim} by one step.
 * <p>
 * Solvers leave computed variables untouched and never store a non-finite value: a step producing one fails with an
 * error and leaves the variables unchanged.
 *
 * @author hal.hildebrand
 */
public interface DiffEqSolver {

    String getName();

    /**
     * Advances the simulation variables by the given step.
     *
     * @return the error reported by the simulation, in which case the variables are unchanged
     */
    Optional<StepError> step(double stepSize);

    /**
     * Commits the integrated values, rejecting a result containing NaN or infinity.
     */
    static Optional<StepError> commit(VarsList varsList, double[] vars, String solver) {
        int bad = Util.firstNonFinite(vars);
        if (bad >= 0) {
            return Optional.of(StepError.of(
            solver + " produced " + vars[bad] + " for variable " + varsList.getName(bad)));
        }
        varsList.setValues(vars, true);
        return Optional.empty();
    }
}
