package com.hellblazer.impetus.simulation;

import java.util.Optional;

/**
 * A simulation expressed as a set of first order differential equations over the values of a {@link VarsList}.
 *
 * @author hal.hildebrand
 */
public interface ODESim {

    VarsList getVarsList();

    /**
     * Computes the rate of change of each variable.
     *
     * @param vars     the state to evaluate, which may be an intermediate state of the solver
     * @param change   receives the rate of change of each variable
     * @param timeStep offset of this state from the current simulation time
     * @return an error, such as penetrating collisions, when the state cannot be evaluated
     */
    Optional<StepError> evaluate(double[] vars, double[] change, double timeStep);

    /**
     * Updates the simulation objects to match the current variables, and updates computed variables.
     */
    void modifyObjects();

    /**
     * Saves the current variables so that {@link #restoreState()} can back up to them.
     */
    void saveState();

    void restoreState();

    default double getTime() {
        return getVarsList().getTime();
    }

    /**
     * Returns to the state saved by {@link #saveInitialState()}.
     */
    void reset();

    void saveInitialState();
}
