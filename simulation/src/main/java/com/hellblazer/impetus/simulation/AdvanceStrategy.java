package com.hellblazer.impetus.simulation;

/**
 * Advances a simulation through time. A scheduler calls {@link #advance} repeatedly; the strategy decides how the time
 * step is subdivided.
 *
 * @author hal.hildebrand
 */
public interface AdvanceStrategy {

    /**
     * Advances the simulation by the given time step.
     *
     * @param timeStep amount of simulation time to advance
     * @param memo     callback invoked after each accepted sub-step, may be null
     * @throws AdvanceException when the step cannot be completed
     */
    void advance(double timeStep, Memorizable memo);

    default void advance(double timeStep) {
        advance(timeStep, null);
    }

    /**
     * Same as {@link #advance} but reports a failure as a result instead of throwing.
     */
    default AdvanceResult tryAdvance(double timeStep, Memorizable memo) {
        try {
            advance(timeStep, memo);
            return AdvanceResult.success(getTime());
        } catch (AdvanceException e) {
            return AdvanceResult.failure(e);
        }
    }

    double getTime();

    /**
     * @return the default time step for {@link #advance}
     */
    double getTimeStep();

    void setTimeStep(double timeStep);

    DiffEqSolver getDiffEqSolver();

    void setDiffEqSolver(DiffEqSolver solver);

    /**
     * Returns the simulation to its saved initial state.
     */
    void reset();

    /**
     * Saves the current state as the initial state used by {@link #reset()}.
     */
    void save();
}
