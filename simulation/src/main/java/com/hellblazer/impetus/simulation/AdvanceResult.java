package com.hellblazer.impetus.simulation;

/**
 * Outcome of {@link AdvanceStrategy#tryAdvance}.
 *
 * @param isSuccess whether the whole time step was advanced
 * @param time      simulation time after the call
 * @param error     the failure, null on success
 * @author hal.hildebrand
 */
public record AdvanceResult(boolean isSuccess, double time, AdvanceException error) {

    public static AdvanceResult success(double time) {
        return new AdvanceResult(true, time, null);
    }

    public static AdvanceResult failure(AdvanceException error) {
        return new AdvanceResult(false, error.getTime(), error);
    }
}
