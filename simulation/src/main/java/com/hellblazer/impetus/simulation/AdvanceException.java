package com.hellblazer.impetus.simulation;

/**
 * Fatal failure of an {@link AdvanceStrategy#advance} call. The simulation state is left at the last accepted step;
 * the caller should stop advancing and report the diagnosis.
 *
 * @author hal.hildebrand
 */
public class AdvanceException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Collisions could not be resolved after repeated backups. */
        STUCK,
        /** The differential equation solver failed for a reason other than collisions. */
        SOLVER_ERROR,
        /** The next sub-step was too small to advance simulation time. */
        TIME_STALLED,
        /** Bodies were left interpenetrating at the end of a sub-step. */
        ILLEGAL_STATE,
        /** The collision handler could not compute valid impulses. */
        COLLISION_FAILED
    }

    private final Kind   kind;
    private final double time;

    public AdvanceException(Kind kind, double time, String message) {
        super(message + " at time " + time);
        this.kind = kind;
        this.time = time;
    }

    public AdvanceException(Kind kind, double time, String message, Throwable cause) {
        super(message + " at time " + time, cause);
        this.kind = kind;
        this.time = time;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return simulation time when the failure occurred
     */
    public double getTime() {
        return time;
    }
}
