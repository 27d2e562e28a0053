package com.hellblazer.impetus.simulation;

/**
 * Points in the {@link CollisionAdvance} state machine that can be traced in the log.
 *
 * @author hal.hildebrand
 */
public enum WayPoint {
    START,
    ADVANCE_SIM_START,
    ADVANCE_SIM_FAIL,
    ADVANCE_SIM_COLLIDING,
    ADVANCE_SIM_FINISH,
    POST_COLLISION,
    PRE_COLLISION,
    HANDLE_COLLISION_START,
    HANDLE_COLLISION_SUCCESS,
    HANDLE_COLLISION_FAIL,
    COLLISIONS_TO_HANDLE,
    HANDLE_REMOVE_DISTANT,
    ADVANCED_NO_BACKUP,
    SMALL_IMPACTS,
    SMALL_IMPACTS_START,
    SMALL_IMPACTS_FINISH,
    BINARY_SEARCH_FAIL,
    NEXT_STEP_ESTIMATE,
    NEXT_STEP_BINARY,
    NEXT_STEP_FULL,
    MAYBE_STUCK,
    ESTIMATE_IN_PAST,
    ESTIMATE_FAILED,
    NO_ESTIMATE,
    SUMMARY,
    FINISH,
    STUCK
}
