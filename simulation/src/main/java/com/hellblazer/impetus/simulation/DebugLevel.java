package com.hellblazer.impetus.simulation;

import java.util.EnumSet;
import java.util.Set;

import static com.hellblazer.impetus.simulation.WayPoint.*;

/**
 * Verbosity of {@link CollisionAdvance} way-point tracing. Each level selects the set of way-points logged at debug
 * level; {@code CUSTOM} keeps whatever set was given with {@link CollisionAdvance#setWayPoints(Set)}.
 *
 * @author hal.hildebrand
 */
public enum DebugLevel {
    NONE {
        @Override
        public Set<WayPoint> wayPoints() {
            return EnumSet.of(STUCK);
        }
    },
    LOW {
        @Override
        public Set<WayPoint> wayPoints() {
            return EnumSet.of(SUMMARY, STUCK);
        }
    },
    MEDIUM {
        @Override
        public Set<WayPoint> wayPoints() {
            return EnumSet.of(COLLISIONS_TO_HANDLE, HANDLE_REMOVE_DISTANT, HANDLE_COLLISION_SUCCESS, PRE_COLLISION,
                              POST_COLLISION, STUCK);
        }
    },
    OPTIMAL {
        @Override
        public Set<WayPoint> wayPoints() {
            return EnumSet.of(ADVANCE_SIM_FAIL, ADVANCE_SIM_COLLIDING, POST_COLLISION, PRE_COLLISION,
                              HANDLE_REMOVE_DISTANT, HANDLE_COLLISION_START, HANDLE_COLLISION_SUCCESS,
                              HANDLE_COLLISION_FAIL, SMALL_IMPACTS, SMALL_IMPACTS_START, SMALL_IMPACTS_FINISH,
                              BINARY_SEARCH_FAIL, NEXT_STEP_ESTIMATE, NEXT_STEP_BINARY, ESTIMATE_IN_PAST,
                              ESTIMATE_FAILED, NO_ESTIMATE, MAYBE_STUCK, STUCK, SUMMARY);
        }
    },
    HIGH {
        @Override
        public Set<WayPoint> wayPoints() {
            return EnumSet.allOf(WayPoint.class);
        }
    },
    CUSTOM {
        @Override
        public Set<WayPoint> wayPoints() {
            return EnumSet.of(STUCK);
        }
    };

    public abstract Set<WayPoint> wayPoints();
}
