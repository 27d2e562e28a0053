package com.hellblazer.impetus.simulation;

import java.util.List;

/**
 * Failure reported by {@link ODESim#evaluate} and passed through {@link DiffEqSolver#step}. When the evaluation found
 * penetrating collisions they are carried here so the advance strategy can back up and handle them.
 *
 * @param message    diagnosis
 * @param collisions collisions that prevented the evaluation, empty for other failures
 * @author hal.hildebrand
 */
public record StepError(String message, List<? extends Collision> collisions) {

    public StepError {
        collisions = List.copyOf(collisions);
    }

    public static StepError of(String message) {
        return new StepError(message, List.of());
    }

    public static StepError collisions(List<? extends Collision> collisions) {
        return new StepError("penetrating collisions: " + collisions.size(), collisions);
    }

    public boolean hasCollisions() {
        return !collisions.isEmpty();
    }
}
