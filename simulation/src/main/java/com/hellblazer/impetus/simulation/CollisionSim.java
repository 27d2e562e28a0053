package com.hellblazer.impetus.simulation;

import java.util.List;

/**
 * A simulation whose objects can collide.
 *
 * @param <T> collision type
 * @author hal.hildebrand
 */
public interface CollisionSim<T extends Collision> extends ODESim {

    /**
     * Adds the collisions and contacts present in the given state to the list.
     *
     * @param collisions receives the collisions found
     * @param vars       the state to examine
     * @param stepSize   size of the step just taken
     */
    void findCollisions(List<T> collisions, double[] vars, double stepSize);

    /**
     * Applies impulses that resolve the given collisions.
     *
     * @return true when any impulse was applied
     */
    boolean handleCollisions(List<T> collisions, CollisionTotals totals);
}
