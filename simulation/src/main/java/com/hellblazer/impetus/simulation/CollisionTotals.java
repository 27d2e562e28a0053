package com.hellblazer.impetus.simulation;

/**
 * Running counts of collision handling work, for diagnostics and regression tests.
 *
 * @author hal.hildebrand
 */
public class CollisionTotals {

    private int collisions;
    private int searches;
    private int impulses;
    private int steps;
    private int backups;

    public void addCollisions(int n) {
        collisions += n;
    }

    public void addSearches(int n) {
        searches += n;
    }

    public void addImpulses(int n) {
        impulses += n;
    }

    public void addSteps(int n) {
        steps += n;
    }

    public void addBackups(int n) {
        backups += n;
    }

    public int getCollisions() {
        return collisions;
    }

    /**
     * @return number of completed binary searches for a collision time
     */
    public int getSearches() {
        return searches;
    }

    public int getImpulses() {
        return impulses;
    }

    /**
     * @return number of differential equation solver steps
     */
    public int getSteps() {
        return steps;
    }

    public int getBackups() {
        return backups;
    }

    public void reset() {
        collisions = 0;
        searches = 0;
        impulses = 0;
        steps = 0;
        backups = 0;
    }

    @Override
    public String toString() {
        return "CollisionTotals{collisions=" + collisions + ", steps=" + steps + ", backups=" + backups
        + ", impulses=" + impulses + ", searches=" + searches + "}";
    }
}
