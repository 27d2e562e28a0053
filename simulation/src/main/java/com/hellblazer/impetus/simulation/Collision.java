package com.hellblazer.impetus.simulation;

/**
 * A collision or contact between two objects of a {@link CollisionSim}.
 * <p>
 * Distance is positive when the objects are separated and negative when they interpenetrate. Velocity is the normal
 * relative velocity: negative when the objects approach each other.
 *
 * @author hal.hildebrand
 */
public interface Collision {

    /**
     * @return true for a joint or other two-sided constraint, which pushes and pulls
     */
    boolean bilateral();

    /**
     * Whether the distance is close enough to the target gap to handle this collision now.
     *
     * @param allowTiny accept distances between zero and the target gap, used after backing up when an earlier time is
     *                  not available
     */
    boolean closeEnough(boolean allowTiny);

    /**
     * @return true for a resting contact: touching with small normal velocity
     */
    boolean contact();

    double getDetectedTime();

    double getDistance();

    /**
     * @return estimated time of reaching the target gap, NaN when unknown
     */
    double getEstimatedTime();

    double getImpulse();

    double getLateralVelocity();

    double getVelocity();

    /**
     * @return true when the objects interpenetrate
     */
    boolean illegalState();

    /**
     * @return true when the collision must be handled by backing up in time
     */
    boolean isColliding();

    boolean isTouching();

    boolean needsHandling();

    /**
     * Records the time the collision was found and estimates when the target gap is reached at constant velocity.
     *
     * @throws IllegalStateException if the detected time was already set
     */
    void setDetectedTime(double time);

    void setNeedsHandling(boolean needsHandling);

    /**
     * @return true when this and the other collision concern the same features of the same objects
     */
    boolean similarTo(Collision other);

    /**
     * Refreshes velocity and the estimated collision time after the objects have changed, for example after backing up
     * to an earlier time.
     */
    void updateCollision(double time);
}
