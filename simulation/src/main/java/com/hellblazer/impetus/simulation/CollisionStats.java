package com.hellblazer.impetus.simulation;

import com.hellblazer.impetus.common.Util;

import java.util.List;

/**
 * Statistics about a set of collisions, used by {@link CollisionAdvance} to choose the next step size.
 *
 * @author hal.hildebrand
 */
public class CollisionStats {

    private int    numCollisions;
    private int    numJoints;
    private int    numContacts;
    private int    numNonContact;
    private int    numNeedsHandling;
    private int    numImminent;
    private double minDistance  = Double.POSITIVE_INFINITY;
    private double estTime      = Double.NaN;
    private double detectedTime = Double.NaN;

    public void clear() {
        numCollisions = 0;
        numJoints = 0;
        numContacts = 0;
        numNonContact = 0;
        numNeedsHandling = 0;
        numImminent = 0;
        minDistance = Double.POSITIVE_INFINITY;
        estTime = Double.POSITIVE_INFINITY;
        detectedTime = Double.POSITIVE_INFINITY;
    }

    /**
     * Recomputes all statistics from the given collisions.
     * <p>
     * A collision is imminent when it needs handling or is not a contact, and the objects approach each other. The
     * estimated time is the earliest estimate among imminent collisions, and is unknown (NaN) when any imminent
     * collision has no estimate.
     */
    public void update(List<? extends Collision> collisions) {
        clear();
        numCollisions = collisions.size();
        for (var c : collisions) {
            if (c.bilateral()) {
                numJoints++;
            } else if (c.contact()) {
                numContacts++;
            }
            if (!c.contact()) {
                numNonContact++;
            }
            if (c.needsHandling()) {
                numNeedsHandling++;
                if (c.getDetectedTime() < detectedTime) {
                    detectedTime = c.getDetectedTime();
                }
            }
            if ((c.needsHandling() || !c.contact()) && c.getVelocity() < 0) {
                numImminent++;
                var dist = c.getDistance();
                if (!Double.isFinite(dist)) {
                    throw new IllegalStateException("distance is not finite: " + c);
                }
                if (dist < minDistance) {
                    minDistance = dist;
                }
                if (!Double.isNaN(estTime)) {
                    var t = c.getEstimatedTime();
                    if (Double.isNaN(t)) {
                        estTime = Double.NaN;
                    } else if (t < estTime) {
                        estTime = t;
                    }
                }
            }
        }
        if (estTime == Double.POSITIVE_INFINITY) {
            estTime = Double.NaN;
        }
        if (detectedTime == Double.POSITIVE_INFINITY) {
            detectedTime = Double.NaN;
        }
    }

    public int getNumCollisions() {
        return numCollisions;
    }

    public int getNumJoints() {
        return numJoints;
    }

    public int getNumContacts() {
        return numContacts;
    }

    public int getNumNonContact() {
        return numNonContact;
    }

    public int getNumNeedsHandling() {
        return numNeedsHandling;
    }

    public int getNumImminent() {
        return numImminent;
    }

    /**
     * @return the least positive or most negative distance among imminent collisions
     */
    public double getMinDistance() {
        return minDistance;
    }

    /**
     * @return estimated time of the earliest collision, NaN when it cannot be determined
     */
    public double getEstTime() {
        return estTime;
    }

    /**
     * @return time the earliest collision needing handling was detected, NaN when there is none
     */
    public double getDetectedTime() {
        return detectedTime;
    }

    @Override
    public String toString() {
        var s = "CollisionStats{collisions=" + numCollisions;
        if (numCollisions > 0) {
            s += ", estTime=" + Util.nf7(estTime) + ", detectedTime=" + Util.nf7(detectedTime) + ", needsHandling="
            + numNeedsHandling + ", minDistance=" + Util.nf7(minDistance) + ", nonContact=" + numNonContact
            + ", imminent=" + numImminent + ", joints=" + numJoints + ", contacts=" + numContacts;
        }
        return s + "}";
    }
}
