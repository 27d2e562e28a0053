/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Impetus.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.impetus.engine2d.collision;

import com.hellblazer.impetus.common.Util;
import com.hellblazer.impetus.engine2d.geometry.Edge;
import com.hellblazer.impetus.engine2d.geometry.Geometry;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;
import com.hellblazer.impetus.engine2d.geometry.Vertex;
import com.hellblazer.impetus.engine2d.sim.Connector;
import com.hellblazer.impetus.simulation.Collision;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;

/**
 * A collision or contact between a point on the primary body and an edge (or point) of the normal body. The normal
 * is a unit vector in world coordinates pointing from the normal body towards the primary body; the distance is
 * measured along it and is negative when the bodies interpenetrate.
 * <p>
 * The gap the engine aims for between colliding bodies is half the distance tolerance, so a collision is handled
 * before the bodies actually touch. Joints aim for zero distance and push as well as pull.
 * <p>
 * For curved edges the velocity is computed from the motion of the circle center rather than the impact point, see
 * {@link #getU1()} and {@link #getU2()}.
 *
 * @author hal.hildebrand
 */
public abstract class RigidBodyCollision implements Collision {

    private static final double MIN_ESTIMATE_VELOCITY = 0.001;
    private static final double TINY_TIME             = 1e-12;

    protected final RigidBody primaryBody;
    protected final RigidBody normalBody;
    protected final boolean   joint;
    private final   double    distanceTol;
    private final   double    targetGap;
    private final   double    accuracy;
    private final   double    velocityTol;
    private final   double    elasticity;

    protected Point2d  impact1     = new Point2d(Geometry.ORIGIN);
    protected Point2d  impact2;
    protected Vector2d normal      = new Vector2d(Geometry.NORTH);
    protected double   distance    = Double.NaN;
    protected double   radius1     = Double.NaN;
    protected double   radius2     = Double.NaN;
    protected boolean  ballObject;
    protected boolean  ballNormal;
    protected boolean  normalFixed;
    private   boolean  mustHandle;
    private   double   normalVelocity   = Double.NaN;
    private   double   detectedDistance = Double.NaN;
    private   double   detectedVelocity = Double.NaN;
    private   double   detectedTime     = Double.NaN;
    private   double   estimate         = Double.NaN;
    private   double   updateTime       = Double.NaN;
    private   double   impulse          = Double.NaN;
    private   double   force            = Double.NaN;

    protected RigidBodyCollision(RigidBody primaryBody, RigidBody normalBody, boolean joint) {
        this.primaryBody = primaryBody;
        this.normalBody = normalBody;
        this.joint = joint;
        distanceTol = Math.max(primaryBody.getDistanceTol(), normalBody.getDistanceTol());
        targetGap = joint ? 0 : distanceTol / 2;
        double acc = Math.max(primaryBody.getAccuracy(), normalBody.getAccuracy());
        if (!(acc > 0 && acc <= 1)) {
            throw new IllegalArgumentException("accuracy must be in (0, 1]: " + acc);
        }
        accuracy = acc * distanceTol / 2;
        velocityTol = Math.max(primaryBody.getVelocityTol(), normalBody.getVelocityTol());
        elasticity = Math.min(primaryBody.getElasticity(), normalBody.getElasticity());
    }

    @Override
    public boolean bilateral() {
        return joint;
    }

    @Override
    public boolean closeEnough(boolean allowTiny) {
        if (contact()) {
            return true;
        }
        if (allowTiny) {
            return distance > 0 && distance < targetGap + accuracy;
        }
        return distance > targetGap - accuracy && distance < targetGap + accuracy;
    }

    @Override
    public boolean contact() {
        return joint || (Math.abs(getNormalVelocity()) < velocityTol && distance > 0 && distance < distanceTol);
    }

    /**
     * @return how far the distance is from the target gap, positive when further apart
     */
    public double distanceToHalfGap() {
        return distance - targetGap;
    }

    /**
     * The joint that generated this record, or null for collisions between edges and vertices.
     */
    public Connector getConnector() {
        return null;
    }

    @Override
    public double getDetectedTime() {
        return detectedTime;
    }

    @Override
    public double getDistance() {
        return distance;
    }

    public double getDistanceTol() {
        return distanceTol;
    }

    public double getAccuracy() {
        return accuracy;
    }

    public double getTargetGap() {
        return targetGap;
    }

    public double getVelocityTol() {
        return velocityTol;
    }

    public double getElasticity() {
        return elasticity;
    }

    @Override
    public double getEstimatedTime() {
        return estimate;
    }

    public double getForce() {
        return force;
    }

    public void setForce(double force) {
        this.force = force;
    }

    public Point2d getImpact1() {
        return new Point2d(impact1);
    }

    /**
     * @return the impact point on the normal body when it differs from the impact point on the primary body, else
     * null
     */
    public Point2d getImpact2() {
        return impact2 == null ? null : new Point2d(impact2);
    }

    @Override
    public double getImpulse() {
        return impulse;
    }

    public void setImpulse(double impulse) {
        this.impulse = impulse;
    }

    @Override
    public double getLateralVelocity() {
        var v = getRelativeVelocity();
        return -normal.y * v.x + normal.x * v.y;
    }

    public RigidBody getNormalBody() {
        return normalBody;
    }

    public Vector2d getNormal() {
        return new Vector2d(normal);
    }

    /**
     * Normal component of the relative velocity of the primary body with respect to the normal body. Negative when
     * the bodies approach each other.
     */
    public double getNormalVelocity() {
        if (Double.isNaN(normalVelocity)) {
            normalVelocity = Geometry.dot(normal, getRelativeVelocity());
        }
        return normalVelocity;
    }

    public RigidBody getPrimaryBody() {
        return primaryBody;
    }

    /**
     * @return vector from the primary body's center of mass to the impact point, world coordinates
     */
    public Vector2d getR1() {
        return Geometry.between(primaryBody.getPosition(), impact1);
    }

    /**
     * @return vector from the normal body's center of mass to the impact point, world coordinates
     */
    public Vector2d getR2() {
        return Geometry.between(normalBody.getPosition(), impact2 != null ? impact2 : impact1);
    }

    public double getRadius1() {
        return radius1;
    }

    public double getRadius2() {
        return radius2;
    }

    /**
     * Relative velocity of the impact point on the primary body with respect to the normal body.
     */
    public Vector2d getRelativeVelocity() {
        double vax = 0;
        double vay = 0;
        double vbx = 0;
        double vby = 0;
        if (primaryBody.isMoveable()) {
            var r1 = getU1();
            var va = primaryBody.getVelocity();
            double wa = primaryBody.getAngularVelocity();
            vax = va.x - wa * r1.y;
            vay = va.y + wa * r1.x;
        }
        if (normalBody.isMoveable()) {
            var r2 = getU2();
            var vb = normalBody.getVelocity();
            double wb = normalBody.getAngularVelocity();
            vbx = vb.x - wb * r2.y;
            vby = vb.y + wb * r2.x;
        }
        return new Vector2d(vax - vbx, vay - vby);
    }

    /**
     * Vector from the primary body's center of mass to the point whose motion determines the normal velocity: the
     * center of the circle for a curved edge, otherwise the impact point.
     */
    public Vector2d getU1() {
        return getR1();
    }

    /**
     * As {@link #getU1()}, for the normal body.
     */
    public Vector2d getU2() {
        return getR2();
    }

    public double getUpdateTime() {
        return updateTime;
    }

    @Override
    public double getVelocity() {
        return getNormalVelocity();
    }

    public boolean hasBody(RigidBody body) {
        return primaryBody == body || normalBody == body;
    }

    public abstract boolean hasEdge(Edge edge);

    public abstract boolean hasVertex(Vertex v);

    @Override
    public boolean illegalState() {
        return !joint && distance < 0;
    }

    public boolean isBallNormal() {
        return ballNormal;
    }

    public boolean isBallObject() {
        return ballObject;
    }

    @Override
    public boolean isColliding() {
        if (joint) {
            return false;
        }
        if (distance < 0) {
            return true;
        }
        return getNormalVelocity() < -velocityTol && distance < targetGap - accuracy;
    }

    /**
     * @return true when the normal does not rotate with either body, so its time derivative is zero
     */
    public boolean isNormalFixed() {
        return normalFixed;
    }

    @Override
    public boolean isTouching() {
        return joint || distance < distanceTol;
    }

    @Override
    public boolean needsHandling() {
        return mustHandle;
    }

    public void setBallNormal(boolean ballNormal) {
        this.ballNormal = ballNormal;
    }

    public void setBallObject(boolean ballObject) {
        this.ballObject = ballObject;
    }

    @Override
    public void setDetectedTime(double time) {
        if (!Double.isNaN(detectedTime)) {
            throw new IllegalStateException("detected time already set " + this);
        }
        detectedTime = time;
        detectedDistance = distance;
        double nv = getNormalVelocity();
        detectedVelocity = nv;
        estimate = Double.NaN;
        if (!joint && nv < -MIN_ESTIMATE_VELOCITY) {
            estimate = time + (targetGap - distance) / nv;
        }
    }

    public void setDistance(double distance) {
        this.distance = distance;
    }

    public void setImpact1(Point2d impact1) {
        this.impact1 = new Point2d(impact1);
    }

    public void setImpact2(Point2d impact2) {
        this.impact2 = impact2 == null ? null : new Point2d(impact2);
    }

    @Override
    public void setNeedsHandling(boolean needsHandling) {
        mustHandle = needsHandling;
    }

    public void setNormal(Vector2d normal) {
        this.normal = new Vector2d(normal);
        normalVelocity = Double.NaN;
    }

    public void setNormalFixed(boolean normalFixed) {
        this.normalFixed = normalFixed;
    }

    public void setRadius1(double radius1) {
        this.radius1 = radius1;
    }

    public void setRadius2(double radius2) {
        this.radius2 = radius2;
    }

    /**
     * Refreshes the cached normal velocity and re-estimates the collision time. Subclasses recompute the geometry
     * (impact point, normal, distance) from the current body positions before calling this.
     */
    @Override
    public void updateCollision(double time) {
        if (!Double.isFinite(distance)) {
            throw new IllegalStateException("distance is not finite " + this);
        }
        normalVelocity = Double.NaN;
        updateTime = time;
        double nv = getNormalVelocity();
        if ((mustHandle || !contact()) && nv < 0) {
            updateEstimatedTime(time);
        } else {
            estimate = Double.NaN;
        }
    }

    /**
     * Estimates the time of reaching the target gap assuming constant acceleration between the detected state and the
     * current state.
     */
    protected void updateEstimatedTime(double time) {
        double t1 = time;
        double t2 = detectedTime;
        double h = t2 - t1;
        if (h <= TINY_TIME) {
            return;
        }
        double v1 = getNormalVelocity();
        double v2 = detectedVelocity;
        double d1 = distance;
        double a = (v2 - v1) / h;
        if (Math.abs(a) < TINY_TIME) {
            return;
        }
        double det = Math.sqrt(v1 * v1 - 2 * a * (d1 - targetGap));
        double e1 = t1 + (-v1 + det) / a;
        double e2 = t1 + (-v1 - det) / a;
        boolean e1Within = t1 < e1 && e1 < t2;
        boolean e2Within = t1 < e2 && e2 < t2;
        if (e1Within && e2Within) {
            estimate = Math.min(e1, e2);
        } else if (e1Within) {
            estimate = e1;
        } else if (e2Within) {
            estimate = e2;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{distance=" + Util.nfe(distance) + ", normalVelocity=" + Util.nfe(
        normalVelocity) + ", body=" + primaryBody.getName() + ", normalBody=" + normalBody.getName() + ", impact1="
        + impact1 + ", joint=" + joint + ", elasticity=" + Util.nf7(elasticity) + ", targetGap=" + Util.nfe(targetGap)
        + ", accuracy=" + Util.nf7(accuracy) + ", mustHandle=" + mustHandle + ", impact2=" + impact2 + ", normal="
        + normal + ", ballObject=" + ballObject + ", ballNormal=" + ballNormal + ", estimate=" + Util.nf7(estimate)
        + ", detectedTime=" + Util.nf7(detectedTime) + ", detectedDistance=" + Util.nfe(detectedDistance)
        + ", detectedVelocity=" + Util.nfe(detectedVelocity) + ", impulse=" + Util.nfe(impulse) + ", force="
        + Util.nfe(force) + ", updateTime=" + Util.nf7(updateTime) + '}';
    }
}
