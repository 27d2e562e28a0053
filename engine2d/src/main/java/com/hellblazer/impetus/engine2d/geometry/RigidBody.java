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
package com.hellblazer.impetus.engine2d.geometry;

import com.hellblazer.impetus.common.DoubleRect;
import com.hellblazer.impetus.common.Util;
import com.hellblazer.impetus.engine2d.collision.RigidBodyCollision;

import javax.vecmath.Point2d;
import javax.vecmath.Tuple2d;
import javax.vecmath.Vector2d;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A rigid body moving in the plane. The pose is the world location of the center of mass and the rotation angle about
 * it; body coordinates are fixed to the body and contain the center of mass at {@link #getCenterOfMassBody()}.
 * <p>
 * The moment of inertia is held per unit mass, so {@link #momentAboutCM()} is mass times moment. A body with infinite
 * mass never moves and reports zero velocity.
 *
 * @author hal.hildebrand
 */
public abstract sealed class RigidBody permits Polygon, Scrim {

    private final String          name;
    private final List<RigidBody> nonCollide = new ArrayList<>();
    protected     Point2d         cmBody     = new Point2d(0, 0);
    protected     Point2d         locWorld   = new Point2d(0, 0);
    protected     double          angle;
    protected     double          sinAngle;
    protected     double          cosAngle   = 1;
    protected     LocalCoords     oldCoords;
    private       double          mass       = 1;
    private       double          moment;
    private       Vector2d        velocity   = new Vector2d(0, 0);
    private       double          angularVelocity;
    private       double          elasticity = 1.0;
    private       double          distanceTol = 0.01;
    private       double          velocityTol = 0.5;
    private       double          accuracy    = 0.6;
    private       double          zeroEnergyLevel = Double.NaN;
    private       int             varsIndex   = -1;

    protected RigidBody(String name) {
        this.name = name;
    }

    /**
     * Adds the collisions and contacts between this body and the other body to the list.
     */
    public abstract void checkCollision(List<RigidBodyCollision> collisions, RigidBody other, double time);

    public abstract double getBottomBody();

    public abstract double getLeftBody();

    public abstract double getRightBody();

    public abstract double getTopBody();

    /**
     * Center of the circle enclosing the body, in body coordinates.
     */
    public abstract Point2d getCentroidBody();

    public abstract double getCentroidRadius();

    public abstract List<Edge> getEdges();

    /**
     * Smallest distance from the center of mass to the outline, the lowest the center of mass can be when resting on
     * a surface.
     */
    public abstract double getMinHeight();

    public abstract List<Vertex> getVertexes();

    public String getName() {
        return name;
    }

    public Point2d bodyToWorld(Tuple2d p) {
        double rx = p.x - cmBody.x;
        double ry = p.y - cmBody.y;
        return new Point2d(locWorld.x + rx * cosAngle - ry * sinAngle, locWorld.y + rx * sinAngle + ry * cosAngle);
    }

    public Point2d worldToBody(Tuple2d p) {
        double rx = p.x - locWorld.x;
        double ry = p.y - locWorld.y;
        return new Point2d(cmBody.x + rx * cosAngle + ry * sinAngle, cmBody.y - rx * sinAngle + ry * cosAngle);
    }

    public Vector2d rotateBodyToWorld(Tuple2d v) {
        return Geometry.rotate(v, cosAngle, sinAngle);
    }

    public Vector2d rotateWorldToBody(Tuple2d v) {
        return Geometry.rotate(v, cosAngle, -sinAngle);
    }

    /**
     * Moves the body so that the body point lies on the world point, with the given angle.
     */
    public void alignTo(Point2d pBody, Point2d pWorld, double angle) {
        double rx = pBody.x - cmBody.x;
        double ry = pBody.y - cmBody.y;
        double sin = Math.sin(angle);
        double cos = Math.cos(angle);
        setPosition(new Point2d(pWorld.x - (rx * cos - ry * sin), pWorld.y - (rx * sin + ry * cos)), angle);
    }

    public void alignTo(Point2d pBody, Point2d pWorld) {
        alignTo(pBody, pWorld, angle);
    }

    public Point2d getPosition() {
        return new Point2d(locWorld);
    }

    public double getAngle() {
        return angle;
    }

    public void setPosition(Point2d locWorld, double angle) {
        if (!Double.isFinite(locWorld.x) || !Double.isFinite(locWorld.y) || !Double.isFinite(angle)) {
            throw new IllegalArgumentException("non-finite position " + locWorld + " angle " + angle + " of " + name);
        }
        this.locWorld = new Point2d(locWorld);
        if (this.angle != angle) {
            this.angle = angle;
            this.sinAngle = Math.sin(angle);
            this.cosAngle = Math.cos(angle);
        }
        forgetPosition();
    }

    public void setPosition(Point2d locWorld) {
        setPosition(locWorld, angle);
    }

    public Vector2d getVelocity() {
        return isMoveable() ? new Vector2d(velocity) : new Vector2d(0, 0);
    }

    /**
     * @return world velocity of the body point
     */
    public Vector2d getVelocity(Point2d pBody) {
        var r = rotateBodyToWorld(Geometry.between(cmBody, pBody));
        var v = getVelocity();
        double w = getAngularVelocity();
        return new Vector2d(v.x - r.y * w, v.y + r.x * w);
    }

    public double getAngularVelocity() {
        return isMoveable() ? angularVelocity : 0;
    }

    public void setVelocity(Vector2d velocity, double angularVelocity) {
        setVelocity(velocity);
        setAngularVelocity(angularVelocity);
    }

    public void setVelocity(Vector2d velocity) {
        if (!Double.isFinite(velocity.x) || !Double.isFinite(velocity.y)) {
            throw new IllegalArgumentException("non-finite velocity " + velocity + " of " + name);
        }
        this.velocity = new Vector2d(velocity);
    }

    public void setAngularVelocity(double angularVelocity) {
        if (!Double.isFinite(angularVelocity)) {
            throw new IllegalArgumentException("angular velocity must be finite: " + angularVelocity);
        }
        this.angularVelocity = angularVelocity;
    }

    public Point2d getCenterOfMassBody() {
        return new Point2d(cmBody);
    }

    public void setCenterOfMass(double x, double y) {
        cmBody = new Point2d(x, y);
        clearMinHeight();
        forgetPosition();
    }

    public Point2d getCentroidWorld() {
        return bodyToWorld(getCentroidBody());
    }

    public double getMass() {
        return mass;
    }

    public RigidBody setMass(double mass) {
        if (!(mass > 0)) {
            throw new IllegalArgumentException("mass must be positive: " + mass);
        }
        this.mass = mass;
        return this;
    }

    public boolean isMoveable() {
        return Double.isFinite(mass);
    }

    /**
     * Moment of inertia about the center of mass per unit mass.
     */
    public double getMoment() {
        return moment;
    }

    public RigidBody setMomentAboutCM(double moment) {
        if (!(moment >= 0)) {
            throw new IllegalArgumentException("moment must not be negative: " + moment);
        }
        this.moment = moment;
        return this;
    }

    public double momentAboutCM() {
        return mass * moment;
    }

    public double translationalEnergy() {
        return isMoveable() ? 0.5 * mass * velocity.lengthSquared() : 0;
    }

    public double rotationalEnergy() {
        return isMoveable() ? 0.5 * momentAboutCM() * angularVelocity * angularVelocity : 0;
    }

    public double getKineticEnergy() {
        return translationalEnergy() + rotationalEnergy();
    }

    public double getElasticity() {
        return elasticity;
    }

    public RigidBody setElasticity(double elasticity) {
        if (!(elasticity >= 0 && elasticity <= 1)) {
            throw new IllegalArgumentException("elasticity must be in [0, 1]: " + elasticity);
        }
        this.elasticity = elasticity;
        return this;
    }

    public double getDistanceTol() {
        return distanceTol;
    }

    public void setDistanceTol(double distanceTol) {
        if (!(distanceTol > 0)) {
            throw new IllegalArgumentException("distance tolerance must be positive: " + distanceTol);
        }
        this.distanceTol = distanceTol;
    }

    public double getVelocityTol() {
        return velocityTol;
    }

    public void setVelocityTol(double velocityTol) {
        if (!(velocityTol > 0)) {
            throw new IllegalArgumentException("velocity tolerance must be positive: " + velocityTol);
        }
        this.velocityTol = velocityTol;
    }

    /**
     * Fraction of half the distance tolerance within which a collision is close enough to the target gap.
     */
    public double getAccuracy() {
        return accuracy;
    }

    public void setAccuracy(double accuracy) {
        if (!(accuracy > 0 && accuracy <= 1)) {
            throw new IllegalArgumentException("accuracy must be in (0, 1]: " + accuracy);
        }
        this.accuracy = accuracy;
    }

    /**
     * @return height at which the potential energy is zero, NaN when not set
     */
    public double getZeroEnergyLevel() {
        return zeroEnergyLevel;
    }

    public RigidBody setZeroEnergyLevel(double height) {
        this.zeroEnergyLevel = height;
        return this;
    }

    public int getVarsIndex() {
        return varsIndex;
    }

    public void setVarsIndex(int varsIndex) {
        this.varsIndex = varsIndex;
    }

    public void addNonCollide(Collection<? extends RigidBody> bodies) {
        for (var b : bodies) {
            if (b != this && !nonCollide.contains(b)) {
                nonCollide.add(b);
            }
        }
    }

    public void removeNonCollide(Collection<? extends RigidBody> bodies) {
        nonCollide.removeAll(bodies);
    }

    public List<RigidBody> getNonCollide() {
        return Collections.unmodifiableList(nonCollide);
    }

    public boolean doesNotCollide(RigidBody other) {
        return nonCollide.contains(other);
    }

    public DoubleRect getBoundsBody() {
        return new DoubleRect(getLeftBody(), getBottomBody(), getRightBody(), getTopBody());
    }

    public DoubleRect getBoundsWorld() {
        var vertexes = getVertexes();
        if (vertexes.isEmpty()) {
            return DoubleRect.EMPTY;
        }
        var first = bodyToWorld(vertexes.get(0).locBody());
        var rect = DoubleRect.make(first.x, first.y, first.x, first.y);
        for (var v : vertexes) {
            var p = bodyToWorld(v.locBody());
            rect = rect.unionPoint(p.x, p.y);
        }
        return rect;
    }

    /**
     * Remembers the current pose, used to see how vertices moved during a time step.
     */
    public void saveOldCoords() {
        oldCoords = new LocalCoords(cmBody, locWorld, sinAngle, cosAngle);
    }

    public LocalCoords getOldCoords() {
        return oldCoords;
    }

    public void eraseOldCoords() {
        oldCoords = null;
    }

    protected void clearMinHeight() {
    }

    protected void forgetPosition() {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", mass=" + Util.nf7(mass) + ", loc=" + locWorld
        + ", angle=" + Util.nf7(angle) + ", velocity=" + velocity + ", angularVelocity=" + Util.nf7(
        angularVelocity) + "}";
    }
}
