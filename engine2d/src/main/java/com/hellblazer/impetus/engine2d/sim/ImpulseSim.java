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
package com.hellblazer.impetus.engine2d.sim;

import com.hellblazer.impetus.common.RandomLCG;
import com.hellblazer.impetus.common.Util;
import com.hellblazer.impetus.engine2d.collision.CollisionFinder;
import com.hellblazer.impetus.engine2d.collision.RigidBodyCollision;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;
import com.hellblazer.impetus.simulation.AdvanceException;
import com.hellblazer.impetus.simulation.CollisionSim;
import com.hellblazer.impetus.simulation.CollisionTotals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector2d;
import java.util.Arrays;
import java.util.List;

/**
 * Rigid bodies that collide, with collisions resolved by instantaneous impulses. Each impulse is found so that the
 * bodies separate at the combined elasticity times their approach velocity; simultaneous collisions are resolved as
 * configured by {@link CollisionHandling}.
 *
 * @author hal.hildebrand
 */
public class ImpulseSim extends RigidBodySim implements CollisionSim<RigidBodyCollision> {

    /**
     * Impulses smaller than this are not counted as a change in energy.
     */
    public static final double TINY_IMPULSE = 1e-12;

    private static final Logger log                = LoggerFactory.getLogger(ImpulseSim.class);
    private static final double SMALL_IMPULSE      = 1e-4;
    private static final double SMALL_VELOCITY     = 1e-5;
    private static final double IMPULSE_CHECK_TOL  = 1e-4;
    private static final double NEGATIVE_IMPULSE   = -1e-12;

    protected final RandomLCG         random;
    private final   ComputeForces     computeImpacts;
    private         CollisionHandling collisionHandling = CollisionHandling.SERIAL_GROUPED_LASTPASS;
    private         double            distanceTol       = 0.01;
    private         double            velocityTol       = 0.5;
    private         double            collisionAccuracy = 0.6;
    private         boolean           proximityTest     = true;

    public ImpulseSim() {
        random = new RandomLCG(0);
        computeImpacts = new ComputeForces("impulse", random);
    }

    /**
     * Adds the body and sets its tolerances to those of this simulation.
     */
    @Override
    public void addBody(RigidBody body) {
        super.addBody(body);
        body.setDistanceTol(distanceTol);
        body.setVelocityTol(velocityTol);
        body.setAccuracy(collisionAccuracy);
    }

    @Override
    public void findCollisions(List<RigidBodyCollision> collisions, double[] vars, double stepSize) {
        moveObjects(vars);
        double time = vars[getVarsList().timeIndex()];
        for (int i = 0; i < bodies.size(); i++) {
            var body1 = bodies.get(i);
            for (int j = i + 1; j < bodies.size(); j++) {
                var body2 = bodies.get(j);
                if (body1.doesNotCollide(body2) || body2.doesNotCollide(body1)) {
                    continue;
                }
                if (!body1.isMoveable() && !body2.isMoveable()) {
                    continue;
                }
                if (!isSpeeding(body1, body2, stepSize) && !CollisionFinder.intersectionPossible(body1, body2,
                                                                                                  distanceTol)) {
                    continue;
                }
                body1.checkCollision(collisions, body2, time);
            }
        }
    }

    /**
     * Whether the bodies move fast enough to pass through each other within the step, in which case the bounding
     * rectangle test can't rule out a collision.
     */
    private boolean isSpeeding(RigidBody body1, RigidBody body2, double stepSize) {
        if (!proximityTest || !(stepSize > 0)) {
            return true;
        }
        double speedLimit = 2 * (body1.getMinHeight() + body2.getMinHeight()) / stepSize;
        return cheapLength(body1.getVelocity()) + cheapLength(body2.getVelocity()) > speedLimit;
    }

    private static double cheapLength(Vector2d v) {
        return Math.abs(v.x) + Math.abs(v.y);
    }

    /**
     * @throws IllegalArgumentException if the list is empty
     * @throws AdvanceException         if the impulses could not be solved
     */
    @Override
    public boolean handleCollisions(List<RigidBodyCollision> collisions, CollisionTotals totals) {
        if (collisions.isEmpty()) {
            throw new IllegalArgumentException("empty collision list");
        }
        if (collisionHandling == CollisionHandling.SIMULTANEOUS) {
            return handleCollisionsSimultaneous(collisions, totals);
        }
        return handleCollisionsSerial(collisions, totals, collisionHandling.isHybrid(),
                                      collisionHandling.isGrouped(), collisionHandling.isLastPass());
    }

    private boolean handleCollisionsSimultaneous(List<RigidBodyCollision> collisions, CollisionTotals totals) {
        int n = collisions.size();
        var b = new double[n];
        var j = new double[n];
        var joint = new boolean[n];
        boolean nonJoint = false;
        for (int i = 0; i < n; i++) {
            var c = collisions.get(i);
            joint[i] = c.bilateral();
            nonJoint |= !joint[i];
            double nv = c.getNormalVelocity();
            b[i] = c.contact() ? nv : (1 + c.getElasticity()) * nv;
        }
        var A = makeCollisionMatrix(collisions);
        solve(A, j, b, joint);
        boolean impulse = false;
        for (int i = 0; i < n; i++) {
            impulse |= j[i] > TINY_IMPULSE;
            applyCollisionImpulse(collisions.get(i), j[i]);
        }
        if (nonJoint && impulse) {
            getVarsList().incrSequence(KE_INDEX, TE_INDEX);
        }
        modifyObjects();
        totals.addImpulses(1);
        return impulse;
    }

    /**
     * Treats one focus collision at a time until every collision is separating or has a tiny normal velocity. The
     * normal velocities are tracked in {@code b} using the collision matrix, and impulses accumulate in {@code j2}
     * before being applied to the bodies at the end.
     */
    private boolean handleCollisionsSerial(List<RigidBodyCollision> collisions, CollisionTotals totals,
                                           boolean hybrid, boolean grouped, boolean lastPass) {
        int n = collisions.size();
        double smallVelocity = SMALL_VELOCITY;
        final int panicLimit = 20 * n;
        int loopPanic = panicLimit;
        var e = new double[n];
        var b = new double[n];
        var j2 = new double[n];
        var joint = new boolean[n];
        boolean nonJoint = false;
        for (int i = 0; i < n; i++) {
            var c = collisions.get(i);
            joint[i] = c.bilateral();
            e[i] = grouped && joint[i] ? 0 : c.getElasticity();
            b[i] = c.getNormalVelocity();
            nonJoint |= !joint[i];
        }
        var A = makeCollisionMatrix(collisions);
        int loopCtr = 0;
        int focus;
        do {
            loopCtr++;
            if (loopCtr > loopPanic) {
                smallVelocity *= 2;
                loopPanic += panicLimit;
                log.debug("Serial collision handling slow at {}: {} loops, small velocity now {}",
                          Util.nf7(getTime()), loopCtr, Util.nfe(smallVelocity));
            }
            focus = pickFocus(smallVelocity, joint, b);
            if (focus == -1 && !lastPass) {
                break;
            }
            handleFocus(hybrid, grouped, smallVelocity, focus, joint, e, b, j2, collisions, A);
            totals.addImpulses(1);
        } while (focus > -1);

        boolean impulse = false;
        for (int i = 0; i < n; i++) {
            impulse |= j2[i] > TINY_IMPULSE;
            applyCollisionImpulse(collisions.get(i), j2[i]);
        }
        if (nonJoint && impulse) {
            getVarsList().incrSequence(KE_INDEX, TE_INDEX);
        }
        modifyObjects();
        return impulse;
    }

    /**
     * @return a random collision whose velocity is not small, or -1
     */
    private int pickFocus(double smallVelocity, boolean[] joint, double[] b) {
        for (int k : random.randomInts(b.length)) {
            if (!joint[k] && b[k] < -smallVelocity || joint[k] && Math.abs(b[k]) > smallVelocity) {
                return k;
            }
        }
        return -1;
    }

    /**
     * Solves the impulses for the focus collision and those grouped with it, accumulating them into {@code j2} and
     * updating the velocities {@code b}. A focus of -1 means all collisions at zero elasticity.
     */
    private void handleFocus(boolean hybrid, boolean grouped, double smallVelocity, int focus, boolean[] joint,
                             double[] e, double[] b, double[] j2, List<RigidBodyCollision> collisions,
                             double[][] A) {
        int n = b.length;
        var set = new boolean[n];
        if (focus == -1) {
            Arrays.fill(set, true);
        } else if (hybrid || grouped) {
            for (var c : CollisionFinder.subsetCollisions2(collisions, collisions.get(focus), hybrid, b,
                                                           -smallVelocity)) {
                set[collisions.indexOf(c)] = true;
            }
        } else {
            set[focus] = true;
        }
        var idx = new int[n];
        int n1 = 0;
        for (int k = 0; k < n; k++) {
            idx[k] = set[k] ? n1++ : -1;
        }
        var A1 = new double[n1][n1];
        var b1 = new double[n1];
        var joint1 = new boolean[n1];
        var j1 = new double[n1];
        for (int i = 0; i < n; i++) {
            if (!set[i]) {
                continue;
            }
            b1[idx[i]] = focus != -1 ? b[i] * (1 + e[i]) : b[i];
            joint1[idx[i]] = joint[i];
            for (int j = 0; j < n; j++) {
                if (set[j]) {
                    A1[idx[i]][idx[j]] = A[i][j];
                }
            }
        }
        solve(A1, j1, b1, joint1);
        for (int i = 0; i < n; i++) {
            if (set[i]) {
                j2[i] += j1[idx[i]];
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (set[j]) {
                    b[i] += A[i][j] * j1[idx[j]];
                }
            }
        }
    }

    private void solve(double[][] A, double[] j, double[] b, boolean[] joint) {
        int error = computeImpacts.computeForces(A, j, b, joint, false, getTime());
        if (error != ComputeForces.SUCCESS) {
            var accel = MatrixSolver.add(MatrixSolver.multiply(A, j), b);
            if (!ComputeForces.checkForceAccel(IMPULSE_CHECK_TOL, j, accel, joint)) {
                throw new AdvanceException(AdvanceException.Kind.COLLISION_FAILED, getTime(),
                                           "compute impulses failed, error=" + error + " with tolerance "
                                           + Util.nfe(IMPULSE_CHECK_TOL));
            }
            log.debug("Compute impulses error {} at {} but within tolerance", error, Util.nf7(getTime()));
        }
    }

    /**
     * Builds the matrix whose entry (i, k) is the change in normal velocity at collision i from a unit impulse at
     * collision k.
     */
    protected double[][] makeCollisionMatrix(List<RigidBodyCollision> collisions) {
        int n = collisions.size();
        var A = new double[n][n];
        for (int i = 0; i < n; i++) {
            var ci = collisions.get(i);
            for (int k = 0; k < n; k++) {
                var ck = collisions.get(k);
                A[i][k] = influence(ci, ck, ci.getPrimaryBody()) - influence(ci, ck, ci.getNormalBody());
            }
        }
        return A;
    }

    /**
     * How much a unit impulse at collision cj changes the velocity of the body at the impact point of collision ci,
     * projected onto the normal of ci.
     */
    private static double influence(RigidBodyCollision ci, RigidBodyCollision cj, RigidBody body) {
        if (!body.isMoveable()) {
            return 0;
        }
        Vector2d ri;
        if (body == ci.getPrimaryBody()) {
            ri = ci.getR1();
        } else if (body == ci.getNormalBody()) {
            ri = ci.getR2();
        } else {
            return 0;
        }
        Vector2d rj;
        double factor;
        if (body == cj.getPrimaryBody()) {
            rj = cj.getR1();
            factor = 1;
        } else if (body == cj.getNormalBody()) {
            rj = cj.getR2();
            factor = -1;
        } else {
            return 0;
        }
        var ni = ci.getNormal();
        var nj = cj.getNormal();
        double mass = body.getMass();
        double moment = body.momentAboutCM();
        double rjCrossNj = rj.x * nj.y - rj.y * nj.x;
        return factor * (ni.x * (nj.x / mass - ri.y * rjCrossNj / moment) + ni.y * (nj.y / mass
                                                                                   + ri.x * rjCrossNj / moment));
    }

    /**
     * Applies the impulse along the normal, positive to the primary body and negative to the normal body.
     *
     * @throws AdvanceException if a non-joint impulse is negative
     */
    private void applyCollisionImpulse(RigidBodyCollision c, double j) {
        if (!c.bilateral() && j < 0) {
            if (j < NEGATIVE_IMPULSE) {
                throw new AdvanceException(AdvanceException.Kind.COLLISION_FAILED, getTime(),
                                           "negative impulse " + Util.nfe(j) + " on " + c);
            }
            j = 0;
        }
        c.setImpulse(j);
        if (j == 0) {
            return;
        }
        var normal = c.getNormal();
        applyImpulse(c.getPrimaryBody(), j, normal, c.getR1());
        applyImpulse(c.getNormalBody(), -j, normal, c.getR2());
    }

    private void applyImpulse(RigidBody body, double j, Vector2d normal, Vector2d r) {
        int idx = body.getVarsIndex();
        if (!body.isMoveable() || idx < 0) {
            return;
        }
        boolean continuous = Math.abs(j) < SMALL_IMPULSE;
        double mass = body.getMass();
        var vars = getVarsList();
        vars.setValue(idx + VX, vars.getValue(idx + VX) + normal.x * j / mass, continuous);
        vars.setValue(idx + VY, vars.getValue(idx + VY) + normal.y * j / mass, continuous);
        vars.setValue(idx + VW, vars.getValue(idx + VW) + j * (r.x * normal.y - r.y * normal.x)
                                                          / body.momentAboutCM(), continuous);
    }

    public CollisionHandling getCollisionHandling() {
        return collisionHandling;
    }

    public void setCollisionHandling(CollisionHandling collisionHandling) {
        this.collisionHandling = collisionHandling;
    }

    public double getDistanceTol() {
        return distanceTol;
    }

    public void setDistanceTol(double distanceTol) {
        this.distanceTol = distanceTol;
        bodies.forEach(b -> b.setDistanceTol(distanceTol));
    }

    public double getVelocityTol() {
        return velocityTol;
    }

    public void setVelocityTol(double velocityTol) {
        this.velocityTol = velocityTol;
        bodies.forEach(b -> b.setVelocityTol(velocityTol));
    }

    public double getCollisionAccuracy() {
        return collisionAccuracy;
    }

    /**
     * @throws IllegalArgumentException unless the accuracy is in (0, 1]
     */
    public void setCollisionAccuracy(double collisionAccuracy) {
        if (!(collisionAccuracy > 0 && collisionAccuracy <= 1)) {
            throw new IllegalArgumentException("accuracy must be in (0, 1]: " + collisionAccuracy);
        }
        this.collisionAccuracy = collisionAccuracy;
        bodies.forEach(b -> b.setAccuracy(collisionAccuracy));
    }

    public boolean isProximityTest() {
        return proximityTest;
    }

    /**
     * Enables the bounding rectangle test that skips pairs of bodies far apart.
     */
    public void setProximityTest(boolean proximityTest) {
        this.proximityTest = proximityTest;
    }

    public long getRandomSeed() {
        return random.getSeed();
    }

    public void setRandomSeed(long seed) {
        random.setSeed(seed);
    }
}
