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

import com.hellblazer.impetus.common.Util;
import com.hellblazer.impetus.engine2d.collision.CollisionFinder;
import com.hellblazer.impetus.engine2d.collision.RigidBodyCollision;
import com.hellblazer.impetus.engine2d.force.CoordType;
import com.hellblazer.impetus.engine2d.force.Force;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;
import com.hellblazer.impetus.engine2d.geometry.Scrim;
import com.hellblazer.impetus.simulation.StepError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector2d;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Adds resting contact to {@link ImpulseSim}: bodies in contact are kept from interpenetrating by contact forces
 * that are just large enough to keep the acceleration at each contact non-negative. Joints are contacts whose
 * acceleration is held at exactly zero and whose force may pull as well as push.
 * <p>
 * During {@link #evaluate} the external forces are applied first, then contacts are found anew for the state being
 * evaluated. Penetrating collisions end the evaluation, and are returned for the caller to handle. Otherwise the
 * contacts are split into independent subsets and for each one the equation {@code a = A f + b} is set up and solved
 * by {@link ComputeForces}, where {@code A} tells how a unit force at one contact accelerates the gap at another and
 * {@code b} is the gap acceleration caused by everything else. The resulting forces go into the change vector.
 *
 * @author hal.hildebrand
 */
public class ContactSim extends ImpulseSim {

    private static final Logger log              = LoggerFactory.getLogger(ContactSim.class);
    private static final double CONTACT_FORCE_TOL = 1e-4;

    private final List<Connector> connectors         = new ArrayList<>();
    private final ComputeForces   computeForces;
    private       ExtraAccel      extraAccel         = ExtraAccel.VELOCITY_AND_DISTANCE_JOINTS;
    private       double          extraAccelTimeStep = 0.025;
    private       int             numContacts;

    public ContactSim() {
        computeForces = new ComputeForces("contact", random);
    }

    /**
     * Applies the tolerances, random seed and collision handling of the configuration.
     */
    public void configure(EngineConfig config) {
        setDistanceTol(config.distanceTol());
        setVelocityTol(config.velocityTol());
        setCollisionAccuracy(config.collisionAccuracy());
        setRandomSeed(config.randomSeed());
        setCollisionHandling(config.collisionHandling());
        setExtraAccel(config.extraAccel());
        setExtraAccelTimeStep(config.extraAccelTimeStep());
        if (!Double.isNaN(config.elasticity()) && !bodies.isEmpty()) {
            setElasticity(config.elasticity());
        }
        log.info("Configured contact sim: distanceTol={}, velocityTol={}, accuracy={}, seed={}, handling={}, "
                 + "extraAccel={}", config.distanceTol(), config.velocityTol(), config.collisionAccuracy(),
                 config.randomSeed(), config.collisionHandling(), config.extraAccel());
    }

    /**
     * Adds the connector at the end of the list. Connectors are aligned in list order.
     *
     * @throws IllegalArgumentException if a body of the connector has not been added, other than the scrim
     */
    public void addConnector(Connector connector) {
        if (connectors.contains(connector)) {
            return;
        }
        checkBody(connector.getBody1());
        checkBody(connector.getBody2());
        connectors.add(connector);
    }

    private void checkBody(RigidBody body) {
        if (!(body instanceof Scrim) && !bodies.contains(body)) {
            throw new IllegalArgumentException("body not yet added to simulation " + body.getName());
        }
    }

    public void addConnectors(List<? extends Connector> connectors) {
        connectors.forEach(this::addConnector);
    }

    public boolean removeConnector(Connector connector) {
        return connectors.remove(connector);
    }

    public List<Connector> getConnectors() {
        return new ArrayList<>(connectors);
    }

    /**
     * Aligns every connector, in the order they were added, then copies the resulting body positions into the
     * variables.
     */
    public void alignConnectors() {
        connectors.forEach(Connector::align);
        bodies.forEach(this::initializeFromBody);
    }

    @Override
    public void removeBody(RigidBody body) {
        super.removeBody(body);
        connectors.removeIf(c -> c.getBody1() == body || c.getBody2() == body);
    }

    @Override
    public void cleanSlate() {
        super.cleanSlate();
        connectors.clear();
    }

    @Override
    public void reset() {
        super.reset();
        alignConnectors();
    }

    @Override
    public void findCollisions(List<RigidBodyCollision> collisions, double[] vars, double stepSize) {
        super.findCollisions(collisions, vars, stepSize);
        double time = vars[getVarsList().timeIndex()];
        for (var connector : connectors) {
            connector.addCollision(collisions, time);
        }
    }

    @Override
    public Optional<StepError> evaluate(double[] vars, double[] change, double timeStep) {
        super.evaluate(vars, change, timeStep);
        var contacts = new ArrayList<RigidBodyCollision>();
        findCollisions(contacts, vars, timeStep);
        if (contacts.stream().anyMatch(RigidBodyCollision::illegalState)) {
            return Optional.of(StepError.collisions(contacts));
        }
        contacts.removeIf(c -> !c.contact());
        int maxContacts = 0;
        while (!contacts.isEmpty()) {
            var subset = CollisionFinder.subsetCollisions1(contacts);
            maxContacts = Math.max(maxContacts, subset.size());
            var error = calcContactForces(vars, change, subset);
            if (error.isPresent()) {
                return error;
            }
            if (subset.size() == contacts.size()) {
                break;
            }
            contacts.removeAll(subset);
        }
        numContacts = maxContacts;
        return Optional.empty();
    }

    private Optional<StepError> calcContactForces(double[] vars, double[] change, List<RigidBodyCollision> subset) {
        var A = calculateAMatrix(subset);
        var b = calculateBVector(subset, change, vars);
        int n = subset.size();
        var joint = new boolean[n];
        for (int i = 0; i < n; i++) {
            joint[i] = subset.get(i).bilateral();
        }
        var f = new double[n];
        double time = vars[getVarsList().timeIndex()];
        int error = computeForces.computeForces(A, f, b, joint, false, time, CONTACT_FORCE_TOL);
        if (error != ComputeForces.SUCCESS) {
            var accel = MatrixSolver.add(MatrixSolver.multiply(A, f), b);
            if (!ComputeForces.checkForceAccel(CONTACT_FORCE_TOL, f, accel, joint)) {
                return Optional.of(StepError.of(
                "compute forces failed at " + Util.nf7(time) + " error=" + error + " with " + n + " contacts"));
            }
            log.debug("Compute forces error {} at {} but within tolerance", error, Util.nf7(time));
        }
        for (int i = 0; i < n; i++) {
            applyContactForce(subset.get(i), f[i], change);
        }
        return Optional.empty();
    }

    /**
     * Entry (i, j) is the change in the gap acceleration at contact i from a unit force at contact j.
     */
    static double[][] calculateAMatrix(List<RigidBodyCollision> contacts) {
        int nc = contacts.size();
        var a = new double[nc][nc];
        for (int i = 0; i < nc; i++) {
            var ci = contacts.get(i);
            var body1 = ci.getPrimaryBody();
            var body2 = ci.getNormalBody();
            var r1 = ci.getU1();
            var r2 = ci.getU2();
            var ni = ci.getNormal();
            for (int j = 0; j < nc; j++) {
                var cj = contacts.get(j);
                var nj = cj.getNormal();
                var rj1 = cj.getU1();
                var rj2 = cj.getU2();
                double sum = 0;
                if (body1.isMoveable() && body1 == cj.getPrimaryBody()) {
                    sum += response(ni, body1, r1, nj, rj1);
                }
                if (body1.isMoveable() && body1 == cj.getNormalBody()) {
                    sum -= response(ni, body1, r1, nj, rj2);
                }
                if (body2.isMoveable() && body2 == cj.getPrimaryBody()) {
                    sum -= response(ni, body2, r2, nj, rj1);
                }
                if (body2.isMoveable() && body2 == cj.getNormalBody()) {
                    sum += response(ni, body2, r2, nj, rj2);
                }
                a[i][j] = sum;
            }
        }
        return a;
    }

    /**
     * Acceleration along normal ni of the body point at r, from a unit force along nj applied at rj.
     */
    private static double response(Vector2d ni, RigidBody body, Vector2d r, Vector2d nj, Vector2d rj) {
        double m = body.getMass();
        double moment = body.momentAboutCM();
        double rjCrossNj = rj.x * nj.y - rj.y * nj.x;
        return ni.x * (nj.x / m - r.y * rjCrossNj / moment) + ni.y * (nj.y / m + r.x * rjCrossNj / moment);
    }

    /**
     * The gap acceleration at each contact without contact forces: the extra acceleration term, the derivative of
     * the normal for curved or rotating normals, and the external and centripetal accelerations of both bodies.
     */
    private double[] calculateBVector(List<RigidBodyCollision> contacts, double[] change, double[] vars) {
        var b = new double[contacts.size()];
        for (int i = 0; i < b.length; i++) {
            var c = contacts.get(i);
            boolean fixedObj = !c.getPrimaryBody().isMoveable();
            boolean fixedNBody = !c.getNormalBody().isMoveable();
            int obj = fixedObj ? -1 : c.getPrimaryBody().getVarsIndex();
            int nobj = fixedNBody ? -1 : c.getNormalBody().getVarsIndex();
            var normal = c.getNormal();

            b[i] += extraAccel.extraAccel(c.getNormalVelocity(), c.distanceToHalfGap(), c.bilateral(),
                                          extraAccelTimeStep);

            double vx1 = fixedObj ? 0 : vars[obj + VX];
            double vy1 = fixedObj ? 0 : vars[obj + VY];
            double w1 = fixedObj ? 0 : vars[obj + VW];
            double vx2 = fixedNBody ? 0 : vars[nobj + VX];
            double vy2 = fixedNBody ? 0 : vars[nobj + VY];
            double w2 = fixedNBody ? 0 : vars[nobj + VW];
            var r1 = c.getU1();
            var r2 = c.getU2();
            double rx = r1.x;
            double ry = r1.y;
            double r2x = fixedNBody ? 0 : r2.x;
            double r2y = fixedNBody ? 0 : r2.y;

            if (!c.isNormalFixed()) {
                double npx;
                double npy;
                if (c.isBallNormal()) {
                    double radius = c.isBallObject() ? c.getRadius1() + c.getRadius2() : c.getRadius2();
                    npx = (vx1 - w1 * ry) / radius;
                    npy = (vy1 + w1 * rx) / radius;
                    if (!fixedNBody) {
                        npx -= (vx2 - w2 * r2y) / radius;
                        npy -= (vy2 + w2 * r2x) / radius;
                    }
                } else {
                    // the normal rotates with the normal body
                    npx = -w2 * normal.y;
                    npy = w2 * normal.x;
                    if (c.isBallObject() && !fixedNBody) {
                        b[i] += -c.getRadius1() * w2 * w2;
                    }
                }
                double v1x = fixedObj ? 0 : vx1 - w1 * ry;
                double v1y = fixedObj ? 0 : vy1 + w1 * rx;
                double v2x = fixedNBody ? 0 : vx2 - w2 * r2y;
                double v2y = fixedNBody ? 0 : vy2 + w2 * r2x;
                double factor = c.isBallNormal() ? 1 : 2;
                b[i] += factor * (npx * (v1x - v2x) + npy * (v1y - v2y));
            }
            if (!fixedObj) {
                b[i] += normal.x * (change[obj + VX] - change[obj + VW] * ry - w1 * w1 * rx);
                b[i] += normal.y * (change[obj + VY] + change[obj + VW] * rx - w1 * w1 * ry);
            }
            if (!fixedNBody) {
                b[i] -= normal.x * (change[nobj + VX] - change[nobj + VW] * r2y - w2 * w2 * r2x);
                b[i] -= normal.y * (change[nobj + VY] + change[nobj + VW] * r2x - w2 * w2 * r2y);
            }
            if (!Double.isFinite(b[i])) {
                throw new IllegalStateException("non-finite b vector entry for " + c);
            }
        }
        return b;
    }

    /**
     * Applies the contact force at the impact point: along the normal to the primary body and opposite to the
     * normal body. Forces on fixed bodies are skipped.
     */
    private void applyContactForce(RigidBodyCollision c, double f, double[] change) {
        c.setForce(f);
        if (f == 0) {
            return;
        }
        var normal = c.getNormal();
        var primary = c.getPrimaryBody();
        if (primary.isMoveable()) {
            var direction = new Vector2d(normal);
            direction.scale(f);
            applyForce(change, new Force("contact_force_" + primary.getName(), primary, c.getImpact1(),
                                         CoordType.WORLD, direction, CoordType.WORLD));
        }
        var normalBody = c.getNormalBody();
        if (normalBody.isMoveable()) {
            var direction = new Vector2d(normal);
            direction.scale(-f);
            var impact2 = c.getImpact2() != null ? c.getImpact2() : c.getImpact1();
            applyForce(change, new Force("contact_force_" + normalBody.getName(), normalBody, impact2,
                                         CoordType.WORLD, direction, CoordType.WORLD));
        }
    }

    public ExtraAccel getExtraAccel() {
        return extraAccel;
    }

    public void setExtraAccel(ExtraAccel extraAccel) {
        this.extraAccel = extraAccel;
    }

    public double getExtraAccelTimeStep() {
        return extraAccelTimeStep;
    }

    /**
     * Sets the time over which the extra acceleration removes velocity. Instability results when the solver's time
     * step exceeds twice this value with Runge-Kutta.
     */
    public void setExtraAccelTimeStep(double extraAccelTimeStep) {
        if (!(extraAccelTimeStep > 0)) {
            throw new IllegalArgumentException("extra accel time step must be positive: " + extraAccelTimeStep);
        }
        this.extraAccelTimeStep = extraAccelTimeStep;
    }

    /**
     * @return number of contacts in the largest interrelated subset found by the last evaluation
     */
    public int getNumContacts() {
        return numContacts;
    }

    public ComputeForces getComputeForces() {
        return computeForces;
    }
}
