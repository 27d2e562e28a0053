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

import com.hellblazer.impetus.engine2d.force.DampingLaw;
import com.hellblazer.impetus.engine2d.force.Force;
import com.hellblazer.impetus.engine2d.force.ForceLaw;
import com.hellblazer.impetus.engine2d.force.GravityLaw;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;
import com.hellblazer.impetus.engine2d.geometry.Scrim;
import com.hellblazer.impetus.simulation.EnergyInfo;
import com.hellblazer.impetus.simulation.EnergySystem;
import com.hellblazer.impetus.simulation.ODESim;
import com.hellblazer.impetus.simulation.StepError;
import com.hellblazer.impetus.simulation.VarsList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rigid bodies moving under the influence of force laws, without collisions. The state of each body occupies six
 * consecutive variables starting at its vars index: x, x velocity, y, y velocity, angle and angular velocity. The
 * first four variables are time and the computed kinetic, potential and total energy.
 * <p>
 * The variables are the authority for body position and velocity: bodies are moved to match them during
 * evaluation and by {@link #modifyObjects()}. After moving a body directly, call {@link #initializeFromBody} to
 * copy its state back.
 *
 * @author hal.hildebrand
 */
public class RigidBodySim implements ODESim, EnergySystem {

    public static final int X  = 0;
    public static final int VX = 1;
    public static final int Y  = 2;
    public static final int VY = 3;
    public static final int W  = 4;
    public static final int VW = 5;

    public static final  int KE_INDEX = 1;
    public static final  int PE_INDEX = 2;
    public static final  int TE_INDEX = 3;
    private static final int FIRST_BODY_INDEX = 4;

    private static final Logger log = LoggerFactory.getLogger(RigidBodySim.class);

    protected final List<RigidBody> bodies    = new ArrayList<>();
    protected final List<ForceLaw>  forceLaws = new ArrayList<>();
    private final   VarsList        varsList  = new VarsList();
    private         double          potentialOffset;
    private         double[]        savedState;
    private         double[]        initialState;

    public RigidBodySim() {
        varsList.addVariables("kinetic_energy", "potential_energy", "total_energy");
        varsList.setComputed(KE_INDEX, true);
        varsList.setComputed(PE_INDEX, true);
        varsList.setComputed(TE_INDEX, true);
    }

    /**
     * Adds the body, allocating its six variables and copying its current position and velocity into them. The
     * {@link Scrim} is never added.
     */
    public void addBody(RigidBody body) {
        if (body instanceof Scrim || bodies.contains(body)) {
            return;
        }
        var name = body.getName();
        int idx = varsList.addVariables(name + "_x", name + "_vx", name + "_y", name + "_vy", name + "_w",
                                        name + "_vw");
        body.setVarsIndex(idx);
        bodies.add(body);
        initializeFromBody(body);
        log.debug("Added body {} at vars index {}", name, idx);
    }

    public void removeBody(RigidBody body) {
        if (!bodies.remove(body)) {
            return;
        }
        varsList.deleteVariables(body.getVarsIndex(), 6);
        body.setVarsIndex(-1);
        varsList.incrSequence(KE_INDEX, PE_INDEX, TE_INDEX);
        log.debug("Removed body {}", body.getName());
    }

    public List<RigidBody> getBodies() {
        return new ArrayList<>(bodies);
    }

    /**
     * @throws IllegalArgumentException if no body has the given name
     */
    public RigidBody getBody(String name) {
        return bodies.stream()
                     .filter(b -> b.getName().equalsIgnoreCase(name))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException("no body named " + name));
    }

    /**
     * Adds the force law. Only one damping law and one gravity law may be present at a time.
     *
     * @throws IllegalArgumentException when adding a second damping or gravity law
     */
    public void addForceLaw(ForceLaw law) {
        if (forceLaws.contains(law)) {
            return;
        }
        for (var existing : forceLaws) {
            if (law instanceof DampingLaw && existing instanceof DampingLaw) {
                throw new IllegalArgumentException("a damping law is already present");
            }
            if (law instanceof GravityLaw && existing instanceof GravityLaw) {
                throw new IllegalArgumentException("a gravity law is already present");
            }
        }
        forceLaws.add(law);
        varsList.incrSequence(PE_INDEX, TE_INDEX);
    }

    public boolean removeForceLaw(ForceLaw law) {
        boolean removed = forceLaws.remove(law);
        if (removed) {
            varsList.incrSequence(PE_INDEX, TE_INDEX);
        }
        return removed;
    }

    public List<ForceLaw> getForceLaws() {
        return new ArrayList<>(forceLaws);
    }

    /**
     * Removes all bodies and force laws and resets time to zero.
     */
    public void cleanSlate() {
        int n = varsList.numVariables();
        if (n > FIRST_BODY_INDEX) {
            varsList.deleteVariables(FIRST_BODY_INDEX, n - FIRST_BODY_INDEX);
        }
        varsList.setTime(0);
        bodies.forEach(b -> b.setVarsIndex(-1));
        bodies.clear();
        forceLaws.clear();
        potentialOffset = 0;
        savedState = null;
        initialState = null;
    }

    /**
     * Copies the position and velocity of the body into the variables.
     */
    public void initializeFromBody(RigidBody body) {
        body.eraseOldCoords();
        int idx = body.getVarsIndex();
        if (idx < 0) {
            throw new IllegalArgumentException("unknown body " + body.getName());
        }
        var position = body.getPosition();
        var velocity = body.getVelocity();
        varsList.setValue(idx + X, position.x, false);
        varsList.setValue(idx + Y, position.y, false);
        varsList.setValue(idx + W, body.getAngle(), false);
        varsList.setValue(idx + VX, velocity.x, false);
        varsList.setValue(idx + VY, velocity.y, false);
        varsList.setValue(idx + VW, body.getAngularVelocity(), false);
        varsList.incrSequence(KE_INDEX, PE_INDEX, TE_INDEX);
    }

    @Override
    public VarsList getVarsList() {
        return varsList;
    }

    @Override
    public Optional<StepError> evaluate(double[] vars, double[] change, double timeStep) {
        moveObjects(vars);
        for (var body : bodies) {
            int idx = body.getVarsIndex();
            if (idx < 0) {
                continue;
            }
            if (!body.isMoveable()) {
                for (int k = 0; k < 6; k++) {
                    change[idx + k] = 0;
                }
                continue;
            }
            change[idx + X] = vars[idx + VX];
            change[idx + Y] = vars[idx + VY];
            change[idx + W] = vars[idx + VW];
            change[idx + VX] = 0;
            change[idx + VY] = 0;
            change[idx + VW] = 0;
        }
        for (var law : forceLaws) {
            for (var force : law.calculateForces()) {
                applyForce(change, force);
            }
        }
        change[varsList.timeIndex()] = 1;
        return Optional.empty();
    }

    /**
     * Adds the acceleration caused by the force to the change vector: linear {@code F/m} and angular
     * {@code (r x F + torque)/I} where r runs from the center of mass to the point of application.
     */
    protected void applyForce(double[] change, Force force) {
        var body = force.getBody();
        int idx = body.getVarsIndex();
        if (idx < 0 || !body.isMoveable() || !bodies.contains(body)) {
            return;
        }
        double mass = body.getMass();
        var f = force.getVector();
        change[idx + VX] += f.x / mass;
        change[idx + VY] += f.y / mass;
        change[idx + VW] += force.torqueAboutCM() / body.momentAboutCM();
    }

    /**
     * Moves the bodies to the position and velocity given by the variables.
     */
    public void moveObjects(double[] vars) {
        for (var body : bodies) {
            int idx = body.getVarsIndex();
            if (idx < 0) {
                continue;
            }
            body.setPosition(new Point2d(vars[idx + X], vars[idx + Y]), vars[idx + W]);
            body.setVelocity(new Vector2d(vars[idx + VX], vars[idx + VY]), vars[idx + VW]);
        }
    }

    @Override
    public void modifyObjects() {
        moveObjects(varsList.getValues());
        var info = getEnergyInfo();
        varsList.setValue(KE_INDEX, info.kinetic(), true);
        varsList.setValue(PE_INDEX, info.potential(), true);
        varsList.setValue(TE_INDEX, info.total(), true);
    }

    @Override
    public EnergyInfo getEnergyInfo() {
        double translational = 0;
        double rotational = 0;
        for (var body : bodies) {
            if (body.isMoveable()) {
                translational += body.translationalEnergy();
                rotational += body.rotationalEnergy();
            }
        }
        return new EnergyInfo(lawPotentialEnergy() + potentialOffset, translational, rotational);
    }

    @Override
    public void setPotentialEnergy(double value) {
        potentialOffset = 0;
        potentialOffset = value - getEnergyInfo().potential();
    }

    public double getPEOffset() {
        return potentialOffset;
    }

    public void setPEOffset(double offset) {
        potentialOffset = offset;
        varsList.incrSequence(PE_INDEX, TE_INDEX);
    }

    /**
     * Sets the elasticity of every body.
     *
     * @throws IllegalStateException if there are no bodies
     */
    public void setElasticity(double elasticity) {
        if (bodies.isEmpty()) {
            throw new IllegalStateException("setElasticity: no bodies");
        }
        bodies.forEach(b -> b.setElasticity(elasticity));
    }

    /**
     * Saves the variables and the current coordinates of each body, which collision detection uses as the start of
     * the step.
     */
    @Override
    public void saveState() {
        savedState = varsList.getValues();
        bodies.forEach(RigidBody::saveOldCoords);
    }

    @Override
    public void restoreState() {
        if (savedState != null) {
            varsList.setValues(savedState, true);
        }
        bodies.forEach(RigidBody::eraseOldCoords);
    }

    @Override
    public void reset() {
        if (initialState != null && initialState.length == varsList.numVariables()) {
            varsList.setValues(initialState, false);
        }
        bodies.forEach(RigidBody::eraseOldCoords);
        modifyObjects();
    }

    @Override
    public void saveInitialState() {
        initialState = varsList.getValues();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{bodies=" + bodies.size() + ", forceLaws=" + forceLaws.size()
        + ", potentialOffset=" + potentialOffset + '}';
    }

    private double lawPotentialEnergy() {
        double pe = 0;
        for (var law : forceLaws) {
            pe += law.getPotentialEnergy();
        }
        return pe;
    }
}
