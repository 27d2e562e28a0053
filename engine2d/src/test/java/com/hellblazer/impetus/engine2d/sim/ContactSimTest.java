/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.engine2d.sim;

import com.hellblazer.impetus.engine2d.collision.RigidBodyCollision;
import com.hellblazer.impetus.engine2d.force.CoordType;
import com.hellblazer.impetus.engine2d.force.GravityLaw;
import com.hellblazer.impetus.engine2d.geometry.Polygon;
import com.hellblazer.impetus.engine2d.geometry.Shapes;
import com.hellblazer.impetus.simulation.CollisionAdvance;
import com.hellblazer.impetus.simulation.CollisionAdvance.AdvanceConfig;
import com.hellblazer.impetus.simulation.RungeKutta;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.ArrayList;

import static com.hellblazer.impetus.engine2d.sim.EngineTestRig.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Scenarios run through {@link CollisionAdvance} with contact forces.
 *
 * @author hal.hildebrand
 */
class ContactSimTest {

    private static final double VARS_TOL   = 1e-5;
    private static final double ENERGY_TOL = 1e-5;

    /**
     * A ball with an offset center of mass strikes the corner of a free block.
     */
    private static CollisionAdvance<RigidBodyCollision> ballBlock(ContactSim sim) {
        var advance = new CollisionAdvance<>(sim);
        var ball = Shapes.makeBall(0.75, "ball");
        ball.setCenterOfMass(0, 0.2);
        ball.setPosition(new Point2d(-2, 2), 0);
        ball.setVelocity(new Vector2d(1, -1), 1);
        sim.addBody(ball);
        var block = Shapes.makeBlock(1, 1, "block");
        block.setPosition(new Point2d(0, 0), 0);
        sim.addBody(block);
        commonSetup(sim, advance, 0, 0.5);
        sim.setElasticity(1.0);
        return advance;
    }

    @Test
    void ballStrikesBlock() {
        var sim = new ContactSim();
        var advance = ballBlock(sim);
        runUntil(advance, 0);
        double energy = sim.getEnergyInfo().total();

        runUntil(advance, 3.0);

        assertEquals(3.0, sim.getVarsList().getTime(), 1e-6);
        assertEquals(energy, sim.getEnergyInfo().total(), ENERGY_TOL);
        var ball = sim.getBody("ball");
        var block = sim.getBody("block");
        var momentum = new Vector2d(ball.getVelocity());
        momentum.scaleAdd(block.getMass(), block.getVelocity(), momentum);
        assertEquals(1, momentum.x, 1e-6);
        assertEquals(-1, momentum.y, 1e-6);
        assertTrue(advance.getCollisionTotals().getCollisions() > 0);

        assertBody(sim, ball, new double[] { -1.135972, 0.0179439, 1.1812653, 0.0028806, 3.1087039, 1.0499788 },
                   VARS_TOL);
        assertBody(sim, block, new double[] { 2.135972, 0.9820561, -2.1812653, -1.0028806, 0.1358799, 0.0624735 },
                   VARS_TOL);
    }

    @Test
    void sameSeedSameResult() {
        var sim1 = new ContactSim();
        var advance1 = ballBlock(sim1);
        var sim2 = new ContactSim();
        var advance2 = ballBlock(sim2);
        runUntil(advance1, 1.5);
        runUntil(advance2, 1.5);
        assertArrayEquals(sim1.getVarsList().getValues(), sim2.getVarsList().getValues());
        var totals1 = advance1.getCollisionTotals();
        var totals2 = advance2.getCollisionTotals();
        assertEquals(totals1.getCollisions(), totals2.getCollisions());
        assertEquals(totals1.getSteps(), totals2.getSteps());
        assertEquals(totals1.getBackups(), totals2.getBackups());
        assertEquals(totals1.getImpulses(), totals2.getImpulses());
        assertEquals(totals1.getSearches(), totals2.getSearches());
        assertEquals(totals1.toString(), totals2.toString());
    }

    @Test
    void timeOnlyMovesForward() {
        var sim = new ContactSim();
        var advance = ballBlock(sim);
        double last = advance.getTime();
        for (int i = 1; i <= 60; i++) {
            advance.advance(TIME_STEP);
            double now = advance.getTime();
            assertTrue(now > last, "time went from " + last + " to " + now);
            assertEquals(i * TIME_STEP, now, 1e-9);
            last = now;
        }
    }

    @Test
    void ballRestsOnFloor() {
        var sim = new ContactSim();
        var advance = new CollisionAdvance<>(sim);
        var ball = Shapes.makeBall(0.5, "ball");
        double floorTop = -2;
        ball.setPosition(new Point2d(0, floorTop + 0.5 + 0.005), 0);
        sim.addBody(ball);
        var floor = Shapes.makeWall(10, 1, "floor");
        floor.setPosition(new Point2d(0, floorTop - 0.5), 0);
        sim.addBody(floor);
        commonSetup(sim, advance, 0, 0.5);
        sim.setExtraAccel(ExtraAccel.VELOCITY_AND_DISTANCE);
        sim.addForceLaw(new GravityLaw(3.0, sim.getBodies()));
        sim.setElasticity(0.8);

        runUntil(advance, 2.0);

        double gap = ball.getPosition().y - 0.5 - floorTop;
        assertTrue(gap > 0 && gap < sim.getDistanceTol(), "gap " + gap);
        assertEquals(0, ball.getVelocity().y, 0.05);
        assertTrue(sim.getNumContacts() > 0);

        var collisions = new ArrayList<RigidBodyCollision>();
        sim.findCollisions(collisions, sim.getVarsList().getValues(), TIME_STEP);
        assertFalse(collisions.isEmpty());
        for (var c : collisions) {
            assertTrue(c.contact(), "not a contact " + c);
            assertFalse(c.illegalState());
            assertFalse(c.isColliding());
        }
    }

    /**
     * A 1 x 5 block hanging at an angle from a fixed point by a double joint, swinging under gravity.
     */
    private static CollisionAdvance<RigidBodyCollision> pendulum(ContactSim sim, ExtraAccel extraAccel) {
        var advance = new CollisionAdvance<>(sim);
        var pendulum = Shapes.makeBlock(1.0, 5.0, "pendulum");
        pendulum.setPosition(new Point2d(0, -2), Math.PI / 3);
        sim.addBody(pendulum);
        commonSetup(sim, advance, 0, 0.15);
        sim.setExtraAccel(extraAccel);
        advance.configure(AdvanceConfig.defaultConfig().withTimeStep(TIME_STEP).withJointSmallImpacts(true));

        var joints = JointUtil.addDoubleFixedJoint(sim, pendulum, new Point2d(0, 2), new Point2d(0, 0));
        assertEquals(2, joints.size());
        assertEquals(joints, sim.getConnectors());
        assertTightJoints(sim, 1e-9);
        sim.addForceLaw(new GravityLaw(5.0, sim.getBodies()));
        return advance;
    }

    @Test
    void pendulumJointStaysTight() {
        var sim = new ContactSim();
        var advance = pendulum(sim, ExtraAccel.NONE);
        var pendulum = sim.getBody("pendulum");

        runUntil(advance, 0);
        double energy = sim.getEnergyInfo().total();
        runUntil(advance, 8.0);

        assertEquals(8.0, sim.getVarsList().getTime(), 1e-6);
        assertBody(sim, pendulum,
                   new double[] { -1.7297436, 0.0807141, -1.0039856, -0.1390604, -1.0448949, 0.0803936 }, VARS_TOL);
        assertEquals(energy, sim.getEnergyInfo().total(), ENERGY_TOL);
        assertTightJoints(sim, 1e-6);
        // the attach point has not moved
        var attach = pendulum.bodyToWorld(new Point2d(0, 2));
        assertEquals(0, attach.x, 1e-5);
        assertEquals(0, attach.y, 1e-5);
    }

    @Test
    void pendulumConservesEnergyOverLongRun() {
        var sim = new ContactSim();
        var advance = pendulum(sim, ExtraAccel.VELOCITY_AND_DISTANCE_JOINTS);

        runUntil(advance, 0);
        double energy = sim.getEnergyInfo().total();
        runUntil(advance, 30.0);

        assertEquals(30.0, sim.getVarsList().getTime(), 1e-6);
        assertEquals(energy, sim.getEnergyInfo().total(), 1e-4);
        assertTightJoints(sim, 1e-3);
    }

    @Test
    void removingBodyRemovesItsJoints() {
        var sim = new ContactSim();
        var a = Shapes.makeBlock(1, 1, "a");
        var b = Shapes.makeBlock(1, 1, "b");
        b.setPosition(new Point2d(2, 0));
        sim.addBody(a);
        sim.addBody(b);
        var joints = JointUtil.attachRigidBody(sim, a, new Point2d(0.5, 0), b, new Point2d(-0.5, 0),
                                               CoordType.BODY);
        assertEquals(2, sim.getConnectors().size());
        assertEquals(1, b.getPosition().x, 1e-12);
        assertTrue(a.doesNotCollide(b));

        sim.removeBody(b);
        assertTrue(sim.getConnectors().isEmpty());
        assertFalse(sim.removeConnector(joints.get(0)));
    }

    @Test
    void connectorBodiesMustBeInSimulation() {
        var sim = new ContactSim();
        var a = Shapes.makeBlock(1, 1, "a");
        assertThrows(IllegalArgumentException.class,
                     () -> JointUtil.addDoubleFixedJoint(sim, a, new Point2d(0, 0), new Point2d(0, 0)));
    }

    @Test
    void configureAppliesSettings() {
        var sim = new ContactSim();
        Polygon ball = Shapes.makeBall(0.5, "ball");
        sim.addBody(ball);
        var config = EngineConfig.defaultConfig()
                                 .withExtraAccel(ExtraAccel.VELOCITY)
                                 .withElasticity(0.3)
                                 .withRandomSeed(42);
        sim.configure(config);
        assertEquals(ExtraAccel.VELOCITY, sim.getExtraAccel());
        assertEquals(0.3, ball.getElasticity(), 1e-12);
        assertEquals(42L, sim.getRandomSeed());
        assertEquals(CollisionHandling.SERIAL_GROUPED_LASTPASS, sim.getCollisionHandling());
        assertThrows(IllegalArgumentException.class, () -> sim.setExtraAccelTimeStep(0));

        var advance = new CollisionAdvance<>(sim, new RungeKutta(sim));
        advance.configure(config.advanceConfig());
        assertEquals(config.timeStep(), advance.getTimeStep(), 1e-12);
    }
}
