/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.engine2d.sim;

import com.hellblazer.impetus.engine2d.collision.RigidBodyCollision;
import com.hellblazer.impetus.engine2d.force.GravityLaw;
import com.hellblazer.impetus.engine2d.geometry.Polygon;
import com.hellblazer.impetus.engine2d.geometry.Shapes;
import com.hellblazer.impetus.simulation.AdvanceException;
import com.hellblazer.impetus.simulation.CollisionAdvance;
import com.hellblazer.impetus.simulation.CollisionTotals;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.ArrayList;
import java.util.List;

import static com.hellblazer.impetus.engine2d.sim.EngineTestRig.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class ImpulseSimTest {

    private static Polygon ball(ImpulseSim sim, String name, double x, double vx) {
        var ball = Shapes.makeBall(0.5, name);
        ball.setPosition(new Point2d(x, 0), 0);
        ball.setVelocity(new Vector2d(vx, 0), 0);
        sim.addBody(ball);
        return ball;
    }

    @ParameterizedTest
    @EnumSource(CollisionHandling.class)
    void headOnCollisionSwapsVelocities(CollisionHandling handling) {
        var sim = new ImpulseSim();
        sim.setCollisionHandling(handling);
        var left = ball(sim, "left", -0.5025, 1);
        var right = ball(sim, "right", 0.5025, -1);
        sim.setElasticity(1.0);

        var collisions = new ArrayList<RigidBodyCollision>();
        sim.findCollisions(collisions, sim.getVarsList().getValues(), TIME_STEP);
        assertFalse(collisions.isEmpty());
        for (var c : collisions) {
            assertEquals(0.005, c.getDistance(), 1e-6);
            assertEquals(-2, c.getNormalVelocity(), 1e-9);
            assertFalse(c.contact());
            assertFalse(c.illegalState());
        }

        var totals = new CollisionTotals();
        assertTrue(sim.handleCollisions(collisions, totals));
        assertTrue(totals.getImpulses() > 0);
        assertEquals(-1, left.getVelocity().x, 1e-6);
        assertEquals(1, right.getVelocity().x, 1e-6);
        assertEquals(0, left.getAngularVelocity(), 1e-9);
        var vars = sim.getVarsList();
        assertEquals(-1, vars.getValue(left.getVarsIndex() + RigidBodySim.VX), 1e-6);
        assertEquals(1.0, sim.getEnergyInfo().total(), 1e-9);
    }

    @Test
    void inelasticCollisionLosesEnergy() {
        var sim = new ImpulseSim();
        var left = ball(sim, "left", -0.5025, 1);
        var right = ball(sim, "right", 0.5025, -1);
        sim.setElasticity(0.5);
        var collisions = new ArrayList<RigidBodyCollision>();
        sim.findCollisions(collisions, sim.getVarsList().getValues(), TIME_STEP);
        sim.handleCollisions(collisions, new CollisionTotals());
        assertEquals(-0.5, left.getVelocity().x, 1e-6);
        assertEquals(0.5, right.getVelocity().x, 1e-6);
        assertEquals(0.25, sim.getEnergyInfo().total(), 1e-9);
    }

    @Test
    void distantAndNonCollidingPairsIgnored() {
        var sim = new ImpulseSim();
        var a = ball(sim, "a", -5, 0);
        ball(sim, "b", 5, 0);
        var collisions = new ArrayList<RigidBodyCollision>();
        sim.findCollisions(collisions, sim.getVarsList().getValues(), TIME_STEP);
        assertTrue(collisions.isEmpty());

        var c = ball(sim, "c", -6.005, 0);
        c.addNonCollide(List.of(a));
        sim.findCollisions(collisions, sim.getVarsList().getValues(), TIME_STEP);
        assertTrue(collisions.isEmpty());
    }

    @Test
    void twoFixedBodiesNeverCollide() {
        var sim = new ImpulseSim();
        var floor = Shapes.makeWall(4, 1, "floor");
        sim.addBody(floor);
        var ceiling = Shapes.makeWall(4, 1, "ceiling");
        ceiling.setPosition(new Point2d(0, 1.005));
        sim.addBody(ceiling);
        var collisions = new ArrayList<RigidBodyCollision>();
        sim.findCollisions(collisions, sim.getVarsList().getValues(), TIME_STEP);
        assertTrue(collisions.isEmpty());
    }

    @Test
    void penetrationIsIllegal() {
        var sim = new ImpulseSim();
        var floor = Shapes.makeWall(4, 1, "floor");
        sim.addBody(floor);
        var block = Shapes.makeBlock(1, 1, "block");
        block.setPosition(new Point2d(0, 1.3));
        block.setVelocity(new Vector2d(0, -14));
        sim.addBody(block);
        sim.saveState();

        var vars = sim.getVarsList().getValues();
        vars[block.getVarsIndex() + RigidBodySim.Y] = 0.95;
        var collisions = new ArrayList<RigidBodyCollision>();
        sim.findCollisions(collisions, vars, TIME_STEP);
        assertFalse(collisions.isEmpty());
        assertTrue(collisions.stream().anyMatch(RigidBodyCollision::illegalState));
    }

    @Test
    void emptyCollisionListRejected() {
        var sim = new ImpulseSim();
        assertThrows(IllegalArgumentException.class, () -> sim.handleCollisions(List.of(), new CollisionTotals()));
        assertThrows(IllegalArgumentException.class, () -> sim.setCollisionAccuracy(0));
    }

    /**
     * Without contact forces a ball dropped on the floor bounces ever lower and faster until the advance gives up.
     */
    @Test
    void bouncingBallGetsStuck() {
        var sim = new ImpulseSim();
        var advance = new CollisionAdvance<RigidBodyCollision>(sim);
        var ball = Shapes.makeBall(0.5, "ball");
        ball.setPosition(new Point2d(0, 0), 0);
        sim.addBody(ball);
        var floor = Shapes.makeWall(10, 1, "floor");
        floor.setPosition(new Point2d(0, -2.5), 0);
        sim.addBody(floor);
        commonSetup(sim, advance, 0, 0.5);
        sim.getForceLaws().forEach(sim::removeForceLaw);
        ball.setZeroEnergyLevel(-2 + ball.getMinHeight());
        sim.addForceLaw(new GravityLaw(3.0, sim.getBodies()));
        sim.setElasticity(0.8);

        var e = assertThrows(AdvanceException.class, () -> runUntil(advance, 15));
        assertTrue(advance.getTime() < 15);
        assertNotNull(e.getKind());
        assertTrue(advance.getCollisionTotals().getCollisions() > 0);
    }
}
