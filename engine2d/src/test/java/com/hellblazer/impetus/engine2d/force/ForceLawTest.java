/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.engine2d.force;

import com.hellblazer.impetus.engine2d.geometry.Scrim;
import com.hellblazer.impetus.engine2d.geometry.Shapes;
import com.hellblazer.impetus.engine2d.sim.RigidBodySim;
import com.hellblazer.impetus.simulation.RungeKutta;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class ForceLawTest {

    private static final double TOL = 1e-9;

    @Test
    void torqueAboutCenterOfMass() {
        var block = Shapes.makeBlock(2, 2, "block");
        block.setPosition(new Point2d(5, 5), 0);
        var f = new Force("push", block, new Point2d(1, 0), CoordType.BODY, new Vector2d(0, 2), CoordType.WORLD, 0.5);
        assertEquals(new Point2d(6, 5), f.getStartPoint());
        assertEquals(2.5, f.torqueAboutCM(), TOL);

        block.setPosition(new Point2d(5, 5), Math.PI / 2);
        var g = new Force("turn", block, new Point2d(1, 0), CoordType.BODY, new Vector2d(1, 0), CoordType.BODY);
        var v = g.getVector();
        assertEquals(0, v.x, TOL);
        assertEquals(1, v.y, TOL);
        // force along the radius has no torque
        assertEquals(0, g.torqueAboutCM(), TOL);
    }

    @Test
    void gravity() {
        var ball = Shapes.makeBall(0.5, "ball");
        ball.setMass(2);
        ball.setPosition(new Point2d(0, 3));
        var wall = Shapes.makeWall(4, 1, "wall");
        var law = new GravityLaw(9.8, List.of(ball, wall));
        assertEquals(List.of(ball), law.getBodies());

        var forces = law.calculateForces();
        assertEquals(1, forces.size());
        assertEquals(-19.6, forces.get(0).getVector().y, TOL);
        assertEquals(0, forces.get(0).torqueAboutCM(), TOL);

        assertEquals(3 * 2 * 9.8, law.getPotentialEnergy(), TOL);
        law.setZeroEnergyLevel(1);
        assertEquals(2 * 2 * 9.8, law.getPotentialEnergy(), TOL);
        ball.setZeroEnergyLevel(3);
        assertEquals(0, law.getPotentialEnergy(), TOL);
    }

    @Test
    void damping() {
        var block = Shapes.makeBlock(1, 1, "block");
        block.setVelocity(new Vector2d(2, 0), 1);
        var law = new DampingLaw(0.5, 0.2, List.of(block));
        var forces = law.calculateForces();
        assertEquals(1, forces.size());
        assertEquals(-1, forces.get(0).getVector().x, TOL);
        assertEquals(-0.1, forces.get(0).torqueAboutCM(), TOL);
        assertEquals(0, law.getPotentialEnergy(), TOL);

        law.setDamping(0);
        assertTrue(law.calculateForces().isEmpty());
    }

    @Test
    void mutualGravity() {
        var a = Shapes.makeBall(0.5, "a");
        var b = Shapes.makeBall(0.5, "b");
        b.setPosition(new Point2d(2, 0));
        var law = new Gravity2Law(3, List.of(a, b));
        var forces = law.calculateForces();
        assertEquals(2, forces.size());
        for (var f : forces) {
            var toward = f.getBody() == a ? 1 : -1;
            assertEquals(toward * 0.75, f.getVector().x, TOL);
        }
        assertEquals(3 * (1 - 0.5), law.getPotentialEnergy(), TOL);
    }

    @Test
    void spring() {
        var a = Shapes.makeBlock(1, 1, "a");
        var b = Shapes.makeBlock(1, 1, "b");
        b.setPosition(new Point2d(3, 0));
        var spring = new Spring("spring", a, new Point2d(0, 0), b, new Point2d(0, 0), 1, 2);
        assertEquals(2, spring.getStretch(), TOL);
        assertEquals(4, spring.getPotentialEnergy(), TOL);
        var forces = spring.calculateForces();
        assertEquals(4, forces.get(0).getVector().x, TOL);
        assertSame(a, forces.get(0).getBody());
        assertEquals(-4, forces.get(1).getVector().x, TOL);

        var rope = new Spring("rope", a, new Point2d(0, 0), b, new Point2d(0, 0), 1, 2, true);
        assertEquals(0, rope.getStretch(), TOL);
        assertEquals(0, rope.calculateForces().get(0).getVector().length(), TOL);

        b.setPosition(new Point2d(0, 0));
        assertThrows(IllegalStateException.class, spring::calculateForces);
    }

    @Test
    void springOscillatorConservesEnergy() {
        var sim = new RigidBodySim();
        var block = Shapes.makeBlock(1, 1, "block");
        block.setPosition(new Point2d(1.5, 0));
        sim.addBody(block);
        sim.addForceLaw(new Spring("spring", Scrim.getInstance(), new Point2d(0, 0), block, new Point2d(0, 0), 1,
                                   4));
        sim.modifyObjects();
        double energy = sim.getEnergyInfo().total();
        assertEquals(0.5, energy, TOL);

        var solver = new RungeKutta(sim);
        // half a period of sqrt(k/m) = 2
        int steps = (int) Math.round(Math.PI / 2 / 0.001);
        for (int i = 0; i < steps; i++) {
            assertTrue(solver.step(0.001).isEmpty());
        }
        sim.modifyObjects();
        assertEquals(energy, sim.getEnergyInfo().total(), 1e-6);
        assertEquals(0.5, block.getPosition().x, 1e-3);
    }
}
