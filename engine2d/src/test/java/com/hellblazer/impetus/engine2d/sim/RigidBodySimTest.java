/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.engine2d.sim;

import com.hellblazer.impetus.engine2d.force.DampingLaw;
import com.hellblazer.impetus.engine2d.force.GravityLaw;
import com.hellblazer.impetus.engine2d.geometry.Scrim;
import com.hellblazer.impetus.engine2d.geometry.Shapes;
import com.hellblazer.impetus.simulation.RungeKutta;
import com.hellblazer.impetus.simulation.VarsList;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class RigidBodySimTest {

    private static final double TOL = 1e-9;

    @Test
    void energyVariablesComeFirst() {
        var sim = new RigidBodySim();
        var vars = sim.getVarsList();
        assertEquals(4, vars.numVariables());
        assertEquals(VarsList.TIME, vars.getName(vars.timeIndex()));
        assertEquals("kinetic_energy", vars.getName(RigidBodySim.KE_INDEX));
        assertEquals("potential_energy", vars.getName(RigidBodySim.PE_INDEX));
        assertEquals("total_energy", vars.getName(RigidBodySim.TE_INDEX));
        assertTrue(vars.isComputed(RigidBodySim.TE_INDEX));
    }

    @Test
    void addBodyAllocatesVariables() {
        var sim = new RigidBodySim();
        var block = Shapes.makeBlock(1, 1, "block");
        block.setPosition(new Point2d(1, 2), 0.5);
        block.setVelocity(new Vector2d(3, 4), -1);
        sim.addBody(block);
        sim.addBody(block);
        sim.addBody(Scrim.getInstance());

        assertEquals(List.of(block), sim.getBodies());
        int idx = block.getVarsIndex();
        assertEquals(4, idx);
        var vars = sim.getVarsList();
        assertEquals("block_x", vars.getName(idx + RigidBodySim.X));
        assertEquals("block_vw", vars.getName(idx + RigidBodySim.VW));
        assertEquals(1, vars.getValue(idx + RigidBodySim.X), TOL);
        assertEquals(4, vars.getValue(idx + RigidBodySim.VY), TOL);
        assertEquals(0.5, vars.getValue(idx + RigidBodySim.W), TOL);
        assertEquals(-1, vars.getValue(idx + RigidBodySim.VW), TOL);
        assertSame(block, sim.getBody("BLOCK"));
        assertThrows(IllegalArgumentException.class, () -> sim.getBody("nothing"));
    }

    @Test
    void removedSlotsAreReused() {
        var sim = new RigidBodySim();
        var a = Shapes.makeBall(0.5, "a");
        var b = Shapes.makeBall(0.5, "b");
        sim.addBody(a);
        sim.addBody(b);
        int aIndex = a.getVarsIndex();
        sim.removeBody(a);
        assertEquals(-1, a.getVarsIndex());
        assertEquals(VarsList.DELETED, sim.getVarsList().getName(aIndex));

        var c = Shapes.makeBall(0.5, "c");
        sim.addBody(c);
        assertEquals(aIndex, c.getVarsIndex());
        assertEquals(List.of(b, c), sim.getBodies());
    }

    @Test
    void energy() {
        var sim = new RigidBodySim();
        var block = Shapes.makeBlock(1, 1, "block");
        block.setMass(2);
        block.setPosition(new Point2d(0, 2));
        block.setVelocity(new Vector2d(3, 4), 1);
        sim.addBody(block);
        var wall = Shapes.makeWall(10, 1, "floor");
        wall.setVelocity(new Vector2d(5, 0));
        sim.addBody(wall);
        sim.addForceLaw(new GravityLaw(9.8, sim.getBodies()));

        var info = sim.getEnergyInfo();
        assertEquals(25, info.translational(), TOL);
        assertEquals(0.5 * 2 * (2.0 / 12), info.rotational(), TOL);
        assertEquals(2 * 2 * 9.8, info.potential(), TOL);

        sim.setPotentialEnergy(10);
        assertEquals(10, sim.getEnergyInfo().potential(), TOL);
        assertEquals(10 - 39.2, sim.getPEOffset(), TOL);

        sim.modifyObjects();
        assertEquals(sim.getEnergyInfo().total(), sim.getVarsList().getValue(RigidBodySim.TE_INDEX), TOL);
    }

    @Test
    void onlyOneGravityAndDampingLaw() {
        var sim = new RigidBodySim();
        var gravity = new GravityLaw(1);
        sim.addForceLaw(gravity);
        sim.addForceLaw(gravity);
        sim.addForceLaw(new DampingLaw(0.1, 0.1));
        assertEquals(2, sim.getForceLaws().size());
        assertThrows(IllegalArgumentException.class, () -> sim.addForceLaw(new GravityLaw(2)));
        assertThrows(IllegalArgumentException.class, () -> sim.addForceLaw(new DampingLaw(0.2, 0.1)));
        assertTrue(sim.removeForceLaw(gravity));
        assertFalse(sim.removeForceLaw(gravity));
        sim.addForceLaw(new GravityLaw(2));
    }

    @Test
    void freeFall() {
        var sim = new RigidBodySim();
        var ball = Shapes.makeBall(0.5, "ball");
        ball.setPosition(new Point2d(0, 10));
        ball.setVelocity(new Vector2d(1, 0), 2);
        var floor = Shapes.makeWall(10, 1, "floor");
        sim.addBody(ball);
        sim.addBody(floor);
        sim.addForceLaw(new GravityLaw(9.8, sim.getBodies()));

        var change = new double[sim.getVarsList().numVariables()];
        assertTrue(sim.evaluate(sim.getVarsList().getValues(), change, 0).isEmpty());
        int idx = ball.getVarsIndex();
        assertEquals(-9.8, change[idx + RigidBodySim.VY], TOL);
        assertEquals(1, change[idx + RigidBodySim.X], TOL);
        assertEquals(2, change[idx + RigidBodySim.W], TOL);
        assertEquals(0, change[floor.getVarsIndex() + RigidBodySim.VY], TOL);
        assertEquals(1, change[sim.getVarsList().timeIndex()], TOL);

        var solver = new RungeKutta(sim);
        for (int i = 0; i < 10; i++) {
            assertTrue(solver.step(0.1).isEmpty());
        }
        var vars = sim.getVarsList();
        assertEquals(1, vars.getTime(), 1e-12);
        assertEquals(10 - 4.9, vars.getValue(idx + RigidBodySim.Y), 1e-9);
        assertEquals(-9.8, vars.getValue(idx + RigidBodySim.VY), 1e-9);
        assertEquals(1, vars.getValue(idx + RigidBodySim.X), 1e-9);
        assertEquals(2, vars.getValue(idx + RigidBodySim.W), 1e-9);
    }

    @Test
    void resetRestoresInitialState() {
        var sim = new RigidBodySim();
        var ball = Shapes.makeBall(0.5, "ball");
        ball.setPosition(new Point2d(0, 3));
        sim.addBody(ball);
        sim.addForceLaw(new GravityLaw(9.8, sim.getBodies()));
        sim.saveInitialState();
        var solver = new RungeKutta(sim);
        solver.step(0.5);
        sim.modifyObjects();
        assertTrue(ball.getPosition().y < 3);

        sim.reset();
        assertEquals(3, ball.getPosition().y, TOL);
        assertEquals(0, sim.getVarsList().getTime(), TOL);
    }

    @Test
    void cleanSlateAndElasticity() {
        var sim = new RigidBodySim();
        assertThrows(IllegalStateException.class, () -> sim.setElasticity(0.5));
        var ball = Shapes.makeBall(0.5, "ball");
        sim.addBody(ball);
        sim.setElasticity(0.25);
        assertEquals(0.25, ball.getElasticity(), TOL);
        sim.addForceLaw(new GravityLaw(1));
        sim.cleanSlate();
        assertTrue(sim.getBodies().isEmpty());
        assertTrue(sim.getForceLaws().isEmpty());
        assertEquals(-1, ball.getVarsIndex());
    }
}
