/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.engine2d.sim;

import com.hellblazer.impetus.engine2d.collision.RigidBodyCollision;
import com.hellblazer.impetus.engine2d.force.DampingLaw;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;
import com.hellblazer.impetus.simulation.CollisionAdvance;
import com.hellblazer.impetus.simulation.CollisionAdvance.AdvanceConfig;
import com.hellblazer.impetus.simulation.RungeKutta;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Shared setup and checks for the engine scenario tests.
 *
 * @author hal.hildebrand
 */
final class EngineTestRig {

    static final double TIME_STEP = 0.025;

    private EngineTestRig() {
    }

    /**
     * The settings most scenarios share. Call after the bodies are added so the damping law sees them.
     */
    static void commonSetup(ImpulseSim sim, CollisionAdvance<RigidBodyCollision> advance, double damping,
                            double rotateRatio) {
        sim.addForceLaw(new DampingLaw(damping, rotateRatio, sim.getBodies()));
        sim.setCollisionAccuracy(0.6);
        sim.setCollisionHandling(CollisionHandling.SERIAL_GROUPED_LASTPASS);
        sim.setRandomSeed(99999);
        sim.setDistanceTol(0.01);
        sim.setVelocityTol(0.5);
        if (sim instanceof ContactSim contactSim) {
            contactSim.setExtraAccel(ExtraAccel.VELOCITY);
            contactSim.setExtraAccelTimeStep(TIME_STEP);
        }
        advance.configure(AdvanceConfig.defaultConfig().withTimeStep(TIME_STEP));
        advance.setDiffEqSolver(new RungeKutta(sim));
    }

    /**
     * Handles any collisions present at the start, then advances in whole time steps until the time is reached.
     */
    static void runUntil(CollisionAdvance<RigidBodyCollision> advance, double time) {
        if (advance.getTime() < 1e-12) {
            advance.advance(0);
            advance.getCollisionTotals().reset();
        }
        while (advance.getTime() < time - 1e-7) {
            advance.advance(advance.getTimeStep());
        }
    }

    static void assertBody(RigidBodySim sim, RigidBody body, double[] expected, double tolerance) {
        int idx = body.getVarsIndex();
        assertTrue(idx >= 0, body.getName() + " is not in the simulation");
        var vars = sim.getVarsList();
        String[] names = { "x", "vx", "y", "vy", "w", "vw" };
        for (int k = 0; k < 6; k++) {
            assertEquals(expected[k], vars.getValue(idx + k), tolerance, body.getName() + " " + names[k]);
        }
    }

    static void assertTightJoints(ContactSim sim, double tolerance) {
        for (var connector : sim.getConnectors()) {
            double dist = connector.getNormalDistance();
            assertTrue(Math.abs(dist) <= tolerance, "joint not tight " + connector + " distance " + dist);
        }
    }
}
