/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.simulation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * @author hal.hildebrand
 */
class CollisionStatsTest {

    private static Collision collision(boolean joint, boolean contact, boolean needsHandling, double velocity,
                                       double distance, double estimate, double detected) {
        var c = mock(Collision.class);
        when(c.bilateral()).thenReturn(joint);
        when(c.contact()).thenReturn(contact);
        when(c.needsHandling()).thenReturn(needsHandling);
        when(c.getVelocity()).thenReturn(velocity);
        when(c.getDistance()).thenReturn(distance);
        when(c.getEstimatedTime()).thenReturn(estimate);
        when(c.getDetectedTime()).thenReturn(detected);
        return c;
    }

    @Test
    void emptyListHasNoEstimate() {
        var stats = new CollisionStats();
        stats.update(List.of());
        assertEquals(0, stats.getNumCollisions());
        assertTrue(Double.isNaN(stats.getEstTime()));
        assertTrue(Double.isNaN(stats.getDetectedTime()));
        assertEquals(Double.POSITIVE_INFINITY, stats.getMinDistance());
    }

    @Test
    void countsAndEarliestEstimate() {
        var stats = new CollisionStats();
        stats.update(List.of(collision(true, true, false, 0, 0, Double.NaN, 1.0),
                             collision(false, true, false, -0.1, 0.004, Double.NaN, 1.0),
                             collision(false, false, true, -2, -0.01, 0.98, 1.0),
                             collision(false, false, false, -1, 0.05, 1.02, 0.9),
                             collision(false, false, false, 1, 0.005, Double.NaN, 1.0)));
        assertEquals(5, stats.getNumCollisions());
        assertEquals(1, stats.getNumJoints());
        // the joint also reports contact, but is only counted as a joint
        assertEquals(1, stats.getNumContacts());
        assertEquals(3, stats.getNumNonContact());
        assertEquals(1, stats.getNumNeedsHandling());
        assertEquals(2, stats.getNumImminent());
        assertEquals(-0.01, stats.getMinDistance());
        assertEquals(0.98, stats.getEstTime());
        assertEquals(1.0, stats.getDetectedTime());
    }

    @Test
    void unknownEstimateMakesEstimateUnknown() {
        var stats = new CollisionStats();
        stats.update(List.of(collision(false, false, true, -2, -0.01, 0.98, 1.0),
                             collision(false, false, false, -1, 0.05, Double.NaN, 1.0)));
        assertEquals(2, stats.getNumImminent());
        assertTrue(Double.isNaN(stats.getEstTime()));
    }

    @Test
    void nonFiniteDistanceOfImminentCollisionIsAnError() {
        var stats = new CollisionStats();
        var bad = collision(false, false, true, -2, Double.NaN, 0.98, 1.0);
        assertThrows(IllegalStateException.class, () -> stats.update(List.of(bad)));
    }
}
