/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.engine2d.collision;

import com.hellblazer.impetus.engine2d.force.CoordType;
import com.hellblazer.impetus.engine2d.geometry.Polygon;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;
import com.hellblazer.impetus.engine2d.geometry.Shapes;
import com.hellblazer.impetus.engine2d.sim.ImpulseSim;
import com.hellblazer.impetus.engine2d.sim.Joint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Groups of collisions among a row of touching balls, a separate pair far away, and a floor.
 *
 * @author hal.hildebrand
 */
class CollisionFinderTest {

    private ImpulseSim               sim;
    private Polygon                  a, b, c, d, e;
    private List<RigidBodyCollision> collisions;

    private Polygon ball(String name, double x, double y) {
        var ball = Shapes.makeBall(0.5, name);
        ball.setPosition(new Point2d(x, y), 0);
        sim.addBody(ball);
        return ball;
    }

    private RigidBodyCollision between(RigidBody body1, RigidBody body2) {
        return collisions.stream()
                         .filter(r -> r.hasBody(body1) && r.hasBody(body2))
                         .findFirst()
                         .orElseThrow(() -> new AssertionError(
                         "no collision between " + body1.getName() + " and " + body2.getName()));
    }

    @BeforeEach
    void setUp() {
        sim = new ImpulseSim();
        a = ball("a", 0, 0);
        b = ball("b", 1.005, 0);
        c = ball("c", 2.01, 0);
        d = ball("d", 10, 0);
        e = ball("e", 11.005, 0);
        collisions = new ArrayList<>();
        sim.findCollisions(collisions, sim.getVarsList().getValues(), 0.025);
    }

    @Test
    void touchingBallsAreContacts() {
        assertEquals(3, collisions.stream().map(r -> Set.of(r.getPrimaryBody(), r.getNormalBody())).distinct().count());
        for (var r : collisions) {
            assertTrue(r.contact(), r.toString());
            assertTrue(r.isTouching());
            assertFalse(r.bilateral());
            assertEquals(0.005, r.getDistance(), 1e-6);
            assertEquals(0, r.distanceToHalfGap(), 1e-6);
            assertTrue(r.isBallObject() || r.isBallNormal());
        }
        assertFalse(collisions.stream().anyMatch(r -> r.hasBody(a) && r.hasBody(c)));
    }

    @Test
    void connectedSubset() {
        var ordered = new ArrayList<RigidBodyCollision>();
        ordered.add(between(d, e));
        ordered.add(between(a, b));
        ordered.add(between(b, c));
        var subset = CollisionFinder.subsetCollisions1(ordered);
        assertEquals(List.of(between(d, e)), subset);

        ordered.add(0, ordered.remove(1));
        subset = CollisionFinder.subsetCollisions1(ordered);
        assertEquals(2, subset.size());
        assertTrue(subset.contains(between(a, b)));
        assertTrue(subset.contains(between(b, c)));
        assertTrue(CollisionFinder.subsetCollisions1(List.of()).isEmpty());
    }

    @Test
    void fixedBodiesDoNotConnect() {
        var floor = Shapes.makeWall(20, 1, "floor");
        floor.setPosition(new Point2d(5, -1.005), 0);
        sim.addBody(floor);
        collisions.clear();
        sim.findCollisions(collisions, sim.getVarsList().getValues(), 0.025);
        var ordered = new ArrayList<RigidBodyCollision>();
        ordered.add(between(a, floor));
        ordered.add(between(d, floor));
        var subset = CollisionFinder.subsetCollisions1(ordered);
        assertEquals(List.of(between(a, floor)), subset);
    }

    @Test
    void jointsJoinTheSubset() {
        var joint = new Joint(c, new Point2d(0, 0), d, new Point2d(0, 0), CoordType.WORLD, new Vector2d(1, 0));
        var superset = new ArrayList<>(collisions);
        joint.addCollision(superset, 0);
        var jointRecord = superset.get(0);
        assertTrue(jointRecord.bilateral());
        assertTrue(jointRecord.contact());
        assertSame(joint, jointRecord.getConnector());
        assertTrue(c.doesNotCollide(d));

        var velocities = new double[superset.size()];
        var subset = CollisionFinder.subsetCollisions2(superset, between(a, b), false, velocities, -0.5);
        assertEquals(List.of(between(a, b)), subset);

        subset = CollisionFinder.subsetCollisions2(superset, between(b, c), false, velocities, -0.5);
        assertEquals(List.of(between(b, c), jointRecord), subset);

        velocities[superset.indexOf(between(a, b))] = -1;
        subset = CollisionFinder.subsetCollisions2(superset, between(b, c), true, velocities, -0.5);
        assertEquals(3, subset.size());
        assertTrue(subset.contains(between(a, b)));
        assertTrue(subset.contains(jointRecord));
    }

    @Test
    void jointsAreAlwaysAdded() {
        var joint = new Joint(a, new Point2d(0, 0), b, new Point2d(0, 0), CoordType.WORLD, new Vector2d(0, 1));
        var list = new ArrayList<RigidBodyCollision>();
        var record = new ConnectorCollision(a, b, joint, true);
        joint.updateCollision(record);
        assertTrue(CollisionFinder.addCollision(list, record));
        assertTrue(CollisionFinder.addCollision(list, record));
        assertEquals(2, list.size());
        assertSame(joint, record.getConnector());
    }

    @Test
    void boundingCircles() {
        assertTrue(CollisionFinder.intersectionPossible(a, b, 0.01));
        assertFalse(CollisionFinder.intersectionPossible(a, c, 0.01));
        assertFalse(CollisionFinder.intersectionPossible(a, d, 1));
        assertTrue(CollisionFinder.intersectionPossible(a, d, 10));
    }
}
