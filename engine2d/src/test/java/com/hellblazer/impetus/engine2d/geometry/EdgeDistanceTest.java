/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.engine2d.geometry;

import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;

import javax.vecmath.Point2d;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Distances from points to the edges of a 2 x 1 block and a unit ball, in body coordinates.
 *
 * @author hal.hildebrand
 */
class EdgeDistanceTest {

    private static final double TOL = 1e-9;

    private static Edge blockEdge(int index) {
        return Shapes.makeBlock(2, 1, "block").getEdges().get(index);
    }

    @Property
    @Label("top and bottom edges are mirror images")
    void topBottomSymmetry(@ForAll @DoubleRange(min = -0.99, max = 0.99) double x,
                           @ForAll @DoubleRange(min = -3, max = 3) double y) {
        var block = Shapes.makeBlock(2, 1, "block");
        var top = block.getEdges().get(Shapes.TOP_EDGE);
        var bottom = block.getEdges().get(Shapes.BOTTOM_EDGE);
        double d = top.distanceToPoint(new Point2d(x, y));
        assertEquals(y - 0.5, d, TOL);
        assertEquals(d, bottom.distanceToPoint(new Point2d(x, -y)), TOL);
        assertEquals(d, top.distanceToLine(new Point2d(x, y)), TOL);
    }

    @Property
    @Label("left and right edges are mirror images")
    void leftRightSymmetry(@ForAll @DoubleRange(min = -3, max = 3) double x,
                           @ForAll @DoubleRange(min = -0.49, max = 0.49) double y) {
        var right = blockEdge(Shapes.RIGHT_EDGE);
        var left = blockEdge(Shapes.LEFT_EDGE);
        double d = right.distanceToPoint(new Point2d(x, y));
        assertEquals(x - 1, d, TOL);
        assertEquals(d, left.distanceToPoint(new Point2d(-x, y)), TOL);
    }

    @Property
    @Label("distance to a ball depends only on the distance from its center")
    void ballIsRadial(@ForAll @DoubleRange(min = 0, max = 6.28) double angle,
                      @ForAll @DoubleRange(min = -0.5, max = 3) double gap) {
        var edge = Shapes.makeBall(1, "ball").getEdges().get(0);
        double r = 1 + gap;
        var p = new Point2d(r * Math.cos(angle), r * Math.sin(angle));
        assertEquals(gap, edge.distanceToPoint(p), TOL);
        var mirrored = new Point2d(p.x, -p.y);
        assertEquals(gap, edge.distanceToPoint(mirrored), TOL);
    }

    @Property
    @Label("moving the body does not change distances measured in body coordinates")
    void distanceIsInvariantUnderPlacement(@ForAll @DoubleRange(min = -0.99, max = 0.99) double x,
                                           @ForAll @DoubleRange(min = 0.5, max = 2) double y,
                                           @ForAll @DoubleRange(min = -5, max = 5) double px,
                                           @ForAll @DoubleRange(min = -5, max = 5) double py,
                                           @ForAll @DoubleRange(min = -3.14, max = 3.14) double angle) {
        var block = Shapes.makeBlock(2, 1, "block");
        var top = block.getEdges().get(Shapes.TOP_EDGE);
        var pBody = new Point2d(x, y);
        double before = top.distanceToPoint(pBody);
        block.setPosition(new Point2d(px, py), angle);
        var world = block.bodyToWorld(pBody);
        assertEquals(before, top.distanceToPoint(block.worldToBody(world)), TOL);
    }
}
