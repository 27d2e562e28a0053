/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.engine2d.geometry;

import org.junit.jupiter.api.Test;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class ShapesTest {

    private static final double TOL = 1e-9;

    @Test
    void block() {
        var block = Shapes.makeBlock(1, 2, "block");
        assertEquals("block", block.getName());
        assertEquals(1, block.getWidth(), TOL);
        assertEquals(2, block.getHeight(), TOL);
        assertEquals(4, block.getEdges().size());
        assertEquals(4, block.getVertexes().size());
        assertEquals(1, block.getPaths().size());
        assertTrue(block.getEdges().stream().allMatch(Edge::isStraight));
        assertEquals(5.0 / 12, block.getMoment(), TOL);
        assertEquals(0.5, block.getMinHeight(), TOL);
        assertEquals(Math.sqrt(1.25), block.getCentroidRadius(), TOL);
        assertTrue(block.probablyPointInside(new Point2d(0, 0)));
        assertTrue(block.probablyPointInside(new Point2d(0.4, -0.9)));
        assertFalse(block.probablyPointInside(new Point2d(0.6, 0)));
        assertTrue(block.isMoveable());
    }

    @Test
    void blockWithCornerOrigin() {
        var block = Shapes.makeBlock2(2, 1, "block2");
        assertEquals(0, block.getLeftBody(), TOL);
        assertEquals(0, block.getBottomBody(), TOL);
        assertEquals(new Point2d(1, 0.5), block.getCenterOfMassBody());
        block.setPosition(new Point2d(5, 5), 0);
        var corner = block.bodyToWorld(new Point2d(0, 0));
        assertEquals(4, corner.x, TOL);
        assertEquals(4.5, corner.y, TOL);
    }

    @Test
    void ball() {
        var ball = Shapes.makeBall(0.75, "ball");
        assertEquals(1, ball.getEdges().size());
        var edge = assertInstanceOf(CircularEdge.class, ball.getEdges().get(0));
        assertTrue(edge.isCompleteCircle());
        assertTrue(edge.isOutsideIsOut());
        assertEquals(0.75, edge.getRadius(), TOL);
        assertEquals(1.5, ball.getWidth(), TOL);
        assertEquals(1.5, ball.getHeight(), TOL);
        assertEquals(0.75 * 0.75 / 2, ball.getMoment(), TOL);
        assertEquals(0.8, ball.getElasticity(), TOL);
        assertEquals(0.75, ball.getCentroidRadius(), 0.05);
        assertTrue(ball.probablyPointInside(new Point2d(0.5, 0.5)));
        assertFalse(ball.probablyPointInside(new Point2d(0.6, 0.6)));
    }

    @Test
    void roundCornerBlock() {
        var block = Shapes.makeRoundCornerBlock(2, 1, 0.2, "rounded");
        assertEquals(8, block.getEdges().size());
        assertEquals(4, block.getEdges().stream().filter(e -> !e.isStraight()).count());
        assertEquals(2, block.getWidth(), TOL);
        assertEquals(1, block.getHeight(), TOL);
        assertThrows(IllegalArgumentException.class, () -> Shapes.makeRoundCornerBlock(2, 1, 0.6, "bad"));
    }

    @Test
    void frameHasTwoPaths() {
        var frame = Shapes.makeFrame(4, 3, 0.2, "frame");
        assertEquals(2, frame.getPaths().size());
        assertEquals(8, frame.getEdges().size());
        assertEquals(4.2, frame.getWidth(), TOL);
        assertEquals(3.2, frame.getHeight(), TOL);
        assertTrue(frame.isMoveable());
        assertThrows(IllegalArgumentException.class, () -> Shapes.makeFrame(1, 1, 1, "solid"));
    }

    @Test
    void wallIsImmoveable() {
        var wall = Shapes.makeWall(10, 1, "wall");
        assertFalse(wall.isMoveable());
        assertEquals(Double.POSITIVE_INFINITY, wall.getMass());
        wall.setVelocity(new Vector2d(3, 0), 1);
        assertEquals(0, wall.getVelocity().length(), TOL);
        assertEquals(0, wall.getKineticEnergy(), TOL);
    }

    @Test
    void cup() {
        var cup = Shapes.makeCup(2, 1, 1.5, "cup");
        assertEquals(4, cup.getEdges().size());
        var arc = cup.getEdges()
                     .stream()
                     .filter(e -> !e.isStraight())
                     .map(CircularEdge.class::cast)
                     .findFirst()
                     .orElseThrow();
        assertFalse(arc.isOutsideIsOut());
        assertEquals(1.5, arc.getRadius(), TOL);
        assertEquals(0.5, cup.getTopBody(), TOL);
        assertEquals(-0.5, cup.getBottomBody(), TOL);
        assertThrows(IllegalArgumentException.class, () -> Shapes.makeCup(2, 1, 0.9, "flat"));
    }

    @Test
    void regularPolygon() {
        var hex = Shapes.makeNGon(6, 1, "hex");
        assertEquals(6, hex.getEdges().size());
        assertEquals(6, hex.getVertexes().size());
        assertEquals(-Math.cos(Math.PI / 6), hex.getBottomBody(), TOL);
        assertEquals(1, hex.getCentroidRadius(), TOL);
        assertTrue(hex.probablyPointInside(new Point2d(0, 0)));
        assertThrows(IllegalArgumentException.class, () -> Shapes.makeNGon(2, 1, "line"));
    }

    @Test
    void polygonFromPoints() {
        var triangle = Shapes.makePolygon(List.of(new Point2d(0, 0), new Point2d(2, 0), new Point2d(0, 2)), 0.5,
                                          "triangle");
        assertEquals(3, triangle.getEdges().size());
        assertEquals(0.5, triangle.getMoment(), TOL);
        assertTrue(triangle.probablyPointInside(new Point2d(0.5, 0.5)));
        assertFalse(triangle.probablyPointInside(new Point2d(1.5, 1.5)));
        assertFalse(triangle.probablyPointInside(new Point2d(-0.1, 0.5)));
        assertThrows(IllegalArgumentException.class,
                     () -> Shapes.makePolygon(List.of(new Point2d(0, 0), new Point2d(1, 0)), 1, "line"));
    }
}
