/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.impetus.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class DoubleRectTest {

    private static final double EPSILON = 1e-12;

    @Test
    void testMakeOrdersCorners() {
        var r = DoubleRect.make(2, 3, -1, -4);
        assertEquals(-1, r.left(), EPSILON);
        assertEquals(-4, r.bottom(), EPSILON);
        assertEquals(2, r.right(), EPSILON);
        assertEquals(3, r.top(), EPSILON);
        assertEquals(3, r.width(), EPSILON);
        assertEquals(7, r.height(), EPSILON);
    }

    @Test
    void testInvertedRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DoubleRect(1, 0, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new DoubleRect(Double.NaN, 0, 0, 1));
    }

    @Test
    void testIntersectsIncludesTouching() {
        var a = new DoubleRect(0, 0, 1, 1);
        assertTrue(a.intersects(new DoubleRect(1, 1, 2, 2)));
        assertTrue(a.intersects(new DoubleRect(0.5, -1, 0.6, 3)));
        assertFalse(a.intersects(new DoubleRect(1.01, 0, 2, 1)));
        assertFalse(a.intersects(new DoubleRect(0, -2, 1, -0.5)));
    }

    @Test
    void testUnionAndExpand() {
        var u = new DoubleRect(0, 0, 1, 1).union(new DoubleRect(-2, 0.5, 0.5, 4));
        assertEquals(new DoubleRect(-2, 0, 1, 4), u);
        var e = u.expand(0.5);
        assertEquals(-2.5, e.left(), EPSILON);
        assertEquals(4.5, e.top(), EPSILON);
        assertTrue(e.contains(1.4, -0.4));
        assertFalse(DoubleRect.EMPTY.unionPoint(1, 1).isEmpty());
        assertTrue(DoubleRect.EMPTY.isEmpty());
    }
}
