/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.impetus.common;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class UtilTest {

    @Test
    void testFirstNonFinite() {
        assertEquals(-1, Util.firstNonFinite(new double[] { 0, 1, 2 }));
        assertEquals(1, Util.firstNonFinite(new double[] { 0, Double.NaN, Double.POSITIVE_INFINITY }));
    }

    @Test
    void testFormatting() {
        assertEquals("1.5000000", Util.nf7(1.5));
        assertEquals("NaN", Util.nf7(Double.NaN));
        assertEquals("[1.0000000, -2.0000000]", Util.nf7(new double[] { 1, -2 }));
    }

    @Property
    void limitAngleKeepsDirection(@ForAll @DoubleRange(min = -100, max = 100) double angle) {
        var limited = Util.limitAngle(angle);
        assertTrue(limited > -Math.PI - 1e-12 && limited <= Math.PI + 1e-12, "limited=" + limited);
        assertEquals(Math.sin(angle), Math.sin(limited), 1e-9);
        assertEquals(Math.cos(angle), Math.cos(limited), 1e-9);
    }
}
