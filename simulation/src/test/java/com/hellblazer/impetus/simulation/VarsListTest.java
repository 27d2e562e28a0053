/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.simulation;

import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VarsList bookkeeping: slot reuse, sequence numbers and the finite value invariant.
 *
 * @author hal.hildebrand
 */
class VarsListTest {

    @Test
    void timeIsFirstVariable() {
        var vars = new VarsList();
        assertEquals(1, vars.numVariables());
        assertEquals(VarsList.TIME, vars.getName(0));
        assertEquals(0, vars.timeIndex());
        vars.setTime(2.5);
        assertEquals(2.5, vars.getTime());
    }

    @Test
    void deletedSlotsAreReused() {
        var vars = new VarsList();
        int a = vars.addVariables("a_x", "a_vx");
        int b = vars.addVariables("b_x", "b_vx");
        assertEquals(1, a);
        assertEquals(3, b);
        vars.deleteVariables(a, 2);
        assertEquals(VarsList.DELETED, vars.getName(1));
        assertEquals(-1, vars.indexOf("a_x"));

        int c = vars.addVariables("c_x", "c_vx");
        assertEquals(1, c);
        assertEquals(5, vars.numVariables());
        assertEquals(3, vars.indexOf("b_x"));

        int d = vars.addVariables("d_x", "d_vx", "d_y");
        assertEquals(5, d);
    }

    @Test
    void discontinuousChangeIncrementsSequence() {
        var vars = new VarsList();
        int x = vars.addVariables("x");
        int before = vars.getSequence(x);
        vars.setValue(x, 1.0);
        assertEquals(before, vars.getSequence(x));
        vars.setValue(x, 2.0, false);
        assertEquals(before + 1, vars.getSequence(x));
        vars.setValues(new double[] { 0, 3.0 }, false);
        assertEquals(before + 2, vars.getSequence(x));
        vars.incrSequence(x);
        assertEquals(before + 3, vars.getSequence(x));
    }

    @Test
    void nonFiniteValuesAreRejected() {
        var vars = new VarsList();
        int x = vars.addVariables("x");
        vars.setValue(x, 4.0);
        var e = assertThrows(IllegalArgumentException.class, () -> vars.setValue(x, Double.NaN));
        assertTrue(e.getMessage().contains("x"));
        assertThrows(IllegalArgumentException.class,
                     () -> vars.setValues(new double[] { 1.0, Double.POSITIVE_INFINITY }));
        // nothing changed
        assertEquals(4.0, vars.getValue(x));
        assertEquals(0.0, vars.getTime());
    }

    @Test
    void illegalNamesAndIndexes() {
        var vars = new VarsList();
        assertThrows(IllegalArgumentException.class, () -> vars.addVariables());
        assertThrows(IllegalArgumentException.class, () -> vars.addVariables(VarsList.DELETED));
        assertThrows(IndexOutOfBoundsException.class, () -> vars.getValue(3));
        assertThrows(IndexOutOfBoundsException.class, () -> vars.deleteVariables(0, 1));
    }

    @Test
    void historyKeepsLastStates() {
        var vars = new VarsList();
        for (int i = 0; i < VarsList.HISTORY_SIZE + 3; i++) {
            vars.setTime(i);
            vars.saveHistory();
        }
        var history = vars.getHistory();
        assertEquals(VarsList.HISTORY_SIZE, history.size());
        assertEquals(3.0, history.get(0)[0]);
        assertEquals(VarsList.HISTORY_SIZE + 2.0, history.get(history.size() - 1)[0]);
    }

    @Property
    @Label("Adding after deleting never grows the list past its high water mark")
    void reuseKeepsSize(@ForAll @IntRange(min = 1, max = 6) int bodies, @ForAll @IntRange(min = 0, max = 5) int victim) {
        var vars = new VarsList();
        int[] starts = new int[bodies];
        for (int i = 0; i < bodies; i++) {
            starts[i] = vars.addVariables("x" + i, "vx" + i, "y" + i, "vy" + i, "w" + i, "vw" + i);
        }
        int size = vars.numVariables();
        int index = victim % bodies;
        vars.deleteVariables(starts[index], 6);
        int again = vars.addVariables("x", "vx", "y", "vy", "w", "vw");
        assertEquals(starts[index], again);
        assertEquals(size, vars.numVariables());
    }

    @Property
    @Label("Values round trip through the array interface")
    void valuesRoundTrip(@ForAll @IntRange(min = 1, max = 20) int count) {
        var vars = new VarsList();
        var names = new String[count];
        for (int i = 0; i < count; i++) {
            names[i] = "v" + i;
        }
        vars.addVariables(names);
        var values = new double[count + 1];
        for (int i = 0; i < values.length; i++) {
            values[i] = i * 0.5;
        }
        vars.setValues(values);
        assertArrayEquals(values, vars.getValues());
        // copies are independent of the list
        vars.getValues()[1] = 99;
        assertEquals(0.5, vars.getValue(1));
    }
}
