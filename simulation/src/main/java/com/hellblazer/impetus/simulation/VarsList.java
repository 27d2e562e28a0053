package com.hellblazer.impetus.simulation;

import com.hellblazer.impetus.common.Util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The state vector of a simulation: an ordered set of named double values.
 * <p>
 * Index 0 is always the simulation time. Simulations append their own variables with {@link #addVariables(String...)};
 * slots released by {@link #deleteVariables(int, int)} are reused by later additions so indexes held by other objects
 * stay stable.
 * <p>
 * Each variable carries a sequence number that is incremented whenever the variable changes discontinuously, for
 * example when a collision impulse changes a velocity. Consumers recording the state over time use the sequence number
 * to avoid drawing a line across the discontinuity.
 * <p>
 * Computed variables (energies, for example) are derived from the others; differential equation solvers leave them
 * alone.
 *
 * @author hal.hildebrand
 */
public class VarsList {

    public static final String  TIME         = "time";
    public static final String  DELETED      = "deleted";
    public static final int     HISTORY_SIZE = 10;
    private static final int    TIME_INDEX   = 0;

    private final List<Variable> variables = new ArrayList<>();
    private final Deque<double[]> history  = new ArrayDeque<>(HISTORY_SIZE);

    public VarsList() {
        variables.add(new Variable(TIME));
    }

    /**
     * Adds a run of contiguous variables, reusing deleted slots when a long enough run of them exists.
     *
     * @return index of the first added variable
     */
    public int addVariables(String... names) {
        if (names.length == 0) {
            throw new IllegalArgumentException("no variable names given");
        }
        for (var name : names) {
            if (name == null || name.isBlank() || DELETED.equals(name)) {
                throw new IllegalArgumentException("illegal variable name: " + name);
            }
        }
        int position = findDeletedRun(names.length);
        if (position < 0) {
            position = variables.size();
            for (var name : names) {
                variables.add(new Variable(name));
            }
        } else {
            for (int i = 0; i < names.length; i++) {
                var v = variables.get(position + i);
                v.name = names[i];
                v.value = 0;
                v.computed = false;
                v.sequence++;
            }
        }
        return position;
    }

    /**
     * Marks a run of variables as deleted. The slots are kept so that other indexes remain valid.
     */
    public void deleteVariables(int index, int count) {
        if (count == 0) {
            return;
        }
        if (index <= TIME_INDEX || count < 0 || index + count > variables.size()) {
            throw new IndexOutOfBoundsException("cannot delete " + count + " variables at " + index);
        }
        for (int i = index; i < index + count; i++) {
            var v = variables.get(i);
            v.name = DELETED;
            v.value = 0;
            v.computed = false;
            v.sequence++;
        }
    }

    public int numVariables() {
        return variables.size();
    }

    public int timeIndex() {
        return TIME_INDEX;
    }

    public double getTime() {
        return getValue(TIME_INDEX);
    }

    public void setTime(double time) {
        setValue(TIME_INDEX, time);
    }

    public String getName(int index) {
        return variable(index).name;
    }

    /**
     * @return index of the variable with the given name, or -1
     */
    public int indexOf(String name) {
        for (int i = 0; i < variables.size(); i++) {
            if (variables.get(i).name.equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public double getValue(int index) {
        return variable(index).value;
    }

    public void setValue(int index, double value) {
        setValue(index, value, true);
    }

    /**
     * Sets a value; a discontinuous change increments the variable's sequence number.
     *
     * @throws IllegalArgumentException if the value is NaN or infinite
     */
    public void setValue(int index, double value, boolean continuous) {
        var v = variable(index);
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("non-finite value " + value + " for variable " + v.name);
        }
        v.value = value;
        if (!continuous) {
            v.sequence++;
        }
    }

    public double[] getValues() {
        var values = new double[variables.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = variables.get(i).value;
        }
        return values;
    }

    public void setValues(double[] values) {
        setValues(values, true);
    }

    /**
     * Replaces all values. The array may be shorter than the list, in which case the remaining variables are
     * unchanged.
     *
     * @throws IllegalArgumentException if any value is NaN or infinite, in which case nothing is changed
     */
    public void setValues(double[] values, boolean continuous) {
        if (values.length > variables.size()) {
            throw new IllegalArgumentException(
            "too many values: " + values.length + " for " + variables.size() + " variables");
        }
        int bad = Util.firstNonFinite(values);
        if (bad >= 0) {
            throw new IllegalArgumentException(
            "non-finite value " + values[bad] + " for variable " + variables.get(bad).name);
        }
        for (int i = 0; i < values.length; i++) {
            var v = variables.get(i);
            v.value = values[i];
            if (!continuous) {
                v.sequence++;
            }
        }
    }

    public void incrSequence(int... indexes) {
        if (indexes.length == 0) {
            variables.forEach(v -> v.sequence++);
            return;
        }
        for (int index : indexes) {
            variable(index).sequence++;
        }
    }

    public int getSequence(int index) {
        return variable(index).sequence;
    }

    public boolean isComputed(int index) {
        return variable(index).computed;
    }

    public void setComputed(int index, boolean computed) {
        variable(index).computed = computed;
    }

    /**
     * Records the current values in a ring of the last {@value #HISTORY_SIZE} states, for post-mortem of failures.
     */
    public void saveHistory() {
        if (history.size() == HISTORY_SIZE) {
            history.removeFirst();
        }
        history.addLast(getValues());
    }

    /**
     * @return the saved states, oldest first
     */
    public List<double[]> getHistory() {
        var copy = new ArrayList<double[]>(history.size());
        history.forEach(h -> copy.add(h.clone()));
        return copy;
    }

    public String printHistory() {
        var sb = new StringBuilder();
        for (var h : history) {
            sb.append(Util.nf7(h)).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("VarsList{");
        for (int i = 0; i < variables.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            var v = variables.get(i);
            sb.append(v.name).append('=').append(Util.nf7(v.value));
        }
        return sb.append('}').toString();
    }

    private int findDeletedRun(int length) {
        int run = 0;
        for (int i = 1; i < variables.size(); i++) {
            if (DELETED.equals(variables.get(i).name)) {
                if (++run == length) {
                    return i - length + 1;
                }
            } else {
                run = 0;
            }
        }
        return -1;
    }

    private Variable variable(int index) {
        if (index < 0 || index >= variables.size()) {
            throw new IndexOutOfBoundsException("variable index " + index + " of " + variables.size());
        }
        return variables.get(index);
    }

    private static final class Variable {
        private String  name;
        private double  value;
        private int     sequence;
        private boolean computed;

        private Variable(String name) {
            this.name = name;
        }
    }
}
