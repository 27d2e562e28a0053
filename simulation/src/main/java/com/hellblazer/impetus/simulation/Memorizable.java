package com.hellblazer.impetus.simulation;

/**
 * Callback invoked after every accepted time step, for recording data or refreshing a display.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface Memorizable {

    void memorize();
}
