package com.hellblazer.impetus.simulation;

/**
 * A simulation that can report its energy.
 *
 * @author hal.hildebrand
 */
public interface EnergySystem {

    EnergyInfo getEnergyInfo();

    /**
     * Adjusts the potential energy offset so that the current potential energy equals the given value.
     */
    void setPotentialEnergy(double value);
}
