package com.hellblazer.impetus.simulation;

/**
 * Energy of a simulation at an instant.
 *
 * @param potential     potential energy, including any offset set on the simulation
 * @param translational kinetic energy of the centers of mass
 * @param rotational    kinetic energy of rotation about the centers of mass
 * @author hal.hildebrand
 */
public record EnergyInfo(double potential, double translational, double rotational) {

    public double kinetic() {
        return translational + rotational;
    }

    public double total() {
        return potential + translational + rotational;
    }
}
