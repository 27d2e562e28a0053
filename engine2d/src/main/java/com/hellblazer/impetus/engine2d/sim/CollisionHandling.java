/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Impetus.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.impetus.engine2d.sim;

/**
 * How {@link ImpulseSim} resolves a set of simultaneous collisions.
 * <p>
 * The serial variants treat one randomly chosen focus collision at a time, applying its impulse and then handling
 * whatever ricochets result until every collision is separating or nearly at rest. Grouped variants solve the focus
 * collision together with the joints connected to it. The last pass variants finish with a single simultaneous
 * solve at zero elasticity to remove the remaining small approach velocities.
 *
 * @author hal.hildebrand
 */
public enum CollisionHandling {
    /** All collisions solved in one step so that each separates at elasticity times its approach velocity. */
    SIMULTANEOUS(false, false, false),
    /** Serial, but each focus collision is solved together with the other collisions on its bodies. */
    HYBRID(true, true, true),
    SERIAL_GROUPED(false, true, false),
    SERIAL_GROUPED_LASTPASS(false, true, true),
    SERIAL_SEPARATE(false, false, false),
    SERIAL_SEPARATE_LASTPASS(false, false, true);

    private final boolean hybrid;
    private final boolean grouped;
    private final boolean lastPass;

    CollisionHandling(boolean hybrid, boolean grouped, boolean lastPass) {
        this.hybrid = hybrid;
        this.grouped = grouped;
        this.lastPass = lastPass;
    }

    public boolean isHybrid() {
        return hybrid;
    }

    public boolean isGrouped() {
        return grouped;
    }

    public boolean isLastPass() {
        return lastPass;
    }
}
