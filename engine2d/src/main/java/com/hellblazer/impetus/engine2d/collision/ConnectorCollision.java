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
package com.hellblazer.impetus.engine2d.collision;

import com.hellblazer.impetus.engine2d.geometry.Edge;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;
import com.hellblazer.impetus.engine2d.geometry.Vertex;
import com.hellblazer.impetus.engine2d.sim.Connector;
import com.hellblazer.impetus.simulation.Collision;

/**
 * The collision record of a {@link Connector}, which computes the impact points, normal and distance. Acts as a
 * collision and as a contact at the same time.
 *
 * @author hal.hildebrand
 */
public class ConnectorCollision extends RigidBodyCollision {

    private final Connector connector;

    public ConnectorCollision(RigidBody primaryBody, RigidBody normalBody, Connector connector, boolean joint) {
        super(primaryBody, normalBody, joint);
        this.connector = connector;
    }

    @Override
    public Connector getConnector() {
        return connector;
    }

    @Override
    public boolean hasEdge(Edge edge) {
        return false;
    }

    @Override
    public boolean hasVertex(Vertex v) {
        return false;
    }

    @Override
    public boolean similarTo(Collision other) {
        return false;
    }

    @Override
    public void updateCollision(double time) {
        connector.updateCollision(this);
        super.updateCollision(time);
    }

    @Override
    public String toString() {
        var s = super.toString();
        return s.substring(0, s.length() - 1) + ", connector=" + connector.getName() + '}';
    }
}
