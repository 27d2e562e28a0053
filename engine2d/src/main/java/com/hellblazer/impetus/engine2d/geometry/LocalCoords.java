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
package com.hellblazer.impetus.engine2d.geometry;

import javax.vecmath.Point2d;
import javax.vecmath.Tuple2d;

/**
 * Snapshot of a body's pose, used to transform between body and world coordinates as they were at the start of a
 * time step.
 *
 * @author hal.hildebrand
 */
public record LocalCoords(Point2d cmBody, Point2d locWorld, double sin, double cos) {

    public LocalCoords {
        cmBody = new Point2d(cmBody);
        locWorld = new Point2d(locWorld);
    }

    public Point2d bodyToWorld(Tuple2d p) {
        double rx = p.x - cmBody.x;
        double ry = p.y - cmBody.y;
        return new Point2d(locWorld.x + rx * cos - ry * sin, locWorld.y + rx * sin + ry * cos);
    }

    public Point2d worldToBody(Tuple2d p) {
        double rx = p.x - locWorld.x;
        double ry = p.y - locWorld.y;
        return new Point2d(cmBody.x + rx * cos + ry * sin, cmBody.y - rx * sin + ry * cos);
    }
}
