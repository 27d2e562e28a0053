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
import javax.vecmath.Vector2d;

/**
 * Planar vector helpers shared by the geometry and collision code. All operations return new instances and never
 * modify their arguments.
 *
 * @author hal.hildebrand
 */
public final class Geometry {

    public static final Point2d  ORIGIN = new Point2d(0, 0);
    public static final Vector2d NORTH  = new Vector2d(0, 1);

    private static final double PARALLEL_TOLERANCE  = 1e-16;
    private static final double INTERSECT_TOLERANCE = 1e-14;

    private Geometry() {
    }

    public static Vector2d between(Tuple2d from, Tuple2d to) {
        return new Vector2d(to.x - from.x, to.y - from.y);
    }

    public static Point2d offset(Tuple2d p, Tuple2d direction, double length) {
        return new Point2d(p.x + direction.x * length, p.y + direction.y * length);
    }

    public static Point2d midpoint(Tuple2d a, Tuple2d b) {
        return new Point2d((a.x + b.x) / 2, (a.y + b.y) / 2);
    }

    public static Vector2d scaled(Tuple2d v, double factor) {
        return new Vector2d(v.x * factor, v.y * factor);
    }

    public static Vector2d rotate(Tuple2d v, double cos, double sin) {
        return new Vector2d(v.x * cos - v.y * sin, v.x * sin + v.y * cos);
    }

    /**
     * @return z component of the cross product a × b
     */
    public static double cross(Tuple2d a, Tuple2d b) {
        return a.x * b.y - a.y * b.x;
    }

    public static double dot(Tuple2d a, Tuple2d b) {
        return a.x * b.x + a.y * b.y;
    }

    public static double length(Tuple2d v) {
        return Math.hypot(v.x, v.y);
    }

    public static double distance(Tuple2d a, Tuple2d b) {
        return Math.hypot(a.x - b.x, a.y - b.y);
    }

    public static double distanceSquared(Tuple2d a, Tuple2d b) {
        double dx = a.x - b.x;
        double dy = a.y - b.y;
        return dx * dx + dy * dy;
    }

    /**
     * Intersection point of the line segments p1-p2 and p3-p4.
     *
     * @return the intersection, or null when the segments are parallel or do not meet
     */
    public static Point2d linesIntersect(Tuple2d p1, Tuple2d p2, Tuple2d p3, Tuple2d p4) {
        double x1 = p1.x, y1 = p1.y, x2 = p2.x, y2 = p2.y;
        double x3 = p3.x, y3 = p3.y, x4 = p4.x, y4 = p4.y;
        // quick rejection by bounding boxes
        if (x3 > Math.max(x1, x2) && x4 > Math.max(x1, x2) || x3 < Math.min(x1, x2) && x4 < Math.min(x1, x2)
        || y3 > Math.max(y1, y2) && y4 > Math.max(y1, y2) || y3 < Math.min(y1, y2) && y4 < Math.min(y1, y2)) {
            return null;
        }
        double xi;
        double yi;
        boolean vertical1 = Math.abs(x2 - x1) < PARALLEL_TOLERANCE;
        boolean vertical2 = Math.abs(x4 - x3) < PARALLEL_TOLERANCE;
        if (vertical1 && vertical2) {
            return null;
        } else if (vertical1) {
            xi = x1;
            yi = (y4 - y3) / (x4 - x3) * (xi - x3) + y3;
        } else if (vertical2) {
            xi = x3;
            yi = (y2 - y1) / (x2 - x1) * (xi - x1) + y1;
        } else {
            double k1 = (y2 - y1) / (x2 - x1);
            double k2 = (y4 - y3) / (x4 - x3);
            if (Math.abs(k2 - k1) < PARALLEL_TOLERANCE) {
                return null;
            }
            if (Math.abs(k2) < PARALLEL_TOLERANCE) {
                yi = (y3 + y4) / 2;
                xi = (yi - y1) / k1 + x1;
            } else if (Math.abs(k1) < PARALLEL_TOLERANCE) {
                yi = (y1 + y2) / 2;
                xi = (yi - y3) / k2 + x3;
            } else {
                xi = (k2 * x3 - k1 * x1 - y3 + y1) / (k2 - k1);
                yi = k1 * (xi - x1) + y1;
            }
        }
        if (within(xi, x1, x2) && within(yi, y1, y2) && within(xi, x3, x4) && within(yi, y3, y4)) {
            return new Point2d(xi, yi);
        }
        return null;
    }

    /**
     * How far apart two impact points may be while still describing the same contact, given the radius of curvature
     * of each edge at the contact (infinite for straight edges, negative for concave ones).
     */
    public static double nearness(double r1, double r2, double distanceTol) {
        double r;
        if (r1 == Double.POSITIVE_INFINITY) {
            r = r2 > 0 ? r2 : r1;
        } else if (r2 == Double.POSITIVE_INFINITY) {
            r = r1 > 0 ? r1 : r2;
        } else if (r1 > 0 && r2 > 0) {
            r = Math.min(r1, r2);
        } else if (r1 < 0) {
            r = -r1;
        } else {
            r = -r2;
        }
        if (!(r > 0)) {
            throw new IllegalArgumentException("no usable radius from " + r1 + " and " + r2);
        }
        return r == Double.POSITIVE_INFINITY ? distanceTol : 2 * r * Math.sqrt(2 * distanceTol / r);
    }

    private static boolean within(double v, double a, double b) {
        return Math.min(a, b) - INTERSECT_TOLERANCE <= v && v <= Math.max(a, b) + INTERSECT_TOLERANCE;
    }
}
