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

import com.hellblazer.impetus.engine2d.geometry.CircularEdge;
import com.hellblazer.impetus.engine2d.geometry.Geometry;

import javax.vecmath.Vector2d;
import java.util.List;

/**
 * Collision and contact between two circular edges, at least one of them convex.
 * <p>
 * Only the current positions are examined. A fast collision between circles is caught by the vertices decorating
 * the arcs, which follow the old coordinates; once the binary search gets close in time this test takes over with
 * better precision.
 *
 * @author hal.hildebrand
 */
public final class CircleCircle {

    private CircleCircle() {
    }

    /**
     * Recomputes impact point, normal and distance from the current body positions.
     *
     * @param other        the circle of the primary body
     * @param normalCircle the circle of the normal body
     */
    public static void improveAccuracy(EdgeEdgeCollision rbc, CircularEdge other, CircularEdge normalCircle) {
        if (!normalCircle.isOutsideIsOut() && !other.isOutsideIsOut()) {
            return;
        }
        var normalBody = normalCircle.getBody();
        var cob = normalBody.worldToBody(other.getCenterWorld());
        var coe = normalCircle.bodyToEdge(cob);
        double len = coe.length();
        rbc.distance = gap(normalCircle, other, len);
        var ne = Geometry.scaled(coe, 1 / len);
        rbc.impact1 = normalCircle.edgeToWorld(Geometry.scaled(ne, normalCircle.getRadius()));
        if (!normalCircle.isOutsideIsOut()) {
            ne.negate();
        }
        rbc.setNormal(normalBody.rotateBodyToWorld(ne));
    }

    /**
     * Adds a contact when the circles are within the distance tolerance, or a collision when they overlap by less
     * than the depth of the arcs.
     */
    public static void testCollision(List<RigidBodyCollision> collisions, CircularEdge self, CircularEdge other,
                                     double time) {
        if (!self.isOutsideIsOut() && !other.isOutsideIsOut()) {
            return;
        }
        double distTol = self.getBody().getDistanceTol();
        if (self.isOutsideIsOut() && other.isOutsideIsOut()) {
            if (!other.isWithinArcWorld(self.getCenterWorld())) {
                return;
            }
            var coe = self.bodyToEdge(self.getBody().worldToBody(other.getCenterWorld()));
            if (!self.isWithinArc(coe)) {
                return;
            }
            double len = coe.length();
            double distance = len - (other.getRadius() + self.getRadius());
            if (distance > distTol) {
                return;
            }
            if (distance > 0) {
                addCollision(true, collisions, self, other, distance, len, coe, time);
                return;
            }
            if (distance < -Math.max(other.getDepth(), self.getDepth())) {
                return;
            }
            addCollision(false, collisions, self, other, distance, len, coe, time);
        } else {
            var convex = self.isOutsideIsOut() ? self : other;
            var concave = self.isOutsideIsOut() ? other : self;
            if (convex.getRadius() > concave.getRadius()) {
                return;
            }
            if (!convex.isWithinReflectedArcWorld(concave.getCenterWorld())) {
                return;
            }
            var cne = concave.bodyToEdge(concave.getBody().worldToBody(convex.getCenterWorld()));
            if (!concave.isWithinArc(cne)) {
                return;
            }
            double len = cne.length();
            double distance = concave.getRadius() - convex.getRadius() - len;
            if (distance > distTol) {
                return;
            }
            if (distance > 0) {
                addCollision(true, collisions, concave, convex, distance, len, cne, time);
                return;
            }
            if (distance < -convex.getDepth()) {
                return;
            }
            addCollision(false, collisions, concave, convex, distance, len, cne, time);
        }
    }

    private static double gap(CircularEdge normalCircle, CircularEdge other, double len) {
        if (normalCircle.isOutsideIsOut() && other.isOutsideIsOut()) {
            return len - (normalCircle.getRadius() + other.getRadius());
        } else if (other.isOutsideIsOut()) {
            return normalCircle.getRadius() - other.getRadius() - len;
        }
        return other.getRadius() - normalCircle.getRadius() - len;
    }

    private static void addCollision(boolean contact, List<RigidBodyCollision> collisions, CircularEdge self,
                                     CircularEdge other, double distance, double len, Vector2d coe, double time) {
        var rbc = new EdgeEdgeCollision(other, self);
        rbc.distance = distance;
        rbc.ballNormal = true;
        rbc.ballObject = true;
        var ne = Geometry.scaled(coe, 1 / len);
        rbc.impact1 = self.edgeToWorld(Geometry.scaled(ne, self.getRadius()));
        if (!self.isOutsideIsOut()) {
            ne.negate();
        }
        rbc.setNormal(self.getBody().rotateBodyToWorld(ne));
        rbc.radius1 = (other.isOutsideIsOut() ? 1 : -1) * other.getRadius();
        rbc.radius2 = (self.isOutsideIsOut() ? 1 : -1) * self.getRadius();
        if (contact) {
            rbc.radius1 += distance / 2;
            rbc.radius2 += distance / 2;
        }
        rbc.setDetectedTime(time);
        CollisionFinder.addCollision(collisions, rbc);
    }
}
