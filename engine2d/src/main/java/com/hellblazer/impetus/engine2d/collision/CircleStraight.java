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
import com.hellblazer.impetus.engine2d.geometry.StraightEdge;

import javax.vecmath.Point2d;
import java.util.List;

/**
 * Collision and contact between a convex circular edge and a straight edge. The circle is the primary edge, the
 * straight edge provides the normal.
 *
 * @author hal.hildebrand
 */
public final class CircleStraight {

    private CircleStraight() {
    }

    /**
     * Recomputes impact point, normal and distance from the current body positions.
     */
    public static void improveAccuracy(EdgeEdgeCollision rbc, CircularEdge circle, StraightEdge straight) {
        var straightBody = straight.getBody();
        var cb = straightBody.worldToBody(circle.getCenterWorld());
        var pb2 = straight.pointOffset(cb, -circle.getRadius());
        var pb = rbc.contact() ? straight.projectionOntoLine(cb) : pb2;
        rbc.distance = straight.distanceToLine(pb2);
        rbc.impact1 = straightBody.bodyToWorld(pb);
        rbc.setNormal(straightBody.rotateBodyToWorld(straight.getNormalBody(pb)));
    }

    /**
     * Adds a contact when the circle is within the distance tolerance of the straight edge, or a collision when the
     * nearest point of the circle crossed the straight edge during the step.
     */
    public static void testCollision(List<RigidBodyCollision> collisions, StraightEdge straight,
                                     CircularEdge circle, double time) {
        if (!circle.isOutsideIsOut()) {
            return;
        }
        var straightBody = straight.getBody();
        var cb = straightBody.worldToBody(circle.getCenterWorld());
        var pb = straight.pointOffset(cb, -circle.getRadius());
        var pw = straightBody.bodyToWorld(pb);
        double dist = straight.distanceToLine(pb);
        if (dist > 0) {
            if (dist > straightBody.getDistanceTol()) {
                return;
            }
            if (straight.distanceToPoint(pb) == Double.POSITIVE_INFINITY) {
                return;
            }
            if (!circle.isWithinArcWorld(pw)) {
                return;
            }
            pb = straight.projectionOntoLine(cb);
            pw = straightBody.bodyToWorld(pb);
            addCollision(true, collisions, straight, circle, dist, pw, pb, time);
            return;
        }
        var circleBody = circle.getBody();
        var circleOld = circleBody.getOldCoords();
        var straightOld = straightBody.getOldCoords();
        if (circleOld == null || straightOld == null) {
            if (circleOld != null || straightOld != null) {
                throw new IllegalStateException(
                "old coordinates saved for only one of " + circleBody.getName() + " and " + straightBody.getName());
            }
            return;
        }
        // nearest point of the circle at the start of the step, kept within the arc
        var cw0 = circleOld.bodyToWorld(circle.getCenterBody());
        var cb0 = straightOld.worldToBody(cw0);
        var pb0 = straight.pointOffset(cb0, -circle.getRadius());
        var pcb0 = circle.nearestPointByAngle(circleOld.worldToBody(straightOld.bodyToWorld(pb0)));
        pb0 = straightOld.worldToBody(circleOld.bodyToWorld(pcb0));
        if (straight.distanceToLine(pb0) < 0) {
            return;
        }
        if (!circle.isWithinArcWorld(pw)) {
            return;
        }
        if (straight.intersection(pb, pb0).isEmpty()) {
            return;
        }
        addCollision(false, collisions, straight, circle, dist, pw, pb, time);
    }

    private static void addCollision(boolean contact, List<RigidBodyCollision> collisions, StraightEdge straight,
                                     CircularEdge circle, double dist, Point2d pw, Point2d pb, double time) {
        var rbc = new EdgeEdgeCollision(circle, straight);
        rbc.ballNormal = false;
        rbc.ballObject = true;
        rbc.radius1 = circle.getRadius() + (contact ? dist : 0);
        rbc.radius2 = Double.POSITIVE_INFINITY;
        rbc.distance = dist;
        rbc.impact1 = new Point2d(pw);
        rbc.setNormal(straight.getBody().rotateBodyToWorld(straight.getNormalBody(pb)));
        rbc.setDetectedTime(time);
        CollisionFinder.addCollision(collisions, rbc);
    }
}
