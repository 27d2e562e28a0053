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
import com.hellblazer.impetus.engine2d.geometry.Geometry;
import com.hellblazer.impetus.engine2d.geometry.Polygon;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;
import com.hellblazer.impetus.engine2d.geometry.Vertex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Vertex/edge collision detection between polygons, de-duplication of collision records and grouping of records into
 * connected subsets.
 * <p>
 * Penetration is found by following each vertex from its position at the start of the step (the bodies' old
 * coordinates) to its current position: if that path crosses an edge of the other body, the vertex collided with
 * that edge during the step. Vertices that did not cross any edge may still be in contact.
 *
 * @author hal.hildebrand
 */
public final class CollisionFinder {

    private static final Logger log = LoggerFactory.getLogger(CollisionFinder.class);

    private static final double SIMILAR_TIME        = 1e-14;
    private static final double MIN_TRAVEL_SQUARED  = 0.01;
    private static final double MIN_TRAVEL_DISTANCE = 0.1;

    private CollisionFinder() {
    }

    /**
     * Adds the collision unless a similar one is already known. Of two similar records the one detected later wins;
     * detected at the same time the deeper one wins. The whole list is always examined, because similarity is not
     * transitive: one record may displace several others. Joints are always added.
     *
     * @return true if the collision was added
     */
    public static boolean addCollision(List<RigidBodyCollision> collisions, RigidBodyCollision c2) {
        var removeMe = new ArrayList<RigidBodyCollision>();
        boolean shouldAdd = true;
        if (!c2.bilateral()) {
            if (!Double.isFinite(c2.getDistance())) {
                throw new IllegalStateException("distance is not finite " + c2);
            }
            for (var c1 : collisions) {
                if (!c2.similarTo(c1)) {
                    continue;
                }
                double time1 = c1.getDetectedTime();
                double time2 = c2.getDetectedTime();
                if (time1 > time2 + SIMILAR_TIME) {
                    shouldAdd = false;
                } else if (time2 > time1 + SIMILAR_TIME) {
                    removeMe.add(c1);
                } else if (c2.getDistance() < c1.getDistance()) {
                    removeMe.add(c1);
                } else {
                    shouldAdd = false;
                }
            }
        }
        collisions.removeAll(removeMe);
        if (shouldAdd) {
            collisions.add(c2);
        }
        return shouldAdd;
    }

    /**
     * Tests each vertex of body2 against the edges of body1.
     *
     * @throws IllegalStateException when only one of the bodies has saved old coordinates
     */
    public static void checkVertexes(List<RigidBodyCollision> collisions, Polygon body1, Polygon body2,
                                     double time) {
        var c = body2.worldToBody(body1.getCentroidWorld());
        var old1 = body1.getOldCoords();
        var old2 = body2.getOldCoords();
        if ((old1 == null) != (old2 == null)) {
            throw new IllegalStateException(
            "old coordinates saved for only one of " + body1.getName() + " and " + body2.getName());
        }
        for (var v2 : body2.getVertexes()) {
            var nowVertex = body1.worldToBody(body2.bodyToWorld(v2.locBody()));
            var oldVertex = nowVertex;
            double travelDistSqr = 0;
            if (old1 != null) {
                oldVertex = old1.worldToBody(old2.bodyToWorld(v2.locBody()));
                travelDistSqr = Geometry.distanceSquared(nowVertex, oldVertex);
            }
            double travelDist = travelDistSqr > MIN_TRAVEL_SQUARED ? Math.sqrt(travelDistSqr) : MIN_TRAVEL_DISTANCE;
            double maxRadius = body1.getCentroidRadius() + body1.getDistanceTol() + travelDist;
            if (Geometry.distanceSquared(v2.locBody(), c) > maxRadius * maxRadius) {
                continue;
            }
            testCollisionVertex(collisions, body1, v2, nowVertex, oldVertex, travelDist, time);
        }
    }

    /**
     * Broad phase: can the bounding circles of the bodies, enlarged by the swellage, overlap?
     */
    public static boolean intersectionPossible(RigidBody body1, RigidBody body2, double swellage) {
        double dist = Geometry.distanceSquared(body1.getCentroidWorld(), body2.getCentroidWorld());
        double a = body1.getCentroidRadius() + body2.getCentroidRadius() + swellage;
        return dist < a * a;
    }

    /**
     * @return the records connected to the first record of the superset through shared moveable bodies
     */
    public static List<RigidBodyCollision> subsetCollisions1(List<RigidBodyCollision> superset) {
        var subset = new ArrayList<RigidBodyCollision>();
        if (superset.isEmpty()) {
            return subset;
        }
        var start = superset.get(0);
        subset.add(start);
        var bodies = new HashSet<RigidBody>();
        addMoveable(bodies, start.getPrimaryBody());
        addMoveable(bodies, start.getNormalBody());
        int n;
        do {
            n = subset.size();
            for (var c : superset) {
                if (subset.contains(c)) {
                    continue;
                }
                if (bodies.contains(c.getPrimaryBody()) || bodies.contains(c.getNormalBody())) {
                    subset.add(c);
                    addMoveable(bodies, c.getPrimaryBody());
                    addMoveable(bodies, c.getNormalBody());
                }
            }
        } while (n < subset.size());
        return subset;
    }

    /**
     * The starting record plus the joints connected to its moveable bodies, transitively. With hybrid set, first
     * includes the non-joint records sharing a body with the starting record whose velocity is below the minimum.
     *
     * @param velocities  normal velocity of each record of the superset, by index
     * @param minVelocity records approaching faster than this are included in hybrid mode
     */
    public static List<RigidBodyCollision> subsetCollisions2(List<RigidBodyCollision> superset,
                                                             RigidBodyCollision startC, boolean hybrid,
                                                             double[] velocities, double minVelocity) {
        var subset = new ArrayList<RigidBodyCollision>();
        if (superset.isEmpty()) {
            return subset;
        }
        subset.add(startC);
        Set<RigidBody> bodies = new HashSet<>();
        addMoveable(bodies, startC.getPrimaryBody());
        addMoveable(bodies, startC.getNormalBody());
        if (hybrid) {
            for (int i = 0; i < superset.size(); i++) {
                var c = superset.get(i);
                if (subset.contains(c) || c.bilateral() || !(velocities[i] < minVelocity)) {
                    continue;
                }
                if (c.hasBody(startC.getPrimaryBody()) || c.hasBody(startC.getNormalBody())) {
                    subset.add(c);
                    bodies.add(c.getPrimaryBody());
                    bodies.add(c.getNormalBody());
                }
            }
        }
        int n;
        do {
            n = subset.size();
            for (var c : superset) {
                if (subset.contains(c) || !c.bilateral()) {
                    continue;
                }
                if (bodies.contains(c.getPrimaryBody()) || bodies.contains(c.getNormalBody())) {
                    subset.add(c);
                    addMoveable(bodies, c.getPrimaryBody());
                    addMoveable(bodies, c.getNormalBody());
                }
            }
        } while (n < subset.size());
        return subset;
    }

    private static void addMoveable(Set<RigidBody> bodies, RigidBody body) {
        if (body.isMoveable()) {
            bodies.add(body);
        }
    }

    private static void makeCollision(List<RigidBodyCollision> collisions, Edge edge, Vertex vertex, Point2d eBody,
                                      Point2d pBody, double time) {
        var normalBody = edge.getBody();
        var c = new CornerEdgeCollision(vertex, edge);
        c.setDistance(edge.distanceToLine(pBody));
        c.setImpact1(normalBody.bodyToWorld(eBody));
        c.setNormal(normalBody.rotateBodyToWorld(edge.getNormalBody(eBody)));
        double radius2 = edge.getCurvature(eBody);
        c.setRadius2(radius2);
        c.setBallNormal(Double.isFinite(radius2));
        c.setDetectedTime(time);
        addCollision(collisions, c);
    }

    /**
     * Tests one vertex of another body against the edges of body1. The vertex positions are in body1 coordinates, now
     * and at the start of the step.
     */
    private static void testCollisionVertex(List<RigidBodyCollision> collisions, Polygon body1, Vertex vertex2,
                                            Point2d vBody, Point2d vBodyOld, double travelDist, double time) {
        double distTol = body1.getDistanceTol();
        if (vBody.x < body1.getLeftBody() - distTol && vBodyOld.x < body1.getLeftBody()
        || vBody.x > body1.getRightBody() + distTol && vBodyOld.x > body1.getRightBody()
        || vBody.y < body1.getBottomBody() - distTol && vBodyOld.y < body1.getBottomBody()
        || vBody.y > body1.getTopBody() + distTol && vBodyOld.y > body1.getTopBody()) {
            return;
        }
        boolean moved = !vBody.equals(vBodyOld);
        Edge edge1 = null;
        Point2d e1Body = null;
        double distanceOld = Double.POSITIVE_INFINITY;
        for (var e1 : body1.getEdges()) {
            double maxRadius = e1.getCentroidRadius() + distTol + travelDist;
            if (Geometry.distanceSquared(e1.getCentroidBody(), vBody) > maxRadius * maxRadius) {
                continue;
            }
            var crossings = moved ? e1.intersection(vBody, vBodyOld) : List.<Point2d>of();
            if (crossings.isEmpty()) {
                if (!vertex2.isEndPoint()) {
                    continue;
                }
                var c = e1.findVertexContact(vertex2, vBody, distTol);
                if (c != null) {
                    c.setDetectedTime(time);
                    addCollision(collisions, c);
                }
                continue;
            }
            for (var r1b : crossings) {
                double d = Geometry.distance(vBodyOld, r1b);
                if (d < distanceOld) {
                    distanceOld = d;
                    e1Body = r1b;
                    edge1 = e1;
                }
            }
        }
        if (edge1 != null) {
            makeCollision(collisions, edge1, vertex2, e1Body, vBody, time);
        } else if (log.isTraceEnabled() && body1.probablyPointInside(vBody)) {
            log.trace("vertex {} of {} inside {} without crossing an edge, v: {} old: {}", vertex2.getId(),
                      vertex2.getBody().getName(), body1.getName(), vBody, vBodyOld);
        }
    }
}
