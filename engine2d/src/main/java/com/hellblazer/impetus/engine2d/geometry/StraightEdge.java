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

import com.hellblazer.impetus.engine2d.collision.CornerCornerCollision;
import com.hellblazer.impetus.engine2d.collision.CornerEdgeCollision;
import com.hellblazer.impetus.engine2d.collision.EdgeEdgeCollision;
import com.hellblazer.impetus.engine2d.collision.RigidBodyCollision;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.List;

/**
 * Straight line segment. The outside of the body is on the side given by {@code outsideIsUp}: above the line, or to
 * the right of a vertical line.
 *
 * @author hal.hildebrand
 */
public final class StraightEdge extends Edge {

    private static final double MIN_VERTEX_DISTANCE = 1e-6;
    private static final double VERTEX_VERTEX_RATIO = 0.6;

    private final boolean outsideIsUp;

    StraightEdge(Polygon body, Vertex vertex1, Vertex vertex2, boolean outsideIsUp) {
        super(body, vertex1, vertex2);
        this.outsideIsUp = outsideIsUp;
        vertex1.setEdge2(this);
        vertex2.setEdge1(this);
    }

    public boolean isOutsideIsUp() {
        return outsideIsUp;
    }

    @Override
    public double chordError() {
        return 0;
    }

    @Override
    public double distanceToLine(Point2d p) {
        double r = Geometry.dot(Geometry.between(projectionOntoLine(p), p), getNormalBody(p));
        if (Double.isNaN(r)) {
            throw new IllegalStateException("distance to line is NaN for " + p + " " + this);
        }
        return r;
    }

    @Override
    public double distanceToPoint(Point2d p) {
        var q = projectionOntoLine(p);
        if (outsideSegment(q)) {
            return Double.POSITIVE_INFINITY;
        }
        return Geometry.dot(Geometry.between(q, p), getNormalBody(p));
    }

    @Override
    public RigidBodyCollision findVertexContact(Vertex v, Point2d p, double distanceTol) {
        var q = projectionOntoLine(p);
        if (outsideSegment(q)) {
            return checkVertexVertex(v, p, distanceTol);
        }
        var normal = getNormalBody(p);
        double dist = Geometry.dot(Geometry.between(q, p), normal);
        if (dist < 0 || dist > distanceTol) {
            return null;
        }
        var c = new CornerEdgeCollision(v, this);
        c.setDistance(dist);
        c.setImpact1(body.bodyToWorld(q));
        c.setNormal(body.rotateBodyToWorld(normal));
        c.setBallNormal(false);
        c.setRadius2(Double.POSITIVE_INFINITY);
        return c;
    }

    @Override
    public double getBottomBody() {
        return Math.min(vertex1.locBody().y, vertex2.locBody().y);
    }

    @Override
    public double getLeftBody() {
        return Math.min(vertex1.locBody().x, vertex2.locBody().x);
    }

    @Override
    public double getRightBody() {
        return Math.max(vertex1.locBody().x, vertex2.locBody().x);
    }

    @Override
    public double getTopBody() {
        return Math.max(vertex1.locBody().y, vertex2.locBody().y);
    }

    @Override
    public double getCurvature(Point2d p) {
        return Double.POSITIVE_INFINITY;
    }

    @Override
    public Vector2d getNormalBody(Point2d p) {
        var p1 = vertex1.locBody();
        var p2 = vertex2.locBody();
        double sign = outsideIsUp ? 1 : -1;
        if (isVertical(p1, p2)) {
            return new Vector2d(sign, 0);
        }
        if (Math.abs(p2.y - p1.y) < 1e-10) {
            return new Vector2d(0, sign);
        }
        double k = (p2.y - p1.y) / (p2.x - p1.x);
        double d = Math.sqrt(1 + k * k);
        return new Vector2d(sign * -k / d, sign / d);
    }

    @Override
    public EdgePoint getPointOnEdge(Point2d p) {
        return new EdgePoint(projectionOntoLine(p), getNormalBody(p));
    }

    @Override
    public void improveAccuracyEdge(EdgeEdgeCollision collision, Edge other) {
        // straight edges only meet other straight edges through their vertices
        if (!other.isStraight()) {
            other.improveAccuracyEdge(collision, this);
        }
    }

    @Override
    public List<Point2d> intersection(Point2d p1, Point2d p2) {
        if (p1.equals(p2)) {
            return List.of();
        }
        var q = Geometry.linesIntersect(vertex1.locBody(), vertex2.locBody(), p1, p2);
        return q == null ? List.of() : List.of(q);
    }

    @Override
    public boolean intersectionPossible(Edge other, double swellage) {
        return !other.isStraight() && super.intersectionPossible(other, swellage);
    }

    @Override
    public boolean isStraight() {
        return true;
    }

    @Override
    public double maxDistanceTo(Point2d p) {
        return Math.max(vertex1.locBody().distance(p), vertex2.locBody().distance(p));
    }

    /**
     * @return the nearest point to p on the infinite line through this edge
     */
    public Point2d projectionOntoLine(Point2d p) {
        var p1 = vertex1.locBody();
        var p2 = vertex2.locBody();
        if (isVertical(p1, p2)) {
            return new Point2d(p1.x, p.y);
        }
        if (Math.abs(p2.y - p1.y) < 1e-10) {
            return new Point2d(p.x, p1.y);
        }
        double k = (p2.y - p1.y) / (p2.x - p1.x);
        double qx = (-p1.y + p.y + p.x / k + k * p1.x) / (1 / k + k);
        return new Point2d(qx, p1.y + k * (qx - p1.x));
    }

    @Override
    public void testCollisionEdge(List<RigidBodyCollision> collisions, Edge other, double time) {
        if (!other.isStraight()) {
            other.testCollisionEdge(collisions, this, time);
        }
    }

    private boolean outsideSegment(Point2d q) {
        var p1 = vertex1.locBody();
        var p2 = vertex2.locBody();
        if (isVertical(p1, p2)) {
            return q.y < Math.min(p1.y, p2.y) || q.y > Math.max(p1.y, p2.y);
        }
        return q.x < Math.min(p1.x, p2.x) || q.x > Math.max(p1.x, p2.x);
    }

    /**
     * A vertex beyond the ends of this edge may still be close to one of its end points.
     */
    private RigidBodyCollision checkVertexVertex(Vertex v, Point2d p, double distanceTol) {
        for (var mine : List.of(vertex1, vertex2)) {
            double dist = mine.locBody().distance(p);
            if (dist >= MIN_VERTEX_DISTANCE && dist <= VERTEX_VERTEX_RATIO * distanceTol) {
                return makeVertexVertex(mine, v, p, dist);
            }
        }
        return null;
    }

    private RigidBodyCollision makeVertexVertex(Vertex mine, Vertex other, Point2d p, double dist) {
        var normal = Geometry.between(mine.locBody(), p);
        normal.scale(1 / dist);
        var c = new CornerCornerCollision(other, mine);
        c.setDistance(dist);
        c.setImpact1(body.bodyToWorld(mine.locBody()));
        c.setNormal(body.rotateBodyToWorld(normal));
        c.setBallObject(false);
        c.setRadius1(Double.NaN);
        c.setBallNormal(true);
        c.setRadius2(dist);
        return c.contact() ? c : null;
    }
}
