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

import com.hellblazer.impetus.engine2d.collision.EdgeEdgeCollision;
import com.hellblazer.impetus.engine2d.collision.RigidBodyCollision;

import javax.vecmath.Point2d;
import javax.vecmath.Tuple2d;
import javax.vecmath.Vector2d;
import java.util.List;

/**
 * One segment of the outline of a {@link Polygon}, from {@link #getVertex1()} to {@link #getVertex2()}. Edges are
 * fixed in body coordinates; every point argument and result is in body coordinates unless named otherwise.
 * <p>
 * Distances are signed: positive outside the body, negative inside.
 *
 * @author hal.hildebrand
 */
public abstract sealed class Edge permits StraightEdge, CircularEdge {

    /**
     * The nearest point on an edge and the outward normal there, both in body coordinates.
     */
    public record EdgePoint(Point2d point, Vector2d normal) {
    }

    protected final Polygon body;
    protected final Vertex  vertex1;
    protected final int     index;
    protected       Vertex  vertex2;
    protected       Point2d centroidBody;
    protected       double  centroidRadius = Double.NaN;
    private         Point2d centroidWorld;

    protected Edge(Polygon body, Vertex vertex1, Vertex vertex2) {
        this.body = body;
        this.vertex1 = vertex1;
        this.vertex2 = vertex2;
        this.index = body.getEdges().size();
        this.centroidBody = Geometry.midpoint(vertex1.locBody(), vertex2.locBody());
    }

    /**
     * Error of approximating the edge by the chords between its decorated vertices.
     */
    public abstract double chordError();

    /**
     * Signed distance from the point to the edge extended to infinity (a line, or a full circle).
     */
    public abstract double distanceToLine(Point2d p);

    /**
     * Signed distance from the point to the edge, infinite when the point is not within the region perpendicular to
     * the edge.
     */
    public abstract double distanceToPoint(Point2d p);

    /**
     * Contact between the vertex of another body, located at the given body coordinates point, and this edge.
     *
     * @return the contact, or null when the vertex is not within the distance tolerance
     */
    public abstract RigidBodyCollision findVertexContact(Vertex v, Point2d p, double distanceTol);

    public abstract double getBottomBody();

    public abstract double getLeftBody();

    public abstract double getRightBody();

    public abstract double getTopBody();

    /**
     * Radius of curvature at the point: infinite for straight edges, negative when concave.
     */
    public abstract double getCurvature(Point2d p);

    public abstract Vector2d getNormalBody(Point2d p);

    public abstract EdgePoint getPointOnEdge(Point2d p);

    /**
     * Recomputes distance, impact point and normal of an edge to edge collision from the current positions.
     */
    public abstract void improveAccuracyEdge(EdgeEdgeCollision collision, Edge other);

    /**
     * Points where the segment p1-p2 crosses this edge.
     *
     * @return the crossings, empty when there are none
     */
    public abstract List<Point2d> intersection(Point2d p1, Point2d p2);

    public abstract boolean isStraight();

    public abstract double maxDistanceTo(Point2d p);

    /**
     * Adds the edge to edge collisions and contacts between this edge and the other body's edge.
     */
    public abstract void testCollisionEdge(List<RigidBodyCollision> collisions, Edge other, double time);

    public List<Vertex> getDecoratedVertexes() {
        return List.of();
    }

    public Polygon getBody() {
        return body;
    }

    public Vertex getVertex1() {
        return vertex1;
    }

    public Vertex getVertex2() {
        return vertex2;
    }

    public int getIndex() {
        return index;
    }

    public Point2d getCentroidBody() {
        return new Point2d(centroidBody);
    }

    public double getCentroidRadius() {
        if (Double.isNaN(centroidRadius)) {
            centroidRadius = 1.25 * maxDistanceTo(centroidBody);
        }
        return centroidRadius;
    }

    public Point2d getCentroidWorld() {
        if (centroidWorld == null) {
            centroidWorld = body.bodyToWorld(centroidBody);
        }
        return centroidWorld;
    }

    /**
     * Forgets cached world positions, called when the body moves.
     */
    public void forgetPosition() {
        centroidWorld = null;
    }

    /**
     * Broad phase test: whether the circles bounding the two edges, enlarged by the swellage, overlap.
     */
    public boolean intersectionPossible(Edge other, double swellage) {
        double r = other.getCentroidRadius() + getCentroidRadius() + swellage;
        return Geometry.distanceSquared(getCentroidWorld(), other.getCentroidWorld()) < r * r;
    }

    /**
     * @return the point moved the given length along the normal of this edge
     */
    public Point2d pointOffset(Point2d p, double length) {
        return Geometry.offset(p, getNormalBody(p), length);
    }

    void setVertex2(Vertex vertex) {
        this.vertex2 = vertex;
    }

    protected static boolean isVertical(Tuple2d a, Tuple2d b) {
        return Math.abs(b.x - a.x) < 1e-10;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{index=" + index + ", body=" + body.getName() + ", v1="
        + vertex1.locBody() + ", v2=" + vertex2.locBody() + "}";
    }
}
