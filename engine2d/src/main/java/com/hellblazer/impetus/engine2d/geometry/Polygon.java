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

import com.hellblazer.impetus.engine2d.collision.CollisionFinder;
import com.hellblazer.impetus.engine2d.collision.RigidBodyCollision;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rigid body outlined by one or more closed paths of straight and circular edges.
 * <p>
 * Construction: {@link #startPath(Point2d)}, then edges added with {@link #addStraightEdge} and
 * {@link #addCircularEdge}, each starting where the previous one ended; {@link #closePath()} joins the end of the path
 * to its start. Several paths may be added, for example the inside of a frame. {@link #finish()} closes any open path
 * and computes the bounds, a default center of mass at the middle of the bounds, a default moment for a rectangle,
 * and the enclosing centroid circle used in proximity tests.
 *
 * @author hal.hildebrand
 */
public final class Polygon extends RigidBody {

    private static final double CLOSE_TOLERANCE = 1e-8;

    private final List<Vertex> vertexes = new ArrayList<>();
    private final List<Edge>   edges    = new ArrayList<>();
    private final List<Vertex> paths    = new ArrayList<>();
    private       Vertex       startVertex;
    private       Vertex       lastVertex;
    private       boolean      finished;
    private       int          vertexIds;
    private       double       left;
    private       double       right;
    private       double       bottom;
    private       double       top;
    private       Point2d      centroidBody;
    private       double       centroidRadius = Double.NaN;
    private       double       minHeight      = Double.NaN;

    public Polygon(String name) {
        super(name);
    }

    public void startPath(Point2d p) {
        checkOpen();
        if (startVertex != null) {
            throw new IllegalStateException("there is already an open path in " + getName());
        }
        startVertex = new Vertex(p, nextVertexId());
        lastVertex = startVertex;
        vertexes.add(startVertex);
    }

    public void startPath(double x, double y) {
        startPath(new Point2d(x, y));
    }

    /**
     * Adds a straight edge from the end of the open path to the point.
     *
     * @param outsideIsUp whether points above the edge, or right of a vertical edge, are outside the body
     */
    public StraightEdge addStraightEdge(Point2d end, boolean outsideIsUp) {
        var edge = new StraightEdge(this, lastOpenVertex(), new Vertex(end, nextVertexId()), outsideIsUp);
        addEdge(edge);
        return edge;
    }

    public StraightEdge addStraightEdge(double x, double y, boolean outsideIsUp) {
        return addStraightEdge(new Point2d(x, y), outsideIsUp);
    }

    /**
     * Adds a circular arc from the end of the open path to the point.
     *
     * @param clockwise    direction of travel around the center
     * @param outsideIsOut whether points outside the circle are outside the body, that is the arc is convex
     */
    public CircularEdge addCircularEdge(Point2d end, Point2d center, boolean clockwise, boolean outsideIsOut) {
        return addCircularEdge(end, center, clockwise, outsideIsOut, CircularEdge.DEFAULT_SPACING);
    }

    public CircularEdge addCircularEdge(Point2d end, Point2d center, boolean clockwise, boolean outsideIsOut,
                                        double spacing) {
        var edge = new CircularEdge(this, lastOpenVertex(), new Vertex(end, nextVertexId()), center, clockwise,
                                    outsideIsOut, spacing);
        addEdge(edge);
        return edge;
    }

    /**
     * Joins the end of the open path to its start vertex, which must be at the same location.
     *
     * @return whether a path was closed
     */
    public boolean closePath() {
        checkOpen();
        if (startVertex == null || lastVertex == startVertex) {
            return false;
        }
        if (startVertex.locBody().distance(lastVertex.locBody()) > CLOSE_TOLERANCE) {
            throw new IllegalStateException(
            "path of " + getName() + " does not end at its start: " + startVertex + " " + lastVertex);
        }
        var lastEdge = lastVertex.getEdge1();
        startVertex.setEdge1(lastEdge);
        lastEdge.setVertex2(startVertex);
        vertexes.remove(lastVertex);
        paths.add(startVertex);
        startVertex = null;
        lastVertex = null;
        return true;
    }

    public void finish() {
        checkOpen();
        if (startVertex != null) {
            closePath();
        }
        if (edges.isEmpty()) {
            throw new IllegalStateException("polygon " + getName() + " has no edges");
        }
        finished = true;
        left = edges.stream().mapToDouble(Edge::getLeftBody).min().orElseThrow();
        right = edges.stream().mapToDouble(Edge::getRightBody).max().orElseThrow();
        bottom = edges.stream().mapToDouble(Edge::getBottomBody).min().orElseThrow();
        top = edges.stream().mapToDouble(Edge::getTopBody).max().orElseThrow();
        double w = right - left;
        double h = top - bottom;
        setCenterOfMass(left + w / 2, bottom + h / 2);
        setMomentAboutCM((w * w + h * h) / 12);
        setCentroid(new Point2d(left + w / 2, bottom + h / 2));
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * Sets the center of the circle enclosing the body; its radius is computed to enclose every vertex and the chord
     * error of the curved edges.
     */
    public Polygon setCentroid(Point2d centroid) {
        if (startVertex != null) {
            throw new IllegalStateException("setCentroid called while creating " + getName());
        }
        centroidBody = new Point2d(centroid);
        centroidRadius = Math.sqrt(maxRadiusSquared(centroid));
        return this;
    }

    @Override
    public void checkCollision(List<RigidBodyCollision> collisions, RigidBody other, double time) {
        if (!(other instanceof Polygon body)) {
            return;
        }
        checkFinished();
        CollisionFinder.checkVertexes(collisions, this, body, time);
        CollisionFinder.checkVertexes(collisions, body, this, time);
        for (var e1 : edges) {
            for (var e2 : body.getEdges()) {
                if (e1.intersectionPossible(e2, getDistanceTol())) {
                    e1.testCollisionEdge(collisions, e2, time);
                }
            }
        }
    }

    @Override
    public double getBottomBody() {
        checkFinished();
        return bottom;
    }

    @Override
    public double getLeftBody() {
        checkFinished();
        return left;
    }

    @Override
    public double getRightBody() {
        checkFinished();
        return right;
    }

    @Override
    public double getTopBody() {
        checkFinished();
        return top;
    }

    public double getWidth() {
        return getRightBody() - getLeftBody();
    }

    public double getHeight() {
        return getTopBody() - getBottomBody();
    }

    @Override
    public Point2d getCentroidBody() {
        checkFinished();
        return new Point2d(centroidBody);
    }

    @Override
    public double getCentroidRadius() {
        checkFinished();
        return centroidRadius;
    }

    @Override
    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    @Override
    public List<Vertex> getVertexes() {
        return Collections.unmodifiableList(vertexes);
    }

    /**
     * @return start vertex of each closed path
     */
    public List<Vertex> getPaths() {
        return Collections.unmodifiableList(paths);
    }

    @Override
    public double getMinHeight() {
        if (Double.isNaN(minHeight)) {
            double dist = Double.POSITIVE_INFINITY;
            for (var e : edges) {
                double d = e.distanceToPoint(cmBody);
                if (d == Double.POSITIVE_INFINITY) {
                    continue;
                }
                if (d > 0) {
                    // center of mass outside of this edge, the shape is too complex to say
                    dist = 0;
                    break;
                }
                dist = Math.min(dist, -d);
            }
            if (dist == Double.POSITIVE_INFINITY) {
                dist = Math.min(Math.min(cmBody.y - bottom, right - cmBody.x),
                                Math.min(top - cmBody.y, cmBody.x - left));
            }
            minHeight = dist;
        }
        return minHeight;
    }

    /**
     * A point is probably inside when it is inside of every edge extended to a line; exact for convex polygons.
     */
    public boolean probablyPointInside(Point2d pBody) {
        return edges.stream().noneMatch(e -> e.distanceToLine(pBody) > 0);
    }

    int nextVertexId() {
        return vertexIds++;
    }

    @Override
    protected void clearMinHeight() {
        minHeight = Double.NaN;
    }

    @Override
    protected void forgetPosition() {
        edges.forEach(Edge::forgetPosition);
    }

    private void addEdge(Edge edge) {
        edges.add(edge);
        vertexes.addAll(edge.getDecoratedVertexes());
        vertexes.add(edge.getVertex2());
        lastVertex = edge.getVertex2();
    }

    private Vertex lastOpenVertex() {
        checkOpen();
        if (startVertex == null) {
            throw new IllegalStateException(getName() + " does not have an open path to add edges to");
        }
        return lastVertex;
    }

    private double maxRadiusSquared(Point2d p) {
        double maxR = vertexes.stream().mapToDouble(v -> p.distance(v.locBody())).max().orElse(0);
        maxR += edges.stream().mapToDouble(Edge::chordError).max().orElse(0);
        return maxR * maxR;
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("construction of " + getName() + " is finished");
        }
    }

    private void checkFinished() {
        if (!finished) {
            throw new IllegalStateException("construction of " + getName() + " is not finished");
        }
    }
}
