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

import com.hellblazer.impetus.common.Util;
import com.hellblazer.impetus.engine2d.collision.CircleCircle;
import com.hellblazer.impetus.engine2d.collision.CircleStraight;
import com.hellblazer.impetus.engine2d.collision.CornerEdgeCollision;
import com.hellblazer.impetus.engine2d.collision.EdgeEdgeCollision;
import com.hellblazer.impetus.engine2d.collision.RigidBodyCollision;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arc of a circle, convex when {@code outsideIsOut} and concave otherwise. The arc runs from vertex1 to vertex2 around
 * the center, clockwise or counter-clockwise; equal end points make a complete circle.
 * <p>
 * Angles are measured in edge coordinates, which are body coordinates translated so the center is the origin. The arc
 * covers the angles from {@link #getAngleLow()} to {@link #getAngleHigh()}, where low is in (-π, π] and high is
 * greater than low by at most 2π.
 *
 * @author hal.hildebrand
 */
public final class CircularEdge extends Edge {

    public static final double DEFAULT_SPACING = 0.3;

    private static final double FULL_CIRCLE_TOLERANCE = 1e-6;

    private final Point2d      center;
    private final double       radius;
    private final boolean      clockwise;
    private final boolean      outsideIsOut;
    private final double       angleLow;
    private final double       angleHigh;
    private final double       depth;
    private final double       decoratedAngle;
    private final boolean      completeCircle;
    private final List<Vertex> decoratedVertexes;

    CircularEdge(Polygon body, Vertex vertex1, Vertex vertex2, Point2d center, boolean clockwise,
                 boolean outsideIsOut, double spacing) {
        super(body, vertex1, vertex2);
        this.center = new Point2d(center);
        this.outsideIsOut = outsideIsOut;
        this.clockwise = clockwise;
        this.radius = center.distance(vertex1.locBody());
        double r2 = center.distance(vertex2.locBody());
        if (Math.abs(radius - r2) > Util.TINY_POSITIVE) {
            throw new IllegalArgumentException(
            "center " + center + " is not equidistant from " + vertex1.locBody() + " and " + vertex2.locBody());
        }
        double startAngle = angleOf(Geometry.between(center, vertex1.locBody()));
        double finishAngle = angleOf(Geometry.between(center, vertex2.locBody()));
        if (Math.abs(startAngle - finishAngle) < Util.TINY_POSITIVE) {
            finishAngle = startAngle + 2 * Math.PI;
        }
        var lowHigh = findAngleLowHigh(startAngle, finishAngle, clockwise);
        angleLow = lowHigh[0];
        angleHigh = lowHigh[1];
        double arc = angleHigh - angleLow;
        depth = findDepth(arc, radius);

        int n = (int) Math.max(Math.ceil(arc / (Math.PI / 4)), Math.ceil(arc * radius / spacing));
        decoratedAngle = arc / n;
        var decorated = new ArrayList<Vertex>(n);
        for (int i = 1; i < n; i++) {
            double angle = clockwise ? angleHigh - i * decoratedAngle : angleLow + i * decoratedAngle;
            decorated.add(new Vertex(angleToBody(angle), this, body.nextVertexId()));
        }
        decoratedVertexes = Collections.unmodifiableList(decorated);
        vertex1.setEdge2(this);
        vertex2.setEdge1(this);

        if (arc >= Math.PI) {
            centroidBody = new Point2d(center);
            centroidRadius = radius;
        } else {
            centroidRadius = centroidBody.distance(vertex1.locBody());
        }
        if (!outsideIsOut) {
            centroidRadius *= 1.2;
        }
        completeCircle = Math.abs(2 * Math.PI - arc) < FULL_CIRCLE_TOLERANCE;
    }

    /**
     * @return {low, high} angles of the arc, with low &lt; high
     */
    static double[] findAngleLowHigh(double start, double finish, boolean clockwise) {
        double low;
        double high;
        if (Math.abs(start - finish) < Util.TINY_POSITIVE) {
            low = start;
            high = low + 2 * Math.PI;
        } else if (Math.abs(Math.abs(start - finish) - 2 * Math.PI) < Util.TINY_POSITIVE) {
            low = Math.min(start, finish);
            high = low + 2 * Math.PI;
        } else if (start > finish) {
            if (clockwise) {
                low = finish;
                high = start;
            } else {
                low = start;
                high = finish + 2 * Math.PI;
            }
        } else if (clockwise) {
            low = finish;
            high = start + 2 * Math.PI;
        } else {
            low = start;
            high = finish;
        }
        return new double[] { low, high };
    }

    /**
     * Distance between the middle of a chord spanning the given angle and the middle of its arc, scaled so a full
     * circle is well covered.
     */
    static double findDepth(double angle, double radius) {
        double d1 = Math.sin(angle / 2) - Math.sin(angle) / 2;
        double d2 = Math.cos(angle / 2) - (1 + Math.cos(angle)) / 2;
        return radius * Math.sqrt(d1 * d1 + d2 * d2);
    }

    static boolean isWithinArc(Vector2d pEdge, double low, double high) {
        double angle = angleOf(pEdge);
        if (angle < low) {
            angle += 2 * Math.PI;
        }
        return low <= angle && angle <= high;
    }

    private static double angleOf(Vector2d v) {
        return Math.atan2(v.y, v.x);
    }

    public Point2d getCenterBody() {
        return new Point2d(center);
    }

    public Point2d getCenterWorld() {
        return body.bodyToWorld(center);
    }

    public double getRadius() {
        return radius;
    }

    public boolean isOutsideIsOut() {
        return outsideIsOut;
    }

    public boolean isClockwise() {
        return clockwise;
    }

    public double getAngleLow() {
        return angleLow;
    }

    public double getAngleHigh() {
        return angleHigh;
    }

    public double getDepth() {
        return depth;
    }

    public boolean isCompleteCircle() {
        return completeCircle;
    }

    public Vector2d bodyToEdge(Point2d p) {
        return Geometry.between(center, p);
    }

    public Point2d edgeToBody(Vector2d pEdge) {
        return new Point2d(center.x + pEdge.x, center.y + pEdge.y);
    }

    public Point2d edgeToWorld(Vector2d pEdge) {
        return body.bodyToWorld(edgeToBody(pEdge));
    }

    public Point2d angleToBody(double angle) {
        return edgeToBody(new Vector2d(radius * Math.cos(angle), radius * Math.sin(angle)));
    }

    @Override
    public double chordError() {
        return radius * (1 - Math.sqrt(1 - decoratedAngle * decoratedAngle / 4.0));
    }

    @Override
    public double distanceToLine(Point2d p) {
        return sign() * (bodyToEdge(p).length() - radius);
    }

    @Override
    public double distanceToPoint(Point2d p) {
        var pEdge = bodyToEdge(p);
        return isWithinArc(pEdge) ? sign() * (pEdge.length() - radius) : Double.POSITIVE_INFINITY;
    }

    @Override
    public RigidBodyCollision findVertexContact(Vertex v, Point2d p, double distanceTol) {
        var pEdge = bodyToEdge(p);
        if (!isWithinArc(pEdge)) {
            return null;
        }
        double h = pEdge.length();
        double dist = sign() * (h - radius);
        if (dist < 0 || dist > distanceTol) {
            return null;
        }
        if (h < Util.TINY_POSITIVE) {
            throw new IllegalStateException("cannot get normal for point at center of circle " + this);
        }
        var c = new CornerEdgeCollision(v, this);
        c.setDistance(dist);
        var ne = Geometry.scaled(pEdge, sign() / h);
        c.setNormal(body.rotateBodyToWorld(ne));
        double radius2 = sign() * radius + dist;
        c.setRadius2(radius2);
        c.setImpact1(edgeToWorld(Geometry.scaled(ne, radius2)));
        c.setBallNormal(true);
        c.setRadius1(v.getCurvature());
        return c;
    }

    @Override
    public double getBottomBody() {
        return containsAngle(-Math.PI / 2) ? center.y - radius
                                           : Math.min(vertex1.locBody().y, vertex2.locBody().y);
    }

    @Override
    public double getLeftBody() {
        return containsAngle(Math.PI) ? center.x - radius : Math.min(vertex1.locBody().x, vertex2.locBody().x);
    }

    @Override
    public double getRightBody() {
        return containsAngle(0) ? center.x + radius : Math.max(vertex1.locBody().x, vertex2.locBody().x);
    }

    @Override
    public double getTopBody() {
        return containsAngle(Math.PI / 2) ? center.y + radius : Math.max(vertex1.locBody().y, vertex2.locBody().y);
    }

    @Override
    public double getCurvature(Point2d p) {
        return sign() * radius;
    }

    @Override
    public List<Vertex> getDecoratedVertexes() {
        return decoratedVertexes;
    }

    @Override
    public Vector2d getNormalBody(Point2d p) {
        var pEdge = bodyToEdge(p);
        double h = pEdge.length();
        if (h < Util.TINY_POSITIVE) {
            throw new IllegalStateException("cannot get normal at center point " + p + " of " + this);
        }
        return Geometry.scaled(pEdge, sign() / h);
    }

    @Override
    public EdgePoint getPointOnEdge(Point2d p) {
        var n = getNormalBody(p);
        return new EdgePoint(edgeToBody(Geometry.scaled(n, sign() * radius)), n);
    }

    @Override
    public void improveAccuracyEdge(EdgeEdgeCollision collision, Edge other) {
        if (other instanceof StraightEdge straight) {
            CircleStraight.improveAccuracy(collision, this, straight);
        } else if (other instanceof CircularEdge circle) {
            if (collision.getNormalBody() == circle.getBody()) {
                CircleCircle.improveAccuracy(collision, this, circle);
            } else {
                CircleCircle.improveAccuracy(collision, circle, this);
            }
        }
    }

    @Override
    public List<Point2d> intersection(Point2d p1, Point2d p2) {
        if (p1.equals(p2)) {
            return List.of();
        }
        var pe1 = bodyToEdge(p1);
        var pe2 = bodyToEdge(p2);
        var hits = new ArrayList<Vector2d>(2);
        if (Math.abs(pe2.x - pe1.x) < Util.TINY_POSITIVE) {
            double x = (pe1.x + pe2.x) / 2;
            if (Math.abs(x) > radius) {
                return List.of();
            }
            double y = Math.sqrt(radius * radius - x * x);
            double yLow = Math.min(pe1.y, pe2.y);
            double yHigh = Math.max(pe1.y, pe2.y);
            if (yLow <= y && y <= yHigh) {
                hits.add(new Vector2d(x, y));
            }
            if (yLow <= -y && -y <= yHigh) {
                hits.add(new Vector2d(x, -y));
            }
        } else {
            double k = (pe2.y - pe1.y) / (pe2.x - pe1.x);
            double k12 = 1 + k * k;
            double d = pe1.y - k * pe1.x;
            double e = k12 * radius * radius - d * d;
            if (e < 0) {
                return List.of();
            }
            e = Math.sqrt(e);
            var q1 = new Vector2d(-(k * d + e) / k12, (d - k * e) / k12);
            var q2 = new Vector2d((-k * d + e) / k12, (d + k * e) / k12);
            for (var q : List.of(q1, q2)) {
                if (Math.min(pe1.x, pe2.x) <= q.x && q.x <= Math.max(pe1.x, pe2.x) && Math.min(pe1.y, pe2.y) <= q.y
                && q.y <= Math.max(pe1.y, pe2.y)) {
                    hits.add(q);
                }
            }
        }
        var result = new ArrayList<Point2d>(2);
        for (var q : hits) {
            if (isWithinArc(q)) {
                result.add(edgeToBody(q));
            }
        }
        return result;
    }

    @Override
    public boolean isStraight() {
        return false;
    }

    public boolean isWithinArc(Vector2d pEdge) {
        return completeCircle || isWithinArc(pEdge, angleLow, angleHigh);
    }

    public boolean isWithinArcWorld(Point2d pWorld) {
        return completeCircle || isWithinArc(bodyToEdge(body.worldToBody(pWorld)), angleLow, angleHigh);
    }

    /**
     * Whether the point is within the arc reflected through the center, which is where the center of a convex circle
     * touching this concave arc must be.
     */
    public boolean isWithinReflectedArc(Vector2d pEdge) {
        double angle = angleOf(pEdge);
        while (angle < angleLow + Math.PI) {
            angle += 2 * Math.PI;
        }
        return angleLow + Math.PI <= angle && angle <= angleHigh + Math.PI;
    }

    public boolean isWithinReflectedArcWorld(Point2d pWorld) {
        return isWithinReflectedArc(bodyToEdge(body.worldToBody(pWorld)));
    }

    @Override
    public double maxDistanceTo(Point2d p) {
        return center.distance(p) + radius;
    }

    /**
     * @return the point itself when within the arc, otherwise the nearer arc end point in angle
     */
    public Point2d nearestPointByAngle(Point2d p) {
        double angle = angleOf(bodyToEdge(p));
        double angle2 = angle + (angle < angleLow ? 2 * Math.PI : 0);
        if (angleLow <= angle2 && angle2 <= angleHigh) {
            return p;
        }
        double d1 = angle < angleLow ? angleLow - angle : angleLow - (angle - 2 * Math.PI);
        double d2 = angle > angleHigh ? angle - angleHigh : (2 * Math.PI + angle) - angleHigh;
        return angleToBody(d1 < d2 ? angleLow : angleHigh);
    }

    @Override
    public void testCollisionEdge(List<RigidBodyCollision> collisions, Edge other, double time) {
        if (other instanceof StraightEdge straight) {
            CircleStraight.testCollision(collisions, straight, this, time);
        } else if (other instanceof CircularEdge circle) {
            CircleCircle.testCollision(collisions, circle, this, time);
        }
    }

    @Override
    public String toString() {
        return "CircularEdge{index=" + index + ", body=" + body.getName() + ", center=" + center + ", radius="
        + Util.nf7(radius) + ", low=" + Util.nf7(angleLow) + ", high=" + Util.nf7(angleHigh) + ", outsideIsOut="
        + outsideIsOut + "}";
    }

    private boolean containsAngle(double angle) {
        double a = angle < angleLow ? angle + 2 * Math.PI : angle;
        return angleLow <= a && a <= angleHigh;
    }

    private double sign() {
        return outsideIsOut ? 1 : -1;
    }
}
