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
import java.util.List;

/**
 * Factory of commonly used {@link Polygon} shapes. Unless noted the body coordinates have the origin at the center of
 * mass, the mass is 1 and the elasticity 0.8.
 *
 * @author hal.hildebrand
 */
public final class Shapes {

    /** Edge indexes of the blocks made here. */
    public static final int BOTTOM_EDGE = 0;
    public static final int RIGHT_EDGE  = 1;
    public static final int TOP_EDGE    = 2;
    public static final int LEFT_EDGE   = 3;

    private static final double DEFAULT_ELASTICITY = 0.8;

    private Shapes() {
    }

    /**
     * A disk of the given radius, a single complete circular edge.
     */
    public static Polygon makeBall(double radius, String name) {
        var p = new Polygon(name);
        p.startPath(-radius, 0);
        p.addCircularEdge(new Point2d(-radius, 0), Geometry.ORIGIN, false, true);
        p.finish();
        p.setCentroid(Geometry.ORIGIN);
        p.setMomentAboutCM(radius * radius / 2);
        p.setElasticity(DEFAULT_ELASTICITY);
        return p;
    }

    public static Polygon makeBlock(double width, double height, String name) {
        var p = new Polygon(name);
        double w = width / 2;
        double h = height / 2;
        p.startPath(-w, -h);
        p.addStraightEdge(w, -h, false);
        p.addStraightEdge(w, h, true);
        p.addStraightEdge(-w, h, true);
        p.addStraightEdge(-w, -h, false);
        p.finish();
        p.setCentroid(Geometry.ORIGIN);
        p.setMomentAboutCM((width * width + height * height) / 12);
        p.setElasticity(DEFAULT_ELASTICITY);
        return p;
    }

    /**
     * A block whose body coordinates have the origin at the lower left corner; the center of mass is in the middle.
     */
    public static Polygon makeBlock2(double width, double height, String name) {
        var p = new Polygon(name);
        p.startPath(0, 0);
        p.addStraightEdge(width, 0, false);
        p.addStraightEdge(width, height, true);
        p.addStraightEdge(0, height, true);
        p.addStraightEdge(0, 0, false);
        p.finish();
        p.setCentroid(new Point2d(width / 2, height / 2));
        p.setMomentAboutCM((width * width + height * height) / 12);
        p.setElasticity(DEFAULT_ELASTICITY);
        return p;
    }

    /**
     * A block with rounded corners of the given radius.
     */
    public static Polygon makeRoundCornerBlock(double width, double height, double radius, String name) {
        double w = width / 2;
        double h = height / 2;
        double r = radius;
        if (r > w || r > h) {
            throw new IllegalArgumentException("radius " + r + " must be less than half of width and height");
        }
        var p = new Polygon(name);
        p.startPath(-w + r, -h);
        p.addStraightEdge(w - r, -h, false);
        p.addCircularEdge(new Point2d(w, -h + r), new Point2d(w - r, -h + r), false, true);
        p.addStraightEdge(w, h - r, true);
        p.addCircularEdge(new Point2d(w - r, h), new Point2d(w - r, h - r), false, true);
        p.addStraightEdge(-w + r, h, true);
        p.addCircularEdge(new Point2d(-w, h - r), new Point2d(-w + r, h - r), false, true);
        p.addStraightEdge(-w, -h + r, false);
        p.addCircularEdge(new Point2d(-w + r, -h), new Point2d(-w + r, -h + r), false, true);
        p.finish();
        p.setCentroid(Geometry.ORIGIN);
        p.setMomentAboutCM((width * width + height * height) / 12);
        p.setElasticity(DEFAULT_ELASTICITY);
        return p;
    }

    /**
     * A rectangular frame: an outer path and an inner path of reversed polarity, the walls having the given thickness
     * centered on a rectangle of the given width and height.
     */
    public static Polygon makeFrame(double width, double height, double thickness, String name) {
        double w = width / 2;
        double h = height / 2;
        double t = thickness / 2;
        if (t >= w || t >= h) {
            throw new IllegalArgumentException("thickness " + thickness + " leaves no inside in " + name);
        }
        var p = new Polygon(name);
        p.startPath(w - t, h - t);
        p.addStraightEdge(w - t, -(h - t), false);
        p.addStraightEdge(-(w - t), -(h - t), true);
        p.addStraightEdge(-(w - t), h - t, true);
        p.addStraightEdge(w - t, h - t, false);
        p.closePath();
        p.startPath(w + t, h + t);
        p.addStraightEdge(-(w + t), h + t, true);
        p.addStraightEdge(-(w + t), -(h + t), false);
        p.addStraightEdge(w + t, -(h + t), false);
        p.addStraightEdge(w + t, h + t, true);
        p.closePath();
        p.finish();
        p.setCentroid(Geometry.ORIGIN);
        p.setElasticity(DEFAULT_ELASTICITY);
        return p;
    }

    /**
     * An immoveable block of infinite mass, for floors and walls.
     */
    public static Polygon makeWall(double width, double height, String name) {
        var p = makeBlock(width, height, name);
        p.setMass(Double.POSITIVE_INFINITY);
        return p;
    }

    /**
     * A block whose top is a concave circular arc of the given radius, a cup that a ball can rest in.
     */
    public static Polygon makeCup(double width, double height, double radius, String name) {
        double w = width / 2;
        double h = height / 2;
        if (radius <= w) {
            throw new IllegalArgumentException("radius " + radius + " must exceed half the width " + w);
        }
        double rise = Math.sqrt(radius * radius - w * w);
        if (radius - rise >= height) {
            throw new IllegalArgumentException("arc of radius " + radius + " cuts through the bottom of " + name);
        }
        var p = new Polygon(name);
        p.startPath(-w, -h);
        p.addStraightEdge(w, -h, false);
        p.addStraightEdge(w, h, true);
        p.addCircularEdge(new Point2d(-w, h), new Point2d(0, h + rise), true, false);
        p.addStraightEdge(-w, -h, false);
        p.finish();
        p.setElasticity(DEFAULT_ELASTICITY);
        return p;
    }

    /**
     * A regular polygon with n sides whose vertices lie on a circle of the given radius, with a flat bottom edge.
     */
    public static Polygon makeNGon(int n, double radius, String name) {
        if (n < 3) {
            throw new IllegalArgumentException("a polygon needs at least 3 sides: " + n);
        }
        var points = new Point2d[n];
        double start = -Math.PI / 2 - Math.PI / n;
        for (int i = 0; i < n; i++) {
            double a = start + 2 * Math.PI * i / n;
            points[i] = new Point2d(radius * Math.cos(a), radius * Math.sin(a));
        }
        double cos = Math.cos(Math.PI / n);
        double moment = radius * radius / 6 * (1 + 2 * cos * cos);
        var p = makePolygon(List.of(points), moment, name);
        p.setCentroid(Geometry.ORIGIN);
        return p;
    }

    /**
     * A polygon of straight edges through the points, which must be given counter-clockwise.
     *
     * @param moment moment about the center of mass per unit mass
     */
    public static Polygon makePolygon(List<Point2d> points, double moment, String name) {
        if (points.size() < 3) {
            throw new IllegalArgumentException("a polygon needs at least 3 points: " + points.size());
        }
        var p = new Polygon(name);
        p.startPath(points.get(0));
        for (int i = 1; i <= points.size(); i++) {
            var from = points.get(i - 1);
            var to = points.get(i % points.size());
            p.addStraightEdge(to, outsideIsUpCounterClockwise(from, to));
        }
        p.finish();
        p.setMomentAboutCM(moment);
        p.setElasticity(DEFAULT_ELASTICITY);
        return p;
    }

    /**
     * Travelling counter-clockwise the inside is on the left: outside is up when moving left, and outside is right
     * when moving up a vertical edge.
     */
    private static boolean outsideIsUpCounterClockwise(Point2d from, Point2d to) {
        if (Math.abs(to.x - from.x) < 1e-10) {
            return to.y > from.y;
        }
        return to.x < from.x;
    }
}
