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
package com.hellblazer.impetus.common;

/**
 * Immutable axis aligned rectangle in double precision, used for broad phase proximity tests.
 *
 * @author hal.hildebrand
 */
public record DoubleRect(double left, double bottom, double right, double top) {

    public static final DoubleRect EMPTY = new DoubleRect(0, 0, 0, 0);

    public DoubleRect {
        if (Double.isNaN(left) || Double.isNaN(bottom) || Double.isNaN(right) || Double.isNaN(top)) {
            throw new IllegalArgumentException("NaN bounds");
        }
        if (left > right || bottom > top) {
            throw new IllegalArgumentException(
            "inverted rectangle: left=" + left + " right=" + right + " bottom=" + bottom + " top=" + top);
        }
    }

    /**
     * Smallest rectangle containing both points.
     */
    public static DoubleRect make(double x1, double y1, double x2, double y2) {
        return new DoubleRect(Math.min(x1, x2), Math.min(y1, y2), Math.max(x1, x2), Math.max(y1, y2));
    }

    public double width() {
        return right - left;
    }

    public double height() {
        return top - bottom;
    }

    public double centerX() {
        return (left + right) / 2;
    }

    public double centerY() {
        return (bottom + top) / 2;
    }

    public boolean isEmpty() {
        return width() == 0 && height() == 0;
    }

    public boolean contains(double x, double y) {
        return x >= left && x <= right && y >= bottom && y <= top;
    }

    /**
     * Rectangles that merely touch are considered intersecting.
     */
    public boolean intersects(DoubleRect other) {
        return !(other.left > right || other.right < left || other.bottom > top || other.top < bottom);
    }

    public DoubleRect union(DoubleRect other) {
        return new DoubleRect(Math.min(left, other.left), Math.min(bottom, other.bottom), Math.max(right, other.right),
                              Math.max(top, other.top));
    }

    public DoubleRect unionPoint(double x, double y) {
        return new DoubleRect(Math.min(left, x), Math.min(bottom, y), Math.max(right, x), Math.max(top, y));
    }

    /**
     * @param margin amount added on every side, may be negative as long as the result is not inverted
     */
    public DoubleRect expand(double margin) {
        return new DoubleRect(left - margin, bottom - margin, right + margin, top + margin);
    }
}
