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

import java.util.Locale;

/**
 * Numeric helpers shared by the simulation and engine modules.
 *
 * @author hal.hildebrand
 */
public final class Util {

    /**
     * Smallest distance treated as non-zero in geometric calculations.
     */
    public static final double TINY_POSITIVE = 1e-10;

    private Util() {
    }

    /**
     * @return index of the first NaN or infinite value, or -1 when all values are finite
     */
    public static int firstNonFinite(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Limits an angle to the range (-pi, pi].
     */
    public static double limitAngle(double angle) {
        if (angle > Math.PI) {
            var n = Math.floor((angle + Math.PI) / (2 * Math.PI));
            return angle - 2 * Math.PI * n;
        } else if (angle <= -Math.PI) {
            var n = Math.floor((-angle + Math.PI) / (2 * Math.PI));
            return angle + 2 * Math.PI * n;
        }
        return angle;
    }

    /**
     * Formats a number with 7 decimals for log output.
     */
    public static String nf7(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return String.format(Locale.ROOT, "%.7f", value);
    }

    /**
     * Formats a number in scientific notation for log output of tolerances and residuals.
     */
    public static String nfe(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return String.format(Locale.ROOT, "%.6e", value);
    }

    /**
     * Formats an array of values, 7 decimals each, separated by commas.
     */
    public static String nf7(double[] values) {
        var sb = new StringBuilder("[");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(nf7(values[i]));
        }
        return sb.append(']').toString();
    }
}
