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
package com.hellblazer.impetus.engine2d.sim;

/**
 * Gaussian elimination on an augmented matrix with scaled partial pivoting. Columns with no usable pivot are moved
 * to the end, so a singular but consistent system still yields a solution with the free variables set to zero.
 *
 * @author hal.hildebrand
 */
public final class MatrixSolver {

    /**
     * Rows whose scale falls below this are considered zero.
     */
    public static final double SMALL_POSITIVE = 1e-10;

    private static final double INCONSISTENT_TOL = 0.1;

    private MatrixSolver() {
    }

    /**
     * Solves {@code A x = b} where {@code b} is the last column of the augmented matrix. The matrix is reduced in
     * place to upper triangular form, permuted by {@code nrow}.
     *
     * @param a       augmented matrix with at least n rows and n+1 columns, where n is the length of x
     * @param x       receives the solution
     * @param zeroTol pivots smaller than this are treated as zero
     * @param nrow    receives the row permutation
     * @return -1 on success, otherwise the index of a row that is zero or inconsistent
     */
    public static int solve(double[][] a, double[] x, double zeroTol, int[] nrow) {
        int n = x.length;
        if (a.length < n || a[0].length < n + 1 || nrow.length < n) {
            throw new IllegalArgumentException("matrix too small for " + n + " unknowns");
        }
        int[] ncol = new int[n + 1];
        double[] scale = new double[n];
        for (int i = 0; i < n; i++) {
            nrow[i] = i;
            ncol[i] = i;
            for (int j = 0; j < n; j++) {
                scale[i] = Math.max(scale[i], Math.abs(a[i][j]));
            }
            if (scale[i] < SMALL_POSITIVE) {
                return i;
            }
        }
        ncol[n] = n;

        int r = 0;
        eliminate:
        for (int c = 0; c < n; c++) {
            int columnSwaps = 0;
            while (true) {
                int p = r;
                double max = Math.abs(a[nrow[p]][ncol[c]]) / scale[nrow[p]];
                for (int j = r + 1; j < n; j++) {
                    double d = Math.abs(a[nrow[j]][ncol[c]]) / scale[nrow[j]];
                    if (d > max) {
                        max = d;
                        p = j;
                    }
                }
                if (Math.abs(a[nrow[p]][ncol[c]]) < zeroTol) {
                    if (columnSwaps >= n - 1 - c) {
                        break eliminate;
                    }
                    // no pivot in this column: rotate it to the end and retry
                    int moved = ncol[c];
                    System.arraycopy(ncol, c + 1, ncol, c, n - 1 - c);
                    ncol[n - 1] = moved;
                    columnSwaps++;
                    continue;
                }
                if (nrow[r] != nrow[p]) {
                    int t = nrow[r];
                    nrow[r] = nrow[p];
                    nrow[p] = t;
                }
                for (int j = r + 1; j < n; j++) {
                    double m = a[nrow[j]][ncol[c]] / a[nrow[r]][ncol[c]];
                    for (int k = 0; k < n + 1; k++) {
                        a[nrow[j]][ncol[k]] -= m * a[nrow[r]][ncol[k]];
                    }
                }
                r++;
                break;
            }
        }
        r--;
        for (int i = r + 1; i < n; i++) {
            if (Math.abs(a[nrow[i]][n]) > INCONSISTENT_TOL) {
                return nrow[i];
            }
        }

        int c = n - 1;
        int lastC = n;
        while (r >= 0) {
            int leftmost = -1;
            for (int k = c; k >= r; k--) {
                if (Math.abs(a[nrow[r]][ncol[k]]) > zeroTol) {
                    leftmost = k;
                }
            }
            if (leftmost != -1 && leftmost != c) {
                c = leftmost;
            }
            if (Math.abs(a[nrow[r]][ncol[c]]) < zeroTol) {
                r--;
                continue;
            }
            for (int j = c + 1; j < lastC; j++) {
                x[ncol[j]] = 0;
            }
            lastC = c;
            double sum = 0;
            for (int j = c + 1; j < n; j++) {
                sum += a[nrow[r]][ncol[j]] * x[ncol[j]];
            }
            x[ncol[c]] = (a[nrow[r]][n] - sum) / a[nrow[r]][ncol[c]];
            c--;
            r--;
        }
        for (int j = 0; j <= c; j++) {
            x[ncol[j]] = 0;
        }
        return -1;
    }

    /**
     * Estimates whether a matrix reduced by {@link #solve} is singular by looking for a tiny pivot on its diagonal.
     */
    public static boolean isSingular(double[][] a, int n, int[] nrow, double tolerance) {
        double min = Double.POSITIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            min = Math.min(min, Math.abs(a[nrow[i]][i]));
        }
        return min < tolerance;
    }

    public static double[] multiply(double[][] a, double[] x) {
        var r = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            double s = 0;
            for (int j = 0; j < x.length; j++) {
                s += a[i][j] * x[j];
            }
            r[i] = s;
        }
        return r;
    }

    public static double[] add(double[] a, double[] b) {
        var r = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            r[i] = a[i] + b[i];
        }
        return r;
    }

    /**
     * @return largest absolute value in the vector
     */
    public static double maxSize(double[] v) {
        double max = 0;
        for (double d : v) {
            max = Math.max(max, Math.abs(d));
        }
        return max;
    }
}
