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

import com.hellblazer.impetus.common.RandomLCG;
import com.hellblazer.impetus.common.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Finds contact forces (or collision impulses) that satisfy the complementarity conditions
 *
 * <pre>
 *   a = A f + b,   a &gt;= 0,   f &gt;= 0,   a . f = 0
 * </pre>
 * <p>
 * where for joints the conditions are instead {@code a = 0} with {@code f} free. The solver follows Baraff's
 * incremental pivoting scheme ("Fast contact force computation for nonpenetrating rigid bodies", 1994): contacts are
 * treated one at a time, each driven to zero acceleration while the forces of the already clamped set {@code C} are
 * rebalanced, contacts moving between {@code C} and the unclamped set {@code NC} as needed.
 * <p>
 * Contacts that would make the clamped sub-matrix singular are deferred (moved to the reject set {@code R}) and
 * treated after all others, and only if their acceleration is still too large. A contact that flips between
 * {@code C} and {@code NC} with zero-size steps is deferred too. Repeating a previously seen state of the sets ends
 * the process.
 * <p>
 * The result depends on the treatment order, see {@link NextContactPolicy}. Not thread safe, each simulation owns
 * its instance.
 *
 * @author hal.hildebrand
 */
public class ComputeForces {

    /**
     * Order in which contacts are treated. Every policy treats joints before non-joints.
     */
    public enum NextContactPolicy {
        /** Joint with the largest absolute acceleration, then the most negative acceleration. */
        MIN_ACCEL,
        /** Random order. */
        RANDOM,
        /** The order given by {@link #setPreOrder(int[])}. */
        PRE_ORDERED,
        /** Joints in random order, then the most negative acceleration. */
        HYBRID
    }

    /**
     * Returned when a contact could not be driven to zero acceleration.
     */
    public static final int    GENERAL_FAILURE       = -2;
    /**
     * Returned when the clamped sub-matrix equation could not be solved.
     */
    public static final int    SOLVE_FAILURE         = -999999;
    public static final int    SUCCESS               = -1;
    public static final double SMALL_POSITIVE        = 1e-10;
    static final        double SINGULAR_MATRIX_LIMIT = 2e-3;

    private static final Logger log = LoggerFactory.getLogger(ComputeForces.class);

    private final String            name;
    private final RandomLCG         random;
    private final List<Integer>     reRejects     = new ArrayList<>();
    private final List<int[]>       states        = new ArrayList<>();
    private       NextContactPolicy policy        = NextContactPolicy.HYBRID;
    private       boolean           deferSingular = true;
    private       int[]             preOrder      = new int[0];

    // per-call state of computeForces
    private double[][] A;
    private double[]   b;
    private double[]   f;
    private boolean[]  joint;
    private double[]   a;
    private double[]   deltaA;
    private double[]   deltaF;
    private boolean[]  C;
    private boolean[]  NC;
    private boolean[]  R;
    private boolean[]  zeroSteps;
    private int        n;
    private double     stepSize;
    private boolean    debug;

    /**
     * @param name   identifies the owner in log messages
     * @param random source of the random treatment order, shared with the owning simulation
     */
    public ComputeForces(String name, RandomLCG random) {
        this.name = name;
        this.random = random;
    }

    /**
     * Checks that the forces and resulting accelerations satisfy the constraints within the tolerance: where the
     * force is non-zero (or at a joint) the acceleration must be zero, otherwise it must be non-negative.
     */
    public static boolean checkForceAccel(double tolerance, double[] force, double[] accel, boolean[] joint) {
        if (accel.length < force.length) {
            throw new IllegalArgumentException("acceleration vector shorter than force vector");
        }
        if (Util.firstNonFinite(accel) >= 0 || Util.firstNonFinite(force) >= 0) {
            return false;
        }
        boolean ok = true;
        for (int i = 0; i < force.length; i++) {
            if (joint[i] || Math.abs(force[i]) > SMALL_POSITIVE) {
                if (Math.abs(accel[i]) > tolerance) {
                    log.debug("accel not zero at {}: accel={} force={}", i, Util.nfe(accel[i]), Util.nfe(force[i]));
                    ok = false;
                }
            } else if (accel[i] < -tolerance) {
                log.debug("negative accel at {}: accel={} force={}", i, Util.nfe(accel[i]), Util.nfe(force[i]));
                ok = false;
            }
        }
        return ok;
    }

    /**
     * @return the largest acceleration that violates the constraints
     */
    public static double maxAccel(double[] accel, boolean[] joint, int n) {
        double r = 0;
        for (int i = 0; i < n; i++) {
            if (joint[i] || accel[i] < 0) {
                r = Math.max(r, Math.abs(accel[i]));
            }
        }
        return r;
    }

    public int computeForces(double[][] A, double[] f, double[] b, boolean[] joint, boolean debug, double time) {
        return computeForces(A, f, b, joint, debug, time, Double.NaN);
    }

    /**
     * Solves for the forces.
     *
     * @param A         n x n matrix, entry (i, j) is the change in acceleration at contact i from a unit force at j
     * @param f         receives the force at each contact, zeroed at start
     * @param b         acceleration at each contact from external and inertial forces
     * @param joint     which contacts are joints
     * @param debug     log each treatment step
     * @param time      simulation time, for log messages
     * @param tolerance if not NaN, the result is checked with {@link #checkForceAccel} using this tolerance
     * @return {@link #SUCCESS}, or a negative error code
     */
    public int computeForces(double[][] A, double[] f, double[] b, boolean[] joint, boolean debug, double time,
                             double tolerance) {
        int size = b.length;
        if (A.length != size || (size > 0 && A[0].length != size) || f.length != size || joint.length != size) {
            throw new IllegalArgumentException("wrong length of input array");
        }
        if (size == 0) {
            return SUCCESS;
        }
        if (size == 1) {
            f[0] = (joint[0] || b[0] < 0) ? -b[0] / A[0][0] : 0;
            return SUCCESS;
        }
        this.A = A;
        this.b = b;
        this.f = f;
        this.joint = joint;
        this.debug = debug;
        n = size;
        a = b.clone();
        deltaA = new double[n];
        deltaF = new double[n];
        C = new boolean[n];
        NC = new boolean[n];
        R = new boolean[n];
        zeroSteps = new boolean[n];
        Arrays.fill(f, 0);
        reRejects.clear();
        states.clear();
        stepSize = 0;

        while (true) {
            int d = switch (policy) {
                case HYBRID -> nextContactHybrid();
                case MIN_ACCEL -> nextContactMinAccel();
                case RANDOM -> nextContactRandom();
                case PRE_ORDERED -> nextContactOrdered();
            };
            if (d < 0) {
                break;
            }
            if (R[d]) {
                reRejects.add(d);
            }
            if (checkLoop(d)) {
                log.debug("{} repeated state at time {}, stopping with {} contacts", name, Util.nf7(time), n);
                break;
            }
            int error = driveToZero(d);
            if (debug) {
                log.debug("{} driveToZero d={} n={} result={}", name, d, n, error);
            }
            if (error > -1) {
                C[error] = false;
                NC[error] = false;
                R[error] = true;
            } else if (error < -1) {
                log.debug("{} unable to drive contact {} to zero at time {}, error {}", name, d, Util.nf7(time),
                          error);
                return error;
            } else {
                reRejects.clear();
                R[d] = false;
            }
        }
        if (!Double.isNaN(tolerance) && !checkForceAccel(tolerance, f, a, joint)) {
            return GENERAL_FAILURE;
        }
        return SUCCESS;
    }

    public NextContactPolicy getNextContactPolicy() {
        return policy;
    }

    public void setNextContactPolicy(NextContactPolicy policy) {
        this.policy = policy;
    }

    /**
     * Sets the treatment order used by {@link NextContactPolicy#PRE_ORDERED}.
     */
    public void setPreOrder(int[] preOrder) {
        this.preOrder = preOrder.clone();
    }

    public boolean isDeferSingular() {
        return deferSingular;
    }

    public void setDeferSingular(boolean deferSingular) {
        this.deferSingular = deferSingular;
    }

    private boolean untreated(int i) {
        return !C[i] && !NC[i] && !R[i];
    }

    private int nextContactHybrid() {
        var order = random.randomInts(n);
        for (int k = 0; k < n; k++) {
            int i = order[k];
            if (joint[i] && untreated(i)) {
                return i;
            }
        }
        return mostNegativeAccel();
    }

    private int nextContactMinAccel() {
        double maxAccel = -1;
        int j = -1;
        for (int i = 0; i < n; i++) {
            if (joint[i] && untreated(i) && Math.abs(a[i]) > maxAccel) {
                maxAccel = Math.abs(a[i]);
                j = i;
            }
        }
        return j > -1 ? j : mostNegativeAccel();
    }

    private int mostNegativeAccel() {
        double minAccel = Double.POSITIVE_INFINITY;
        int j = -1;
        for (int i = 0; i < n; i++) {
            if (!joint[i] && untreated(i) && a[i] < minAccel) {
                minAccel = a[i];
                j = i;
            }
        }
        return j > -1 ? j : nextReject();
    }

    private int nextContactRandom() {
        var order = random.randomInts(n);
        for (int i : order) {
            if (joint[i] && untreated(i)) {
                return i;
            }
        }
        for (int i : order) {
            if (!joint[i] && untreated(i)) {
                return i;
            }
        }
        return nextReject();
    }

    private int nextContactOrdered() {
        for (int i : preOrder) {
            if (joint[i] && untreated(i)) {
                return i;
            }
        }
        for (int i : preOrder) {
            if (!joint[i] && untreated(i)) {
                return i;
            }
        }
        return nextReject();
    }

    /**
     * The deferred contact with the most negative acceleration (largest absolute for joints), skipping contacts that
     * were already rejected again since the last progress.
     */
    private int nextReject() {
        double maxAccel = 0;
        int j = -1;
        for (int i = 0; i < n; i++) {
            if (R[i] && !reRejects.contains(i)) {
                if (!joint[i] && a[i] < -maxAccel || joint[i] && Math.abs(a[i]) > maxAccel) {
                    maxAccel = Math.abs(a[i]);
                    j = i;
                }
            }
        }
        return j > -1 && maxAccel > 100 * SMALL_POSITIVE ? j : -1;
    }

    /**
     * Once every contact is in one of C, NC or R, records the pattern of sets plus the contact being treated.
     *
     * @return true if this state was seen before
     */
    private boolean checkLoop(int d) {
        for (int i = 0; i < n; i++) {
            if (untreated(i)) {
                return false;
            }
        }
        var state = new int[n + 1];
        for (int i = 0; i < n; i++) {
            state[i] = C[i] ? 1 : (NC[i] ? 2 : 3);
        }
        state[n] = d;
        for (var previous : states) {
            if (Arrays.equals(previous, state)) {
                return true;
            }
        }
        states.add(state);
        return false;
    }

    /**
     * Drives the acceleration at contact d to zero by increasing its force in steps. Each step is the largest that
     * either zeroes a[d] or moves some other contact between C and NC.
     *
     * @return -1 on success, a contact index to defer, or a negative error code
     */
    private int driveToZero(int d) {
        if (!joint[d] && a[d] >= -SMALL_POSITIVE || joint[d] && Math.abs(a[d]) <= SMALL_POSITIVE) {
            NC[d] = true;
            return SUCCESS;
        }
        if (deferSingular && wouldBeSingular(d, -1) && !R[d]) {
            return d;
        }
        Arrays.fill(deltaA, 0);
        Arrays.fill(deltaF, 0);
        Arrays.fill(zeroSteps, false);
        double accelTol = SMALL_POSITIVE;
        int loopCtr = 0;
        while (!joint[d] && a[d] < -accelTol || joint[d] && Math.abs(a[d]) > accelTol) {
            int error = fdirection(d);
            if (error != SUCCESS) {
                return error;
            }
            int j = maxStep(d);
            if (j < 0 || !(Math.abs(stepSize) <= 1e5)) {
                if (Math.abs(f[d]) < SMALL_POSITIVE) {
                    return d;
                }
                if (Math.abs(a[d]) < 1e-5) {
                    accelTol = 1.1 * Math.abs(a[d]);
                    continue;
                }
                return GENERAL_FAILURE;
            }
            if (Math.abs(stepSize) < 1e-12) {
                if (zeroSteps[j]) {
                    if (debug) {
                        log.debug("{} flip-flop at {} while driving {}", name, j, d);
                    }
                    C[j] = false;
                    NC[j] = false;
                    R[j] = true;
                }
                zeroSteps[j] = true;
            }
            for (int i = 0; i < n; i++) {
                f[i] += stepSize * deltaF[i];
                a[i] += stepSize * deltaA[i];
            }
            if (loopCtr++ > 1000 * n) {
                throw new IllegalStateException(
                "driveToZero loop limit, d=" + d + " a[d]=" + Util.nfe(a[d]) + " n=" + n);
            }
            if (deferSingular && NC[j] && wouldBeSingular(d, j) && !R[j]) {
                C[j] = false;
                NC[j] = false;
                R[j] = true;
                continue;
            }
            if (C[j]) {
                C[j] = false;
                if (Math.abs(a[j]) > SMALL_POSITIVE) {
                    if (Math.abs(f[j]) > 10 * SMALL_POSITIVE) {
                        log.warn("{} moving contact {} from C to NC with force {}", name, j, Util.nfe(f[j]));
                    }
                    NC[j] = false;
                    R[j] = true;
                } else {
                    NC[j] = true;
                }
            } else if (NC[j]) {
                NC[j] = false;
                if (Math.abs(f[j]) > SMALL_POSITIVE) {
                    R[j] = true;
                } else {
                    C[j] = true;
                }
            }
        }
        C[d] = Math.abs(f[d]) > SMALL_POSITIVE;
        NC[d] = !C[d];
        return SUCCESS;
    }

    /**
     * Finds the change in force at each contact of C that keeps their acceleration at zero when the force at d
     * increases by one, and the resulting change in acceleration at every contact. Solves
     * {@code Acc deltaF = -A[d]} where Acc is the sub-matrix of the contacts in C.
     */
    private int fdirection(int d) {
        Arrays.fill(deltaF, 0);
        deltaF[d] = 1;
        int c = count(C);
        if (c > 0) {
            var acc = new double[c][c + 1];
            var rhs = new double[c];
            for (int i = 0, p = 0; i < n; i++) {
                if (C[i]) {
                    for (int j = 0, q = 0; j < n; j++) {
                        if (C[j]) {
                            acc[p][q++] = A[i][j];
                        }
                    }
                    acc[p][c] = -A[i][d];
                    rhs[p] = -A[i][d];
                    p++;
                }
            }
            var original = copy(acc);
            var x = new double[c];
            double tolerance = 1e-9;
            while (true) {
                var nrow = new int[c];
                if (MatrixSolver.solve(acc, x, tolerance, nrow) != -1) {
                    return SOLVE_FAILURE;
                }
                if (residual(original, x, rhs) < 1e-7) {
                    break;
                }
                tolerance /= 10;
                if (tolerance < 1e-17) {
                    log.debug("{} sub-matrix solve not within tolerance for d={}", name, d);
                    break;
                }
                acc = copy(original);
            }
            for (int i = 0, p = 0; i < n; i++) {
                if (C[i]) {
                    deltaF[i] = x[p++];
                }
            }
        }
        for (int i = 0; i < n; i++) {
            double s = 0;
            for (int j = 0; j < n; j++) {
                s += A[i][j] * deltaF[j];
            }
            deltaA[i] = s;
        }
        return SUCCESS;
    }

    /**
     * Finds the largest step in force at d before either a[d] reaches zero or some other contact changes between C
     * and NC. Joints never limit the step, except for d itself. The step is negative when d is a joint with
     * positive acceleration.
     *
     * @return the contact that limits the step, -1 if none; sets {@link #stepSize}
     */
    private int maxStep(int d) {
        double s = joint[d] && a[d] > 0 ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        int j = -1;
        if (joint[d] || deltaA[d] > 0) {
            j = d;
            s = -a[d] / deltaA[d];
        }
        double sign = s > 0 ? 1 : -1;
        for (int i = 0; i < n; i++) {
            if (!joint[i] && C[i] && deltaF[i] * sign < -1e-14) {
                double sPrime = -f[i] / deltaF[i];
                if (sPrime * sign < 0) {
                    sPrime = 0;
                }
                if (sPrime * sign < s * sign) {
                    s = sPrime;
                    j = i;
                }
            }
        }
        for (int i = 0; i < n; i++) {
            if (NC[i] && (!joint[i] && deltaA[i] * sign < -1e-14 || joint[i] && Math.abs(deltaA[i] * sign) > 1e-14)) {
                double sPrime = -a[i] / deltaA[i];
                if (sPrime * sign < 0) {
                    sPrime = 0;
                }
                if (sPrime * sign < s * sign) {
                    s = sPrime;
                    j = i;
                }
            }
        }
        stepSize = s;
        return j;
    }

    /**
     * Whether the clamped sub-matrix would be singular after adding contact d, and e when it is not -1.
     */
    private boolean wouldBeSingular(int d, int e) {
        int c = 0;
        for (int i = 0; i < n; i++) {
            if (C[i] || i == d || i == e) {
                c++;
            }
        }
        var acc = new double[c][c + 1];
        for (int i = 0, p = 0; i < n; i++) {
            if (C[i] || i == d || i == e) {
                for (int j = 0, q = 0; j < n; j++) {
                    if (C[j] || j == d || j == e) {
                        acc[p][q++] = A[i][j];
                    }
                }
                acc[p][c] = 1;
                p++;
            }
        }
        var nrow = new int[c];
        MatrixSolver.solve(acc, new double[c], 1e-9, nrow);
        return MatrixSolver.isSingular(acc, c, nrow, SINGULAR_MATRIX_LIMIT);
    }

    private static int count(boolean[] set) {
        int c = 0;
        for (boolean x : set) {
            if (x) {
                c++;
            }
        }
        return c;
    }

    private static double[][] copy(double[][] m) {
        var r = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            r[i] = m[i].clone();
        }
        return r;
    }

    private static double residual(double[][] augmented, double[] x, double[] rhs) {
        double max = 0;
        for (int i = 0; i < x.length; i++) {
            double s = 0;
            for (int j = 0; j < x.length; j++) {
                s += augmented[i][j] * x[j];
            }
            max = Math.max(max, Math.abs(s - rhs[i]));
        }
        return max;
    }
}
