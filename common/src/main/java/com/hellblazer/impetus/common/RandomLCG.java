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
 * Seeded linear congruential pseudo-random number generator.
 * <p>
 * Used wherever the engine must break ties or pick an order among equally valid choices, so that two runs with the
 * same seed produce identical results on every platform. The sequence is defined by
 * <pre>
 * seed = (1664525 * seed + 1013904223) mod 2^32
 * </pre>
 * Usage:
 * <pre>
 * var random = new RandomLCG(99999);
 * int[] order = random.randomInts(collisions.size());
 * </pre>
 *
 * @author hal.hildebrand
 */
public class RandomLCG {

    /**
     * Largest valid seed.
     */
    public static final long MAX_SEED = (1L << 32) - 1;

    private static final long MODULUS    = 1L << 32;
    private static final long MULTIPLIER = 1664525L;
    private static final long INCREMENT  = 1013904223L;

    private long seed;

    public RandomLCG(long seed) {
        setSeed(seed);
    }

    public long getSeed() {
        return seed;
    }

    /**
     * @param seed an integer in the range [0, 2^32)
     * @throws IllegalArgumentException when the seed is outside that range
     */
    public void setSeed(long seed) {
        if (!isValidSeed(seed)) {
            throw new IllegalArgumentException("random seed out of range: " + seed);
        }
        this.seed = seed;
    }

    /**
     * @return the next value in the sequence, in the range [0, 2^32)
     */
    public static boolean isValidSeed(long seed) {
        return seed >= 0 && seed <= MAX_SEED;
    }

    public long nextInt() {
        seed = (MULTIPLIER * seed + INCREMENT) % MODULUS;
        return seed;
    }

    /**
     * @return a value in [0, 1)
     */
    public double nextFloat() {
        return (double) nextInt() / MODULUS;
    }

    /**
     * @param n exclusive upper bound, must be positive
     * @return an integer in [0, n)
     */
    public int nextRange(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("range must be positive: " + n);
        }
        var r = (int) Math.floor(nextFloat() * n);
        return Math.min(r, n - 1);
    }

    /**
     * Random permutation of the integers 0 to n-1 (Fisher-Yates shuffle).
     */
    public int[] randomInts(int n) {
        var result = new int[n];
        for (int i = 0; i < n; i++) {
            result[i] = i;
        }
        for (int i = n - 1; i > 0; i--) {
            int j = nextRange(i + 1);
            int tmp = result[i];
            result[i] = result[j];
            result[j] = tmp;
        }
        return result;
    }

    @Override
    public String toString() {
        return "RandomLCG{seed=" + seed + "}";
    }
}
