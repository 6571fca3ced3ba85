/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank.algo;

import it.unimi.dsi.util.XoRoShiRo128PlusRandom;

import java.util.Random;

/**
 * Source of randomness for the sampling estimator.
 * <p>
 * Implementations are not expected to be thread-safe: concurrent estimators must each use their own
 * source.
 *
 * @author The Software Heritage developers
 */
public interface RandomSource {
    /** Returns a uniformly distributed integer between 0 (included) and {@code bound} (excluded). */
    int nextInt(int bound);

    /** Returns a uniformly distributed double between 0 (included) and 1 (excluded). */
    double nextDouble();

    /**
     * Draws an index with probability proportional to its weight.
     *
     * @param weights non-negative weights
     * @param length number of weights to consider, starting from index 0
     * @return the drawn index, always one with a positive weight
     * @throws IllegalArgumentException if no weight is positive
     */
    default int pick(double[] weights, int length) {
        double total = 0;
        int last = -1;
        for (int i = 0; i < length; i++) {
            if (weights[i] > 0) {
                total += weights[i];
                last = i;
            }
        }
        if (last == -1) {
            throw new IllegalArgumentException("Cannot draw from weights that are all zero");
        }

        double threshold = nextDouble() * total;
        double cumulative = 0;
        for (int i = 0; i < last; i++) {
            if (weights[i] <= 0)
                continue;
            cumulative += weights[i];
            if (threshold < cumulative)
                return i;
        }
        // Rounding may leave the threshold just above the last partial sum
        return last;
    }

    /** Wraps a {@link Random} instance. */
    static RandomSource of(Random random) {
        return new RandomSource() {
            @Override
            public int nextInt(int bound) {
                return random.nextInt(bound);
            }

            @Override
            public double nextDouble() {
                return random.nextDouble();
            }
        };
    }

    /** Returns a new source with a reproducible sequence. */
    static RandomSource seeded(long seed) {
        return of(new XoRoShiRo128PlusRandom(seed));
    }

    /** Returns a new source seeded from system entropy. */
    static RandomSource create() {
        return of(new XoRoShiRo128PlusRandom());
    }
}
