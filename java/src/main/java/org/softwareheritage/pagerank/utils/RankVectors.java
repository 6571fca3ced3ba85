/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank.utils;

/**
 * Helpers on rank vectors (arrays of non-negative doubles indexed by page id).
 */
public final class RankVectors {
    /** Tolerance used when checking that a vector sums to one. */
    public static final double STOCHASTIC_TOLERANCE = 1E-9;

    private RankVectors() {
    }

    /** Returns the sum of the vector, using Kahan summation. */
    public static double sum(double[] v) {
        double s = 0, c = 0;
        for (double x : v) {
            double y = x - c;
            double t = s + y;
            c = (t - s) - y;
            s = t;
        }
        return s;
    }

    /** Returns true if all entries are non-negative and they sum to one within the given tolerance. */
    public static boolean isStochastic(double[] v, double tolerance) {
        for (double x : v) {
            if (x < 0 || Double.isNaN(x))
                return false;
        }
        return Math.abs(sum(v) - 1) <= tolerance;
    }

    public static boolean isStochastic(double[] v) {
        return isStochastic(v, STOCHASTIC_TOLERANCE);
    }

    /**
     * Scales the vector in place so that it sums to one.
     *
     * @return the vector itself
     * @throws IllegalArgumentException if the vector sums to zero
     */
    public static double[] normalize(double[] v) {
        double s = sum(v);
        if (s == 0) {
            throw new IllegalArgumentException("Cannot normalize a zero vector");
        }
        for (int i = v.length; i-- != 0;)
            v[i] /= s;
        return v;
    }

    /** Returns the largest absolute difference between two vectors of the same length. */
    public static double maxAbsDifference(double[] a, double[] b) {
        checkSameLength(a, b);
        double max = 0;
        for (int i = a.length; i-- != 0;)
            max = Math.max(max, Math.abs(a[i] - b[i]));
        return max;
    }

    /** Returns the L1 distance between two vectors of the same length. */
    public static double l1Distance(double[] a, double[] b) {
        checkSameLength(a, b);
        double d = 0;
        for (int i = a.length; i-- != 0;)
            d += Math.abs(a[i] - b[i]);
        return d;
    }

    private static void checkSameLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector lengths differ: " + a.length + " != " + b.length);
        }
    }
}
