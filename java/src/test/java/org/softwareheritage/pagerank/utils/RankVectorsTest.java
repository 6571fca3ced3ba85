/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RankVectorsTest {
    @Test
    public void sumOfManySmallValues() {
        double[] v = new double[10000];
        java.util.Arrays.fill(v, 1E-4);
        assertEquals(1.0, RankVectors.sum(v), 1E-15);
    }

    @Test
    public void stochastic() {
        assertTrue(RankVectors.isStochastic(new double[]{0.25, 0.75}));
        assertTrue(RankVectors.isStochastic(new double[]{1}));
        assertFalse(RankVectors.isStochastic(new double[]{0.5, 0.4}));
        assertFalse(RankVectors.isStochastic(new double[]{1.5, -0.5}));
        assertFalse(RankVectors.isStochastic(new double[]{Double.NaN, 1}));
        assertTrue(RankVectors.isStochastic(new double[]{0.5, 0.49}, 0.1));
    }

    @Test
    public void normalize() {
        double[] v = {1, 3, 0};
        assertArrayEquals(new double[]{0.25, 0.75, 0}, RankVectors.normalize(v));
        assertThrows(IllegalArgumentException.class, () -> RankVectors.normalize(new double[]{0, 0}));
    }

    @Test
    public void distances() {
        double[] a = {0.5, 0.25, 0.25};
        double[] b = {0.25, 0.5, 0.25};
        assertEquals(0.25, RankVectors.maxAbsDifference(a, b));
        assertEquals(0.5, RankVectors.l1Distance(a, b));
        assertEquals(0, RankVectors.maxAbsDifference(a, a));
        assertThrows(IllegalArgumentException.class, () -> RankVectors.l1Distance(a, new double[2]));
    }
}
