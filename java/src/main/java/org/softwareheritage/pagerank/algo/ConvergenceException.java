/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank.algo;

/**
 * Thrown when the iterative estimator does not reach its tolerance within the allowed number of
 * sweeps. On a link graph with uniform dangling-page redistribution this denotes a modeling bug, so
 * it is an {@link IllegalStateException} like the rank mass check of {@link IterativeEstimator}.
 */
public class ConvergenceException extends IllegalStateException {
    private final int iterations;
    private final double lastDelta;

    public ConvergenceException(int iterations, double lastDelta, double tolerance) {
        super(String.format("PageRank did not converge after %d iterations (last delta %g, tolerance %g)",
                iterations, lastDelta, tolerance));
        this.iterations = iterations;
        this.lastDelta = lastDelta;
    }

    public int getIterations() {
        return iterations;
    }

    /** Returns the max absolute rank change observed during the last sweep. */
    public double getLastDelta() {
        return lastDelta;
    }
}
