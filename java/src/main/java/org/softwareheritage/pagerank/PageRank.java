/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank;

import org.softwareheritage.pagerank.algo.IterativeEstimator;
import org.softwareheritage.pagerank.algo.RandomSource;
import org.softwareheritage.pagerank.algo.SamplingEstimator;

/**
 * Entry points of the PageRank computation.
 * <p>
 * All parameters are passed explicitly on each call; nothing is kept between calls.
 *
 * @author The Software Heritage developers
 */

public final class PageRank {
    /** The default damping factor. */
    public static final double DEFAULT_DAMPING = 0.85;

    private PageRank() {
    }

    /**
     * Returns the next page distribution of a random surfer on the given page.
     *
     * @see TransitionModel#distribution(LinkGraph, String, double)
     */
    public static ProbabilityDistribution transitionModel(LinkGraph graph, String page, double damping) {
        return TransitionModel.distribution(graph, page, damping);
    }

    /**
     * Estimates PageRank with a random walk of {@code samples} steps.
     *
     * @param graph the corpus, must not be empty
     * @param damping damping factor, in (0,1)
     * @param samples number of steps, must be positive
     * @param random source of randomness
     * @return the visit frequencies
     */
    public static RankResult samplePageRank(LinkGraph graph, double damping, int samples, RandomSource random) {
        return new SamplingEstimator(graph, damping, random).estimate(samples);
    }

    /** Same as {@link #samplePageRank(LinkGraph, double, int, RandomSource)}, with a fresh unseeded source. */
    public static RankResult samplePageRank(LinkGraph graph, double damping, int samples) {
        return samplePageRank(graph, damping, samples, RandomSource.create());
    }

    /**
     * Computes PageRank by fixed-point iteration.
     *
     * @param graph the corpus, must not be empty
     * @param damping damping factor, in (0,1)
     * @param tolerance max absolute change between two sweeps at which iteration stops
     * @param maxIterations iteration cap
     * @return the converged ranks
     * @throws org.softwareheritage.pagerank.algo.ConvergenceException if the cap is reached
     */
    public static RankResult iteratePageRank(LinkGraph graph, double damping, double tolerance, int maxIterations) {
        return new IterativeEstimator(graph, damping, tolerance, maxIterations).estimate();
    }

    /** Same as {@link #iteratePageRank(LinkGraph, double, double, int)}, with default tolerance and cap. */
    public static RankResult iteratePageRank(LinkGraph graph, double damping) {
        return new IterativeEstimator(graph, damping).estimate();
    }
}
