/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank;

import org.softwareheritage.pagerank.algo.EstimatorState;
import org.softwareheritage.pagerank.utils.RankVectors;

import java.util.Arrays;

/**
 * PageRank estimate for every page of a corpus, as produced by one estimator run.
 *
 * @author The Software Heritage developers
 */

public class RankResult extends PageVector {
    /** How a rank vector was obtained. */
    public enum Method {
        /** Visit frequencies of a random walk */
        SAMPLING,
        /** Fixed point of the PageRank equations */
        ITERATION;
    }

    private final Method method;
    private final EstimatorState state;
    private final long steps;

    /**
     * Constructor.
     *
     * @param graph the ranked graph
     * @param ranks one rank per page id, non-negative and summing to one; the array is copied
     * @param method estimator that produced the ranks
     * @param state terminal state of the estimator
     * @param steps number of samples drawn, or number of sweeps performed
     * @throws IllegalArgumentException if the ranks are not a probability distribution or the state is
     *             not terminal
     */
    public RankResult(LinkGraph graph, double[] ranks, Method method, EstimatorState state, long steps) {
        super(graph, stochasticCopy(ranks));
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + state);
        }
        this.method = method;
        this.state = state;
        this.steps = steps;
    }

    private static double[] stochasticCopy(double[] ranks) {
        if (!RankVectors.isStochastic(ranks, RankVectors.STOCHASTIC_TOLERANCE)) {
            throw new IllegalArgumentException("Ranks do not sum to one: " + RankVectors.sum(ranks));
        }
        return Arrays.copyOf(ranks, ranks.length);
    }

    public Method getMethod() {
        return method;
    }

    public EstimatorState getState() {
        return state;
    }

    /** Returns the number of samples (for {@link Method#SAMPLING}) or sweeps (for {@link Method#ITERATION}). */
    public long getSteps() {
        return steps;
    }
}
