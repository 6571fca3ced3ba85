/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank.algo;

import it.unimi.dsi.logging.ProgressLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.softwareheritage.pagerank.LinkGraph;
import org.softwareheritage.pagerank.RankResult;
import org.softwareheritage.pagerank.TransitionModel;

/**
 * Monte-Carlo PageRank estimator.
 * <p>
 * Runs a random surfer over the corpus following {@link TransitionModel}, starting from a page chosen
 * uniformly at random, and estimates the rank of each page as the fraction of steps that landed on
 * it. Estimates converge to the stationary distribution of the chain as the number of samples
 * grows; there is no convergence check, the walk always ends in {@link EstimatorState#EXHAUSTED}.
 * <p>
 * Instances are not thread-safe.
 *
 * @author The Software Heritage developers
 */

public class SamplingEstimator {
    /** The default number of samples. */
    public static final int DEFAULT_SAMPLES = 10000;

    private final static Logger logger = LoggerFactory.getLogger(SamplingEstimator.class);

    private final LinkGraph graph;
    private final double damping;
    private final RandomSource random;
    /* Scratch buffer for the transition distribution, rewritten at each step */
    private final double[] transition;
    private EstimatorState state = EstimatorState.INIT;

    /**
     * Constructor.
     *
     * @param graph the corpus, must not be empty
     * @param damping damping factor, in (0,1)
     * @param random source of randomness, owned by this estimator
     */
    public SamplingEstimator(LinkGraph graph, double damping, RandomSource random) {
        if (graph.isEmpty()) {
            throw new IllegalArgumentException("Cannot rank an empty corpus");
        }
        TransitionModel.checkDamping(damping);
        this.graph = graph;
        this.damping = damping;
        this.random = random;
        this.transition = new double[graph.numPages()];
    }

    public EstimatorState getState() {
        return state;
    }

    /** Draws the page the walk starts from, uniformly over the corpus. */
    public int start() {
        return random.nextInt(graph.numPages());
    }

    /**
     * Moves the surfer one step.
     *
     * @param current id of the page the surfer is on
     * @return id of the next page
     */
    public int step(int current) {
        TransitionModel.fill(graph, current, damping, transition);
        return random.pick(transition, transition.length);
    }

    /**
     * Estimates PageRank from the visit counts of a random walk.
     *
     * @param samples number of steps of the walk, must be positive
     * @return the estimated ranks, summing to one
     */
    public RankResult estimate(int samples) {
        if (samples <= 0) {
            throw new IllegalArgumentException("Sample count must be positive, got " + samples);
        }
        state = EstimatorState.SAMPLING;

        ProgressLogger pl = new ProgressLogger(logger, "samples");
        pl.expectedUpdates = samples;
        pl.start("Sampling PageRank over " + graph.numPages() + " pages...");

        long[] visits = new long[graph.numPages()];
        int current = start();
        for (int i = 0; i < samples; i++) {
            current = step(current);
            visits[current]++;
            pl.lightUpdate();
        }
        pl.done();

        double[] ranks = new double[visits.length];
        for (int i = 0; i < visits.length; i++) {
            ranks[i] = (double) visits[i] / samples;
        }
        state = EstimatorState.EXHAUSTED;
        return new RankResult(graph, ranks, RankResult.Method.SAMPLING, state, samples);
    }
}
