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
import org.softwareheritage.pagerank.utils.RankVectors;

import java.util.Arrays;

/**
 * Deterministic PageRank estimator, relaxing the PageRank equations until they reach a fixed point.
 * <p>
 * Starting from the uniform vector, each sweep computes, for every page <var>p</var>,
 *
 * <pre>
 * rank'(p) = (1 - d) / N + d * (sum over i linking to p of rank(i) / outdegree(i) + danglingMass / N)
 * </pre>
 *
 * where <var>danglingMass</var> is the total rank of the pages without links, which behave as if
 * they linked to every page. New values are written to a second buffer and the two buffers are
 * swapped at the end of the sweep, so that a sweep only ever reads the values of the previous one.
 * <p>
 * Iteration stops as soon as no rank moved by more than {@link #getTolerance() the tolerance}
 * during a sweep. Exceeding {@link #getMaxIterations() the iteration cap} raises a
 * {@link ConvergenceException}.
 *
 * @author The Software Heritage developers
 */

public class IterativeEstimator {
    /** The default convergence tolerance (max absolute change between two sweeps). */
    public static final double DEFAULT_TOLERANCE = 0.001;
    /** The default iteration cap. */
    public static final int DEFAULT_MAX_ITERATIONS = 10000;
    /** How far from one the rank mass may drift before the computation is declared broken. */
    static final double MASS_TOLERANCE = 1E-6;

    private final static Logger logger = LoggerFactory.getLogger(IterativeEstimator.class);

    private final LinkGraph graph;
    private final double damping;
    private final double tolerance;
    private final int maxIterations;
    private EstimatorState state = EstimatorState.INIT;
    private int iteration;
    private double lastDelta = Double.POSITIVE_INFINITY;

    /**
     * Constructor.
     *
     * @param graph the corpus, must not be empty
     * @param damping damping factor, in (0,1)
     * @param tolerance convergence tolerance, must be positive
     * @param maxIterations iteration cap, must be positive
     */
    public IterativeEstimator(LinkGraph graph, double damping, double tolerance, int maxIterations) {
        if (graph.isEmpty()) {
            throw new IllegalArgumentException("Cannot rank an empty corpus");
        }
        TransitionModel.checkDamping(damping);
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("Tolerance must be positive, got " + tolerance);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("Iteration cap must be positive, got " + maxIterations);
        }
        this.graph = graph;
        this.damping = damping;
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    public IterativeEstimator(LinkGraph graph, double damping) {
        this(graph, damping, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);
    }

    public double getTolerance() {
        return tolerance;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public EstimatorState getState() {
        return state;
    }

    /** Returns the number of sweeps performed by the last call to {@link #estimate()}. */
    public int getIteration() {
        return iteration;
    }

    /** Returns the max absolute change observed during the last sweep. */
    public double getLastDelta() {
        return lastDelta;
    }

    /**
     * Computes PageRank by fixed-point iteration.
     *
     * @return the converged ranks, summing to one
     * @throws ConvergenceException if the tolerance is not met within the iteration cap
     */
    public RankResult estimate() {
        final int n = graph.numPages();
        double[] rank = new double[n];
        double[] newRank = new double[n];
        Arrays.fill(rank, 1.0 / n);

        iteration = 0;
        lastDelta = Double.POSITIVE_INFINITY;
        state = EstimatorState.ITERATING;

        ProgressLogger pl = new ProgressLogger(logger, "iterations");
        pl.start("Iterating PageRank over " + n + " pages (damping " + damping + ", tolerance " + tolerance
                + ")...");

        while (true) {
            if (iteration == maxIterations) {
                pl.done();
                logger.error("No convergence after {} iterations, last delta {}", iteration, lastDelta);
                throw new ConvergenceException(iteration, lastDelta, tolerance);
            }

            sweep(rank, newRank);
            iteration++;
            lastDelta = RankVectors.maxAbsDifference(rank, newRank);

            if (!RankVectors.isStochastic(newRank, MASS_TOLERANCE)) {
                throw new IllegalStateException(
                        "Rank mass is " + RankVectors.sum(newRank) + " after iteration " + iteration);
            }

            // make the rank just computed the new rank
            double[] t = rank;
            rank = newRank;
            newRank = t;

            pl.update();
            logger.debug("Iteration {}: delta {}", iteration, lastDelta);
            if (lastDelta <= tolerance) {
                break;
            }
        }
        pl.done();

        state = EstimatorState.CONVERGED;
        logger.info("Converged after {} iterations (delta {})", iteration, lastDelta);
        return new RankResult(graph, rank, RankResult.Method.ITERATION, state, iteration);
    }

    /** Computes one relaxation sweep from {@code rank} into {@code newRank}. */
    private void sweep(double[] rank, double[] newRank) {
        final int n = rank.length;
        double danglingMass = 0;
        for (int i = 0; i < n; i++) {
            if (graph.isDangling(i))
                danglingMass += rank[i];
        }

        final double base = (1 - damping) / n + damping * danglingMass / n;
        for (int p = 0; p < n; p++) {
            double incoming = 0;
            for (int i : graph.predecessorArray(p)) {
                incoming += rank[i] / graph.outdegree(i);
            }
            newRank[p] = base + damping * incoming;
        }
    }
}
