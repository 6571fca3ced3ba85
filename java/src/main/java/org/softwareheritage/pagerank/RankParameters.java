/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.softwareheritage.pagerank.algo.IterativeEstimator;
import org.softwareheritage.pagerank.algo.RandomSource;
import org.softwareheritage.pagerank.algo.SamplingEstimator;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Settings of one ranking run.
 * <p>
 * Values can be read from a properties file with the keys {@code damping}, {@code samples},
 * {@code tolerance}, {@code max-iterations} and {@code seed}; missing keys keep their default and
 * other keys are reported with a warning.
 * Instances are immutable, the {@code with*} methods return modified copies.
 */
public final class RankParameters {
    public static final RankParameters DEFAULTS = new RankParameters(PageRank.DEFAULT_DAMPING,
            SamplingEstimator.DEFAULT_SAMPLES, IterativeEstimator.DEFAULT_TOLERANCE,
            IterativeEstimator.DEFAULT_MAX_ITERATIONS, null);
    /** The keys read from a properties file. */
    public static final List<String> KEYS = List.of("damping", "samples", "tolerance", "max-iterations", "seed");

    private final static Logger logger = LoggerFactory.getLogger(RankParameters.class);

    private final double damping;
    private final int samples;
    private final double tolerance;
    private final int maxIterations;
    private final Long seed;

    private RankParameters(double damping, int samples, double tolerance, int maxIterations, Long seed) {
        TransitionModel.checkDamping(damping);
        if (samples <= 0) {
            throw new IllegalArgumentException("Sample count must be positive, got " + samples);
        }
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("Tolerance must be positive, got " + tolerance);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("Iteration cap must be positive, got " + maxIterations);
        }
        this.damping = damping;
        this.samples = samples;
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
        this.seed = seed;
    }

    /**
     * Reads parameters from a properties file, on top of {@link #DEFAULTS}.
     *
     * @param path path of the properties file
     * @return the parameters
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static RankParameters load(Path path) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = new FileInputStream(path.toFile())) {
            properties.load(in);
        }
        return DEFAULTS.with(properties);
    }

    /** Returns a copy overridden by the keys present in {@code properties}. */
    public RankParameters with(Properties properties) {
        SortedSet<String> unrecognized = unrecognizedKeys(properties);
        if (!unrecognized.isEmpty()) {
            logger.warn("Ignoring unknown ranking parameters {} (known: {})", unrecognized, KEYS);
        }
        RankParameters p = this;
        try {
            String value;
            if ((value = properties.getProperty("damping")) != null)
                p = p.withDamping(Double.parseDouble(value.strip()));
            if ((value = properties.getProperty("samples")) != null)
                p = p.withSamples(Integer.parseInt(value.strip()));
            if ((value = properties.getProperty("tolerance")) != null)
                p = p.withTolerance(Double.parseDouble(value.strip()));
            if ((value = properties.getProperty("max-iterations")) != null)
                p = p.withMaxIterations(Integer.parseInt(value.strip()));
            if ((value = properties.getProperty("seed")) != null)
                p = p.withSeed(Long.parseLong(value.strip()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in ranking parameters: " + e.getMessage(), e);
        }
        return p;
    }

    /** Returns the keys of {@code properties} that are not ranking parameters, sorted. */
    static SortedSet<String> unrecognizedKeys(Properties properties) {
        SortedSet<String> keys = new TreeSet<>(properties.stringPropertyNames());
        keys.removeAll(KEYS);
        return keys;
    }

    public RankParameters withDamping(double damping) {
        return new RankParameters(damping, samples, tolerance, maxIterations, seed);
    }

    public RankParameters withSamples(int samples) {
        return new RankParameters(damping, samples, tolerance, maxIterations, seed);
    }

    public RankParameters withTolerance(double tolerance) {
        return new RankParameters(damping, samples, tolerance, maxIterations, seed);
    }

    public RankParameters withMaxIterations(int maxIterations) {
        return new RankParameters(damping, samples, tolerance, maxIterations, seed);
    }

    public RankParameters withSeed(long seed) {
        return new RankParameters(damping, samples, tolerance, maxIterations, seed);
    }

    public double getDamping() {
        return damping;
    }

    public int getSamples() {
        return samples;
    }

    public double getTolerance() {
        return tolerance;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public boolean hasSeed() {
        return seed != null;
    }

    /** Returns a new random source for the sampling estimator, reproducible if a seed was set. */
    public RandomSource newRandomSource() {
        return seed != null ? RandomSource.seeded(seed) : RandomSource.create();
    }

    @Override
    public String toString() {
        return "damping=" + damping + ", samples=" + samples + ", tolerance=" + tolerance + ", max-iterations="
                + maxIterations + (seed != null ? ", seed=" + seed : "");
    }
}
