/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank;

import java.util.Arrays;

/**
 * Random surfer transition rule.
 * <p>
 * With probability <var>d</var> (the damping factor) the surfer follows one of the links of the
 * current page, chosen uniformly; otherwise it jumps to any page of the corpus, chosen uniformly.
 * A dangling page (one without links) is treated as linking to every page, so the next page is
 * uniform over the whole corpus.
 *
 * @author The Software Heritage developers
 */

public final class TransitionModel {
    private TransitionModel() {
    }

    /**
     * Returns the next page distribution of a surfer on the given page.
     *
     * @param graph the corpus
     * @param page current page, must be part of the corpus
     * @param damping damping factor, in (0,1)
     * @return a distribution over all the pages of the corpus
     */
    public static ProbabilityDistribution distribution(LinkGraph graph, String page, double damping) {
        checkDamping(damping);
        int pageId = graph.getPageId(page);
        double[] probabilities = new double[graph.numPages()];
        fill(graph, pageId, damping, probabilities);
        return new ProbabilityDistribution(graph, page, probabilities);
    }

    /**
     * Writes the next page distribution of a surfer on the given page id into an array.
     * <p>
     * Preconditions are not checked again here; this is the inner loop of sampling.
     *
     * @param graph the corpus
     * @param pageId current page id
     * @param damping damping factor, in (0,1)
     * @param probabilities output array, indexed by page id, of length at least
     *            {@link LinkGraph#numPages()}
     */
    public static void fill(LinkGraph graph, int pageId, double damping, double[] probabilities) {
        int n = graph.numPages();
        int[] succ = graph.successorArray(pageId);
        if (succ.length == 0) {
            Arrays.fill(probabilities, 0, n, 1.0 / n);
            return;
        }
        double jump = (1 - damping) / n;
        Arrays.fill(probabilities, 0, n, jump);
        double follow = damping / succ.length;
        for (int dst : succ) {
            probabilities[dst] += follow;
        }
    }

    /**
     * Checks that a damping factor is in the open interval (0,1).
     *
     * @throws IllegalArgumentException otherwise
     */
    public static void checkDamping(double damping) {
        if (!(damping > 0 && damping < 1)) {
            throw new IllegalArgumentException("Damping factor must be in (0,1), got " + damping);
        }
    }
}
