/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank;

/**
 * Probability, for a random surfer, of visiting each page of the corpus at the next step.
 *
 * @see TransitionModel
 */
public class ProbabilityDistribution extends PageVector {
    private final String source;

    ProbabilityDistribution(LinkGraph graph, String source, double[] probabilities) {
        super(graph, probabilities);
        this.source = source;
    }

    /** Returns the page the surfer is currently on. */
    public String getSource() {
        return source;
    }
}
