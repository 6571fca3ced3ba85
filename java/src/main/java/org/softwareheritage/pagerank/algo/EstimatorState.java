/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank.algo;

/**
 * Lifecycle of a rank estimation.
 * <p>
 * Estimators start in {@link #INIT}, move to {@link #SAMPLING} or {@link #ITERATING}, and end in
 * {@link #EXHAUSTED} (sampling budget spent) or {@link #CONVERGED} (fixed point reached).
 */
public enum EstimatorState {
    /** Nothing computed yet */
    INIT,
    /** Random walk in progress */
    SAMPLING,
    /** Relaxation sweeps in progress */
    ITERATING,
    /** Iteration reached the tolerance */
    CONVERGED,
    /** All samples were drawn */
    EXHAUSTED;

    /** Returns true if no more work is expected in this state. */
    public boolean isTerminal() {
        return this == CONVERGED || this == EXHAUSTED;
    }
}
