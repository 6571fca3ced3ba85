/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank.algo;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.softwareheritage.pagerank.GraphTest;
import org.softwareheritage.pagerank.LinkGraph;
import org.softwareheritage.pagerank.RankResult;

public class IterativeEstimatorTest extends GraphTest {
    @Test
    public void twoPagesLinkingToEachOther() {
        IterativeEstimator estimator = new IterativeEstimator(TWO_CYCLE, DAMPING);
        RankResult result = estimator.estimate();
        assertRanks(ranks("1.html", 0.5, "2.html", 0.5), result, 1E-12);
        Assertions.assertEquals(1, result.getSteps());
        Assertions.assertEquals(EstimatorState.CONVERGED, estimator.getState());
        Assertions.assertEquals(RankResult.Method.ITERATION, result.getMethod());
    }

    @Test
    public void singlePage() {
        assertRanks(ranks("1.html", 1.0), new IterativeEstimator(SINGLE, DAMPING).estimate(), 1E-12);
    }

    @Test
    public void cycleIsUniform() {
        assertRanks(ranks("1.html", 1. / 3, "2.html", 1. / 3, "3.html", 1. / 3),
                new IterativeEstimator(THREE_CYCLE, DAMPING).estimate(), 1E-12);
    }

    @Test
    public void hub() {
        IterativeEstimator estimator = new IterativeEstimator(CORPUS0, DAMPING);
        RankResult result = estimator.estimate();
        assertRanks(ranks("1.html", 0.21977732727568303, "2.html", 0.429357664651155, "3.html", 0.21977732727568303,
                "4.html", 0.13108768079747898), result, 1E-9);
        Assertions.assertEquals(11, estimator.getIteration());
        Assertions.assertTrue(estimator.getLastDelta() <= estimator.getTolerance());
    }

    @Test
    public void hubWithTightTolerance() {
        RankResult result = new IterativeEstimator(CORPUS0, DAMPING, 1E-12, 1000).estimate();
        assertRanks(ranks("1.html", 0.21991381963703743, "2.html", 0.4292089873805002, "3.html",
                0.21991381963703743, "4.html", 0.13096337334542496), result, 1E-10);
    }

    @Test
    public void danglingMassIsRedistributed() {
        RankResult result = new IterativeEstimator(DANGLING, DAMPING).estimate();
        assertRanks(ranks("1.html", 0.6489640782988737, "2.html", 0.351035921701126), result, 1E-9);
        Assertions.assertEquals(8, result.getSteps());

        result = new IterativeEstimator(FORK, DAMPING).estimate();
        assertRanks(ranks("a.html", 0.3934112065342797, "b.html", 0.30329439673286007, "c.html",
                0.30329439673286007), result, 1E-9);
        Assertions.assertEquals(10, result.getSteps());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.05, 0.5, 0.85, 0.95})
    public void ranksSumToOne(double damping) {
        for (LinkGraph graph : new LinkGraph[]{TWO_CYCLE, DANGLING, SINGLE, THREE_CYCLE, CORPUS0, FORK}) {
            assertSumsToOne(new IterativeEstimator(graph, damping).estimate(), 1E-9);
        }
    }

    @Test
    public void deterministic() {
        RankResult a = new IterativeEstimator(FORK, DAMPING).estimate();
        RankResult b = new IterativeEstimator(FORK, DAMPING).estimate();
        Assertions.assertArrayEquals(a.toArray(), b.toArray());
    }

    @Test
    public void iterationCap() {
        IterativeEstimator estimator = new IterativeEstimator(CORPUS0, DAMPING, 1E-12, 5);
        ConvergenceException e = Assertions.assertThrows(ConvergenceException.class, estimator::estimate);
        Assertions.assertEquals(5, e.getIterations());
        Assertions.assertTrue(e.getLastDelta() > 1E-12);
        Assertions.assertEquals(EstimatorState.ITERATING, estimator.getState());
    }

    @Test
    public void invalidArguments() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new IterativeEstimator(EMPTY, DAMPING));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new IterativeEstimator(CORPUS0, 0));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new IterativeEstimator(CORPUS0, DAMPING, 0, 10));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new IterativeEstimator(CORPUS0, DAMPING, 0.001, 0));
    }
}
