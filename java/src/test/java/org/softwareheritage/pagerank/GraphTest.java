/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class GraphTest {
    /** Two pages linking to each other. */
    public static final LinkGraph TWO_CYCLE = LinkGraph
            .fromMap(Map.of("1.html", Set.of("2.html"), "2.html", Set.of("1.html")));

    /** 1.html is dangling, 2.html links to it. */
    public static final LinkGraph DANGLING = LinkGraph
            .fromMap(Map.of("1.html", Set.<String>of(), "2.html", Set.of("1.html")));

    /** A single page without links. */
    public static final LinkGraph SINGLE = LinkGraph.fromMap(Map.of("1.html", Set.<String>of()));

    /** 1 -> 2 -> 3 -> 1. */
    public static final LinkGraph THREE_CYCLE = LinkGraph.fromMap(
            Map.of("1.html", Set.of("2.html"), "2.html", Set.of("3.html"), "3.html", Set.of("1.html")));

    /** Four pages, no dangling page, 2.html is the hub. */
    public static final LinkGraph CORPUS0 = LinkGraph.fromMap(Map.of("1.html", Set.of("2.html"), "2.html",
            Set.of("1.html", "3.html"), "3.html", Set.of("2.html", "4.html"), "4.html", Set.of("2.html")));

    /** a links to b and c, b is dangling, c links back to a. */
    public static final LinkGraph FORK = LinkGraph
            .fromMap(Map.of("a.html", Set.of("b.html", "c.html"), "b.html", Set.<String>of(), "c.html", Set.of("a.html")));

    public static final LinkGraph EMPTY = LinkGraph.fromMap(new HashMap<String, Set<String>>());

    public static final double DAMPING = PageRank.DEFAULT_DAMPING;

    public static Map<String, Double> ranks(Object... pageValues) {
        Map<String, Double> expected = new HashMap<>();
        for (int i = 0; i < pageValues.length; i += 2) {
            expected.put((String) pageValues[i], ((Number) pageValues[i + 1]).doubleValue());
        }
        return expected;
    }

    public static void assertRanks(Map<String, Double> expected, PageVector actual, double delta) {
        assertEquals(expected.size(), actual.size(), String.format("Size of vector %s:", actual));
        for (Map.Entry<String, Double> e : expected.entrySet()) {
            assertEquals(e.getValue(), actual.get(e.getKey()), delta, "Value of " + e.getKey() + " in " + actual);
        }
    }

    public static void assertSumsToOne(PageVector actual, double delta) {
        assertEquals(1.0, actual.sum(), delta, String.format("Sum of %s:", actual));
    }
}
