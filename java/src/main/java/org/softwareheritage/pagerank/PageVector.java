/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank;

import it.unimi.dsi.fastutil.objects.Object2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMaps;
import org.softwareheritage.pagerank.utils.RankVectors;

import java.util.Arrays;

/**
 * A real value attached to every page of a {@link LinkGraph}, indexed by page id.
 * <p>
 * Pages without any mass still have an entry (with value zero). Instances are immutable.
 *
 * @author The Software Heritage developers
 */

public abstract class PageVector {
    protected final LinkGraph graph;
    protected final double[] values;

    /**
     * Constructor.
     *
     * @param graph the graph whose pages index the vector
     * @param values one value per page id; the array is owned by the new instance, so public
     *            subclass constructors must pass a copy
     */
    protected PageVector(LinkGraph graph, double[] values) {
        if (values.length != graph.numPages()) {
            throw new IllegalArgumentException(
                    "Vector size (" + values.length + ") is different from graph size (" + graph.numPages() + ")");
        }
        this.graph = graph;
        this.values = values;
    }

    public LinkGraph getGraph() {
        return graph;
    }

    /** Returns the value of the given page. */
    public double get(String page) {
        return values[graph.getPageId(page)];
    }

    /** Returns the value of the given page id. */
    public double getDouble(int pageId) {
        return values[pageId];
    }

    public int size() {
        return values.length;
    }

    /** Returns the sum of all values. */
    public double sum() {
        return RankVectors.sum(values);
    }

    /** Returns a copy of the values, indexed by page id. */
    public double[] toArray() {
        return Arrays.copyOf(values, values.length);
    }

    /** Returns an unmodifiable page to value mapping, iterating in page id order. */
    public Object2DoubleMap<String> toMap() {
        Object2DoubleLinkedOpenHashMap<String> map = new Object2DoubleLinkedOpenHashMap<>(values.length);
        for (int i = 0; i < values.length; i++) {
            map.put(graph.getPage(i), values[i]);
        }
        return Object2DoubleMaps.unmodifiable(map);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(graph.getPage(i)).append('=').append(values[i]);
        }
        return sb.append('}').toString();
    }
}
