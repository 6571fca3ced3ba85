/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrays;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable hyperlink graph of a closed corpus of pages.
 * <p>
 * Pages are identified by name (typically a file name) and are assigned dense integer ids following
 * their lexicographic order. Both the forward (page to linked pages) and the backward (page to
 * linking pages) adjacency lists are kept, so that estimators can walk the graph in either
 * direction without rebuilding it.
 * <p>
 * The graph is read-only once built and may be shared between threads.
 *
 * @author The Software Heritage developers
 */

public class LinkGraph {
    private final String[] pages;
    private final Object2IntOpenHashMap<String> pageIds;
    private final int[][] successors;
    private final int[][] predecessors;
    private final long numLinks;

    private LinkGraph(String[] pages, Object2IntOpenHashMap<String> pageIds, int[][] successors,
            int[][] predecessors, long numLinks) {
        this.pages = pages;
        this.pageIds = pageIds;
        this.successors = successors;
        this.predecessors = predecessors;
        this.numLinks = numLinks;
    }

    /**
     * Builds a graph from a page to links mapping.
     *
     * @param links mapping from each page of the corpus to the pages it links to
     * @return the corresponding graph
     * @throws IllegalArgumentException if a link points outside of the corpus or if a page links to
     *             itself
     */
    public static LinkGraph fromMap(Map<String, ? extends Collection<String>> links) {
        String[] pages = links.keySet().toArray(new String[0]);
        for (String page : pages) {
            if (page == null) {
                throw new IllegalArgumentException("Null page in link graph");
            }
        }
        ObjectArrays.quickSort(pages);

        Object2IntOpenHashMap<String> pageIds = new Object2IntOpenHashMap<>(pages.length);
        pageIds.defaultReturnValue(-1);
        for (int i = 0; i < pages.length; i++) {
            pageIds.put(pages[i], i);
        }

        int n = pages.length;
        int[][] successors = new int[n][];
        IntArrayList[] incoming = new IntArrayList[n];
        for (int i = 0; i < n; i++) {
            incoming[i] = new IntArrayList();
        }

        long numLinks = 0;
        for (int src = 0; src < n; src++) {
            Collection<String> targets = links.get(pages[src]);
            if (targets == null) {
                targets = Collections.emptySet();
            }
            IntArrayList out = new IntArrayList(targets.size());
            for (String target : targets) {
                int dst = pageIds.getInt(target);
                if (dst == -1) {
                    throw new IllegalArgumentException(
                            "Page " + pages[src] + " links to " + target + ", which is not part of the corpus");
                }
                if (dst == src) {
                    throw new IllegalArgumentException("Page " + pages[src] + " links to itself");
                }
                if (!out.contains(dst)) {
                    out.add(dst);
                }
            }
            successors[src] = out.toIntArray();
            Arrays.sort(successors[src]);
            for (int dst : successors[src]) {
                incoming[dst].add(src);
            }
            numLinks += successors[src].length;
        }

        // Sources are visited in increasing order, so the lists are already sorted
        int[][] predecessors = new int[n][];
        for (int dst = 0; dst < n; dst++) {
            predecessors[dst] = incoming[dst].toIntArray();
        }

        return new LinkGraph(pages, pageIds, successors, predecessors, numLinks);
    }

    /** Returns the number of pages in the corpus. */
    public int numPages() {
        return pages.length;
    }

    /** Returns the number of links between pages of the corpus. */
    public long numLinks() {
        return numLinks;
    }

    /** Returns true if the corpus has no page at all. */
    public boolean isEmpty() {
        return pages.length == 0;
    }

    /**
     * Converts a page id to its name.
     *
     * @param pageId page id, between 0 (included) and {@link #numPages()} (excluded)
     * @return the page name
     */
    public String getPage(int pageId) {
        return pages[pageId];
    }

    /**
     * Converts a page name to its id.
     *
     * @param page page name
     * @return the page id
     * @throws IllegalArgumentException if the page is not part of the corpus
     */
    public int getPageId(String page) {
        int pageId = pageIds.getInt(page);
        if (pageId == -1) {
            throw new IllegalArgumentException("Unknown page: " + page);
        }
        return pageId;
    }

    /** Returns true if the given page is part of the corpus. */
    public boolean contains(String page) {
        return pageIds.containsKey(page);
    }

    /** Returns the number of pages linked from the given page. */
    public int outdegree(int pageId) {
        return successors[pageId].length;
    }

    /** Returns the number of pages linking to the given page. */
    public int indegree(int pageId) {
        return predecessors[pageId].length;
    }

    /** Returns true if the given page has no outgoing link inside the corpus. */
    public boolean isDangling(int pageId) {
        return successors[pageId].length == 0;
    }

    /**
     * Returns the sorted ids of the pages linked from the given page.
     * <p>
     * The returned array is shared and must not be modified.
     */
    public int[] successorArray(int pageId) {
        return successors[pageId];
    }

    /**
     * Returns the sorted ids of the pages linking to the given page.
     * <p>
     * The returned array is shared and must not be modified.
     */
    public int[] predecessorArray(int pageId) {
        return predecessors[pageId];
    }

    /**
     * Returns the names of the pages linked from the given page.
     *
     * @param page page name
     * @return an unmodifiable set of page names, in page id order
     */
    public Set<String> links(String page) {
        int[] succ = successors[getPageId(page)];
        Set<String> result = new LinkedHashSet<>(succ.length);
        for (int dst : succ) {
            result.add(pages[dst]);
        }
        return Collections.unmodifiableSet(result);
    }

    /** Returns the names of all pages, in page id (lexicographic) order. */
    public List<String> pages() {
        return Collections.unmodifiableList(Arrays.asList(pages));
    }

    /** Returns the graph as a page to links mapping, in page id order. */
    public Map<String, Set<String>> toMap() {
        Map<String, Set<String>> result = new LinkedHashMap<>(pages.length);
        for (String page : pages) {
            result.put(page, links(page));
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return "LinkGraph[" + pages.length + " pages, " + numLinks + " links]";
    }
}
