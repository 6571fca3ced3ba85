/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.softwareheritage.pagerank.LinkGraph;
import org.softwareheritage.pagerank.RankResult;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Prints the sampled and iterated ranks of a corpus side by side.
 */
public class RankPrinter {
    /** Output formats. */
    public enum Format {
        TEXT, CSV, JSON;

        public static Format parse(String name) {
            try {
                return valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown output format: " + name + " (expected text, csv or json)");
            }
        }
    }

    private final Format format;

    public RankPrinter(Format format) {
        this.format = format;
    }

    /**
     * Writes both results, pages sorted by name.
     *
     * @param out destination, flushed but not closed
     * @param sampled result of the sampling estimator
     * @param iterated result of the iterative estimator, on the same graph
     */
    public void print(Writer out, RankResult sampled, RankResult iterated) throws IOException {
        if (sampled.getGraph() != iterated.getGraph()) {
            throw new IllegalArgumentException("Results were computed on different graphs");
        }
        switch (format) {
            case TEXT:
                printText(out, sampled, iterated);
                break;
            case CSV:
                printCsv(out, sampled, iterated);
                break;
            case JSON:
                printJson(out, sampled, iterated);
                break;
        }
        out.flush();
    }

    private void printText(Writer out, RankResult sampled, RankResult iterated) throws IOException {
        out.write(String.format(Locale.ROOT, "PageRank Results from Sampling (n = %d)%n", sampled.getSteps()));
        printTextRanks(out, sampled);
        out.write(String.format("PageRank Results from Iteration%n"));
        printTextRanks(out, iterated);
    }

    private void printTextRanks(Writer out, RankResult result) throws IOException {
        LinkGraph graph = result.getGraph();
        for (int i = 0; i < graph.numPages(); i++) {
            out.write(String.format(Locale.ROOT, "  %s: %.4f%n", graph.getPage(i), result.getDouble(i)));
        }
    }

    private void printCsv(Writer out, RankResult sampled, RankResult iterated) throws IOException {
        CSVPrinter csvPrinter = new CSVPrinter(out, CSVFormat.RFC4180);
        csvPrinter.printRecord("page", "sampled", "iterated");
        LinkGraph graph = sampled.getGraph();
        for (int i = 0; i < graph.numPages(); i++) {
            csvPrinter.printRecord(graph.getPage(i), sampled.getDouble(i), iterated.getDouble(i));
        }
        csvPrinter.flush();
    }

    private void printJson(Writer out, RankResult sampled, RankResult iterated) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("samples", sampled.getSteps());
        document.put("iterations", iterated.getSteps());
        document.put("sampling", toOrderedMap(sampled));
        document.put("iteration", toOrderedMap(iterated));

        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        out.write(mapper.writeValueAsString(document));
        out.write(System.lineSeparator());
    }

    private static Map<String, Double> toOrderedMap(RankResult result) {
        Map<String, Double> map = new LinkedHashMap<>();
        LinkGraph graph = result.getGraph();
        for (int i = 0; i < graph.numPages(); i++) {
            map.put(graph.getPage(i), result.getDouble(i));
        }
        return map;
    }
}
