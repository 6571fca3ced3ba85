/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Parameter;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.softwareheritage.pagerank.algo.IterativeEstimator;
import org.softwareheritage.pagerank.algo.SamplingEstimator;
import org.softwareheritage.pagerank.crawl.CorpusCrawler;
import org.softwareheritage.pagerank.utils.RankPrinter;
import org.softwareheritage.pagerank.utils.RankVectors;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Command line entry point: ranks the pages of a corpus directory with both estimators.
 * <p>
 * Sample invocation:
 *
 * <pre>
 *   $ java -cp swh-pagerank-*.jar org.softwareheritage.pagerank.App --samples 100000 --format csv corpus0
 * </pre>
 *
 * @author The Software Heritage developers
 */

public class App {
    final static Logger logger = LoggerFactory.getLogger(App.class);

    /** Exit code for command line errors. */
    static final int EXIT_USAGE = 1;
    /** Exit code for failures while crawling or ranking. */
    static final int EXIT_FAILURE = 2;

    /** Runs the estimators once the corpus graph and the parameters are known. */
    @FunctionalInterface
    interface Ranker {
        RankResult[] rank(LinkGraph graph, RankParameters parameters, boolean parallel);
    }

    /**
     * Main entrypoint.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the command line.
     *
     * @param args command line arguments
     * @param out where results are printed
     * @param err where errors are reported
     * @return the process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        return run(args, out, err, App::rank);
    }

    /** Runs the command line with the given estimators. */
    static int run(String[] args, PrintStream out, PrintStream err, Ranker ranker) {
        JSAPResult config = parseArgs(args, err);
        if (config == null) {
            return EXIT_USAGE;
        }

        RankParameters parameters;
        RankPrinter printer;
        try {
            parameters = configure(config);
            printer = new RankPrinter(RankPrinter.Format.parse(config.getString("format")));
        } catch (IllegalArgumentException | IOException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        Path corpus = Paths.get(config.getString("corpus"));
        try {
            LinkGraph graph = CorpusCrawler.crawl(corpus);
            RankResult[] results = ranker.rank(graph, parameters, config.getBoolean("parallel"));
            logger.info("Distance between sampled and iterated ranks: L1 {}, max {}",
                    RankVectors.l1Distance(results[0].toArray(), results[1].toArray()),
                    RankVectors.maxAbsDifference(results[0].toArray(), results[1].toArray()));

            Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            printer.print(writer, results[0], results[1]);
        } catch (IOException e) {
            logger.error("Cannot read corpus {}", corpus, e);
            err.println("Cannot read corpus " + corpus + ": " + e);
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println("Cannot rank corpus " + corpus + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalStateException e) {
            // non-convergence or rank mass leak
            logger.error("Ranking of {} failed", corpus, e);
            err.println("Cannot rank corpus " + corpus + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
        return 0;
    }

    private static JSAPResult parseArgs(String[] args, PrintStream err) {
        JSAP jsap = new JSAP();
        JSAPResult config;
        try {
            for (Parameter parameter : new Parameter[]{
                    new FlaggedOption("damping", JSAP.DOUBLE_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, 'd', "damping",
                            "Damping factor (default: " + PageRank.DEFAULT_DAMPING + ")."),
                    new FlaggedOption("samples", JSAP.INTEGER_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, 'n', "samples",
                            "Number of random walk steps (default: " + SamplingEstimator.DEFAULT_SAMPLES + ")."),
                    new FlaggedOption("tolerance", JSAP.DOUBLE_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, 't',
                            "tolerance", "Max rank change at which iteration stops (default: "
                                    + IterativeEstimator.DEFAULT_TOLERANCE + ")."),
                    new FlaggedOption("maxIterations", JSAP.INTEGER_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, 'i',
                            "max-iterations",
                            "Iteration cap (default: " + IterativeEstimator.DEFAULT_MAX_ITERATIONS + ")."),
                    new FlaggedOption("seed", JSAP.LONG_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, 's', "seed",
                            "Seed of the random walk, for reproducible results."),
                    new FlaggedOption("format", JSAP.STRING_PARSER, "text", JSAP.NOT_REQUIRED, 'f', "format",
                            "Output format: text, csv or json."),
                    new FlaggedOption("config", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, 'c', "config",
                            "Properties file with default parameters, overridden by flags."),
                    new Switch("parallel", 'p', "parallel", "Run both estimators concurrently."),
                    new Switch("help", 'h', "help", "Print this help message."),
                    new UnflaggedOption("corpus", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.REQUIRED,
                            JSAP.NOT_GREEDY, "Directory containing the HTML pages.")}) {
                jsap.registerParameter(parameter);
            }
            config = jsap.parse(args);
        } catch (JSAPException e) {
            err.println("Cannot parse arguments: " + e.getMessage());
            return null;
        }

        // usage and errors go to the caller's stream, never to System.err
        if (config.getBoolean("help", false)) {
            err.println("Ranks the pages of a directory of HTML files with PageRank, both by random sampling and by "
                    + "iteration.");
            printUsage(jsap, err);
            return null;
        }
        if (!config.success()) {
            for (Iterator<?> errors = config.getErrorMessageIterator(); errors.hasNext();) {
                err.println("Error: " + errors.next());
            }
            printUsage(jsap, err);
            return null;
        }
        return config;
    }

    private static void printUsage(JSAP jsap, PrintStream err) {
        err.println("Usage: java " + App.class.getName() + " " + jsap.getUsage());
        err.println(jsap.getHelp());
    }

    private static RankParameters configure(JSAPResult config) throws IOException {
        RankParameters parameters = RankParameters.DEFAULTS;
        if (config.userSpecified("config")) {
            parameters = RankParameters.load(Paths.get(config.getString("config")));
        }
        if (config.userSpecified("damping"))
            parameters = parameters.withDamping(config.getDouble("damping"));
        if (config.userSpecified("samples"))
            parameters = parameters.withSamples(config.getInt("samples"));
        if (config.userSpecified("tolerance"))
            parameters = parameters.withTolerance(config.getDouble("tolerance"));
        if (config.userSpecified("maxIterations"))
            parameters = parameters.withMaxIterations(config.getInt("maxIterations"));
        if (config.userSpecified("seed"))
            parameters = parameters.withSeed(config.getLong("seed"));
        logger.info("Ranking parameters: {}", parameters);
        return parameters;
    }

    /**
     * Runs both estimators on a graph.
     *
     * @param parallel whether to run the two estimators on separate threads
     * @return the sampled ranks followed by the iterated ranks
     */
    static RankResult[] rank(LinkGraph graph, RankParameters parameters, boolean parallel) {
        if (!parallel) {
            return new RankResult[]{sample(graph, parameters), iterate(graph, parameters)};
        }

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<RankResult> sampled = executor.submit(() -> sample(graph, parameters));
            Future<RankResult> iterated = executor.submit(() -> iterate(graph, parameters));
            return new RankResult[]{sampled.get(), iterated.get()};
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new RuntimeException(e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private static RankResult sample(LinkGraph graph, RankParameters parameters) {
        return PageRank.samplePageRank(graph, parameters.getDamping(), parameters.getSamples(),
                parameters.newRandomSource());
    }

    private static RankResult iterate(LinkGraph graph, RankParameters parameters) {
        return PageRank.iteratePageRank(graph, parameters.getDamping(), parameters.getTolerance(),
                parameters.getMaxIterations());
    }
}
