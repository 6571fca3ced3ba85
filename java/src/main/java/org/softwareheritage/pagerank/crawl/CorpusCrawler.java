/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank.crawl;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.softwareheritage.pagerank.LinkGraph;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link LinkGraph} from a directory of HTML pages.
 * <p>
 * Every regular file whose name ends in {@code .html} is a page, named after its file name. Links
 * are the {@code href} attributes of {@code <a>} tags; only links naming another page of the same
 * directory are kept, so self links and external links are dropped.
 *
 * @author The Software Heritage developers
 */

public class CorpusCrawler {
    private final static Logger logger = LoggerFactory.getLogger(CorpusCrawler.class);

    static final String PAGE_SUFFIX = ".html";

    private CorpusCrawler() {
    }

    /**
     * Crawls a corpus directory (non recursively).
     *
     * @param directory the directory containing the pages
     * @return the link graph of the corpus
     * @throws NotDirectoryException if {@code directory} is not a directory
     */
    public static LinkGraph crawl(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new NotDirectoryException(directory.toString());
        }

        Map<String, Set<String>> pages = new HashMap<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + PAGE_SUFFIX)) {
            for (Path file : stream) {
                if (!Files.isRegularFile(file))
                    continue;
                String page = file.getFileName().toString();
                Set<String> links = extractLinks(Files.readString(file, StandardCharsets.UTF_8));
                links.remove(page);
                pages.put(page, links);
            }
        }

        long dropped = 0;
        for (Set<String> links : pages.values()) {
            int before = links.size();
            links.retainAll(pages.keySet());
            dropped += before - links.size();
        }

        LinkGraph graph = LinkGraph.fromMap(pages);
        logger.info("Crawled {}: {} pages, {} links ({} links outside the corpus dropped)", directory,
                graph.numPages(), graph.numLinks(), dropped);
        return graph;
    }

    /**
     * Returns the distinct link targets of an HTML document, in order of appearance.
     * <p>
     * The document is parsed, so tag and attribute names are case insensitive, attribute values may
     * use either quote, and links inside comments or scripts are ignored.
     */
    public static Set<String> extractLinks(String html) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : Jsoup.parse(html).select("a[href]")) {
            links.add(anchor.attr("href"));
        }
        return links;
    }
}
