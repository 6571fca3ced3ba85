/*
 * Copyright (c) 2026 The Software Heritage developers
 * See the AUTHORS file at the top-level directory of this distribution
 * License: GNU General Public License version 3, or any later version
 * See top-level LICENSE file for more information
 */

package org.softwareheritage.pagerank.crawl;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.softwareheritage.pagerank.LinkGraph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class CorpusCrawlerTest {
    static void writePage(Path dir, String name, String... links) throws IOException {
        StringBuilder html = new StringBuilder("<!DOCTYPE html>\n<html>\n<head><title>" + name + "</title></head>\n<body>\n");
        for (String link : links) {
            html.append("  <a href=\"").append(link).append("\">").append(link).append("</a>\n");
        }
        html.append("</body>\n</html>\n");
        Files.writeString(dir.resolve(name), html.toString());
    }

    @Test
    public void crawlKeepsOnlyLinksInsideTheCorpus(@TempDir Path dir) throws IOException {
        writePage(dir, "1.html", "2.html", "1.html", "https://example.org/", "missing.html");
        writePage(dir, "2.html", "1.html", "3.html", "3.html");
        writePage(dir, "3.html");
        Files.writeString(dir.resolve("notes.txt"), "<a href=\"1.html\">not a page</a>");
        Files.createDirectory(dir.resolve("archive.html"));

        LinkGraph graph = CorpusCrawler.crawl(dir);
        Assertions.assertEquals(Map.of("1.html", Set.of("2.html"), "2.html", Set.of("1.html", "3.html"), "3.html",
                Set.<String>of()), graph.toMap());
    }

    @Test
    public void emptyDirectory(@TempDir Path dir) throws IOException {
        Assertions.assertTrue(CorpusCrawler.crawl(dir).isEmpty());
    }

    @Test
    public void notADirectory(@TempDir Path dir) throws IOException {
        writePage(dir, "1.html");
        Assertions.assertThrows(NotDirectoryException.class, () -> CorpusCrawler.crawl(dir.resolve("1.html")));
        Assertions.assertThrows(NotDirectoryException.class, () -> CorpusCrawler.crawl(dir.resolve("nope")));
    }

    @Test
    public void extractLinks() {
        String html = "<p>See <a href=\"a.html\">a</a>, <a class=\"x\" id=\"y\" href=\"b.html\">b</a>"
                + " and <a\nhref=\"c.html\">c</a>.</p><a name=\"top\">no link</a><link href=\"style.css\">"
                + "<a href=\"a.html\">again</a>";
        Assertions.assertEquals(List.of("a.html", "b.html", "c.html"),
                List.copyOf(CorpusCrawler.extractLinks(html)));
    }

    @Test
    public void commentedOutLinksAreIgnored() {
        String html = "<body><!-- <a href=\"2.html\">old</a> --><a href=\"3.html\">new</a>"
                + "<script>var s = '<a href=\"4.html\">';</script></body>";
        Assertions.assertEquals(List.of("3.html"), List.copyOf(CorpusCrawler.extractLinks(html)));
    }

    @Test
    public void tagAndAttributeCaseDoesNotMatter() {
        Assertions.assertEquals(List.of("2.html", "3.html"),
                List.copyOf(CorpusCrawler.extractLinks("<A HREF=\"2.html\">two</A><a Href=\"3.html\">three</a>")));
    }

    @Test
    public void hrefMayUseAnyQuoting() {
        Assertions.assertEquals(List.of("2.html", "3.html", "4.html"), List.copyOf(CorpusCrawler
                .extractLinks("<a href='2.html'>two</a><a href=3.html>three</a><a href = \"4.html\">four</a>")));
    }

    @Test
    public void crawlIgnoresCommentedOutLinks(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("1.html"), "<html><body><!-- <a href=\"2.html\">old</a> --></body></html>");
        Files.writeString(dir.resolve("2.html"), "<html><body><A HREF='1.html'>back</A></body></html>");
        LinkGraph graph = CorpusCrawler.crawl(dir);
        Assertions.assertEquals(Set.<String>of(), graph.links("1.html"));
        Assertions.assertEquals(Set.of("1.html"), graph.links("2.html"));
    }
}
