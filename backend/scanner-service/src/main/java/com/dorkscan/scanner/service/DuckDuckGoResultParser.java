package com.dorkscan.scanner.service;

import com.dorkscan.scanner.model.SearchOutcome;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class DuckDuckGoResultParser {

    private static final Logger log = LoggerFactory.getLogger(DuckDuckGoResultParser.class);

    /**
     * Runs each {@link ResultLinkSelector} in turn and returns the first non-empty link set,
     * truncated to {@code limit}.
     */
    public SearchOutcome parse(String html, int limit) {
        if (html == null || html.isBlank()) return SearchOutcome.tryNext("empty page");
        Document doc = Jsoup.parse(html);
        for (ResultLinkSelector selector : ResultLinkSelector.values()) {
            List<String> links = collect(selector.anchors(doc));
            if (!links.isEmpty()) {
                log.debug("Found {} links using {} selector", links.size(), selector);
                return SearchOutcome.hits(links.subList(0, Math.min(limit, links.size())));
            }
        }
        return SearchOutcome.tryNext("no results on page");
    }

    private List<String> collect(List<Element> anchors) {
        Set<String> links = new LinkedHashSet<>();
        for (Element a : anchors) {
            String link = unwrapRedirect(a.attr("href").trim());
            if (link.startsWith("http")) links.add(link);
        }
        return new ArrayList<>(links);
    }

    // "/l/?uddg=<encoded target>" links point through DuckDuckGo's redirector
    static String unwrapRedirect(String href) {
        if (!href.contains("/l/?")) return href;
        try {
            String query = URI.create("https://duckduckgo.com" + href.substring(href.indexOf("/l/?"))).getRawQuery();
            if (query == null) return href;
            for (String kv : query.split("&")) {
                String[] p = kv.split("=", 2);
                if (p.length == 2 && "uddg".equals(p[0])) {
                    return URLDecoder.decode(p[1], StandardCharsets.UTF_8);
                }
            }
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable redirect link {}: {}", href, e.getMessage());
        }
        return href;
    }
}
