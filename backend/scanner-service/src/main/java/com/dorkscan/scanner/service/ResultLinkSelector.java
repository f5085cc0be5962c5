package com.dorkscan.scanner.service;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Ways of pulling result links out of a DuckDuckGo HTML page, in the order they are tried.
 */
enum ResultLinkSelector {

    /** Anchors carrying the visible result URL. */
    RESULT_URL {
        @Override
        List<Element> anchors(Document doc) {
            return doc.select("a.result__url[href]");
        }
    },

    /** First link inside each result block; survives class renames on the anchor itself. */
    RESULT_CONTAINER {
        @Override
        List<Element> anchors(Document doc) {
            List<Element> anchors = new ArrayList<>();
            for (Element result : doc.select("div.result")) {
                Element a = result.selectFirst("a[href]");
                if (a != null) anchors.add(a);
            }
            return anchors;
        }
    };

    abstract List<Element> anchors(Document doc);
}
