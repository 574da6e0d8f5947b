package com.friendfeed.aggregate.feed;

import org.jsoup.nodes.Document;
import org.jsoup.select.Elements;

public enum FeedFormat {
    ATOM("feed > entry"),
    RSS("rss > channel > item"),
    UNRECOGNIZED(null);

    private final String itemSelector;

    FeedFormat(String itemSelector) {
        this.itemSelector = itemSelector;
    }

    public Elements items(Document xml) {
        if (itemSelector == null) {
            return new Elements();
        }
        return xml.select(itemSelector);
    }

    /**
     * Atom entries win over RSS items when a document somehow carries both.
     */
    public static FeedFormat detect(Document xml) {
        for (FeedFormat candidate : new FeedFormat[] {ATOM, RSS}) {
            if (!candidate.items(xml).isEmpty()) {
                return candidate;
            }
        }
        return UNRECOGNIZED;
    }
}
