package com.friendfeed.aggregate.feed;

import com.friendfeed.aggregate.model.Post;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

@Service
public class FeedParser {
    private static final Logger log = LoggerFactory.getLogger(FeedParser.class);

    private final PublishedDateFormatter dateFormatter;

    public FeedParser(PublishedDateFormatter dateFormatter) {
        this.dateFormatter = dateFormatter;
    }

    /**
     * Extracts up to {@code maxPosts} posts from an RSS 2.0 or Atom payload. A payload in any other
     * format yields an empty list; an empty or undecodable payload throws {@link FeedParseException}.
     */
    public List<Post> parse(byte[] body, int maxPosts) {
        Document xml = parseDocument(body);
        FeedFormat format = FeedFormat.detect(xml);
        Elements items = format.items(xml);
        log.debug("Detected feed format {} with {} items", format, items.size());

        List<Post> posts = new ArrayList<>();
        int limit = Math.min(Math.max(0, maxPosts), items.size());
        for (int i = 0; i < limit; i++) {
            Element item = items.get(i);
            String title = textOf(item.selectFirst("title"));
            String link = format == FeedFormat.ATOM ? atomLink(item) : textOf(item.selectFirst("link"));
            String published = dateFormatter.format(rawPublished(format, item));
            if (title.isEmpty() || link.isEmpty()) {
                log.debug("Skipping feed item {} without title or link", i);
                continue;
            }
            posts.add(new Post(title, link, published));
        }
        return posts;
    }

    private Document parseDocument(byte[] body) {
        if (body == null || new String(body, StandardCharsets.ISO_8859_1).isBlank()) {
            throw new FeedParseException("empty feed payload");
        }
        try (InputStream input = openPayload(body)) {
            return Jsoup.parse(input, null, "", Parser.xmlParser());
        } catch (IOException e) {
            throw new FeedParseException("unreadable feed payload: " + e.getMessage(), e);
        }
    }

    private InputStream openPayload(byte[] body) throws IOException {
        InputStream raw = new ByteArrayInputStream(body);
        if (body.length >= 2 && (body[0] & 0xFF) == 0x1f && (body[1] & 0xFF) == 0x8b) {
            return new GZIPInputStream(raw);
        }
        return raw;
    }

    private String atomLink(Element entry) {
        Element alternate = entry.selectFirst("link[rel=alternate]");
        String href = alternate == null ? "" : alternate.attr("href").trim();
        if (!href.isEmpty()) {
            return href;
        }
        Element first = entry.selectFirst("link");
        return first == null ? "" : first.attr("href").trim();
    }

    private String rawPublished(FeedFormat format, Element item) {
        if (format == FeedFormat.RSS) {
            return textOf(item.selectFirst("pubDate"));
        }
        String published = textOf(item.selectFirst("published"));
        return published.isEmpty() ? textOf(item.selectFirst("updated")) : published;
    }

    private String textOf(Element element) {
        return element == null ? "" : element.text().trim();
    }
}
