package com.friendfeed.aggregate.feed;

import com.friendfeed.aggregate.model.Post;
import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeedParserTest {
    private final FeedParser parser = new FeedParser(new PublishedDateFormatter("YYYY-MM-DD HH:mm:ss", ZoneOffset.UTC));

    @Test
    void extractsRssItemWithFormattedDate() {
        String rss = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0"><channel><title>Blog</title>
              <item><title>Hello</title><link>https://x/1</link><pubDate>2024-01-01</pubDate></item>
            </channel></rss>
            """;

        List<Post> posts = parser.parse(bytes(rss), 2);

        assertThat(posts).containsExactly(new Post("Hello", "https://x/1", "2024-01-01 00:00:00"));
    }

    @Test
    void rssPubDateInRfc1123IsNormalized() {
        String rss = """
            <rss><channel>
              <item><title> Spaced title </title><link> https://x/2 </link><pubDate>Tue, 02 Jan 2024 10:00:00 +0800</pubDate></item>
            </channel></rss>
            """;

        List<Post> posts = parser.parse(bytes(rss), 2);

        assertThat(posts).containsExactly(new Post("Spaced title", "https://x/2", "2024-01-02 02:00:00"));
    }

    @Test
    void atomPrefersAlternateLinkAndFallsBackToFirstLink() {
        String atom = """
            <feed xmlns="http://www.w3.org/2005/Atom">
              <title>Blog</title>
              <link href="https://blog.example/"/>
              <entry>
                <title>Post A</title>
                <link rel="self" href="https://blog.example/a.atom"/>
                <link rel="alternate" href="https://blog.example/a"/>
                <published>2024-03-05T10:15:30+08:00</published>
              </entry>
              <entry>
                <title>Post B</title>
                <link href="https://blog.example/b"/>
                <updated>2024-03-04T00:00:00Z</updated>
              </entry>
            </feed>
            """;

        List<Post> posts = parser.parse(bytes(atom), 5);

        assertThat(posts).containsExactly(
            new Post("Post A", "https://blog.example/a", "2024-03-05 02:15:30"),
            new Post("Post B", "https://blog.example/b", "2024-03-04 00:00:00")
        );
    }

    @Test
    void capLimitsInspectedItemsNotKeptPosts() {
        String rss = """
            <rss><channel>
              <item><link>https://x/untitled</link></item>
              <item><title>Second</title><link>https://x/2</link></item>
              <item><title>Third</title><link>https://x/3</link></item>
            </channel></rss>
            """;

        List<Post> posts = parser.parse(bytes(rss), 2);

        assertThat(posts).extracting(Post::title).containsExactly("Second");
    }

    @Test
    void itemsWithoutLinkAreDroppedSilently() {
        String rss = """
            <rss><channel>
              <item><title>No link</title></item>
              <item><title>Linked</title><link>https://x/1</link></item>
            </channel></rss>
            """;

        assertThat(parser.parse(bytes(rss), 10)).extracting(Post::link).containsExactly("https://x/1");
    }

    @Test
    void missingOrUnparsableDateBecomesEmptyString() {
        String rss = """
            <rss><channel>
              <item><title>A</title><link>https://x/a</link><pubDate>sometime last week</pubDate></item>
              <item><title>B</title><link>https://x/b</link></item>
            </channel></rss>
            """;

        assertThat(parser.parse(bytes(rss), 10)).extracting(Post::published).containsExactly("", "");
    }

    @Test
    void unrecognizedDocumentYieldsNoPosts() {
        assertThat(parser.parse(bytes("<html><body><p>not a feed</p></body></html>"), 5)).isEmpty();
        assertThat(parser.parse(bytes("<rss><channel><title>empty</title></channel></rss>"), 5)).isEmpty();
    }

    @Test
    void emptyPayloadIsAParseFailure() {
        assertThatThrownBy(() -> parser.parse(new byte[0], 2)).isInstanceOf(FeedParseException.class);
        assertThatThrownBy(() -> parser.parse(bytes("  \n "), 2)).isInstanceOf(FeedParseException.class);
        assertThatThrownBy(() -> parser.parse(null, 2)).isInstanceOf(FeedParseException.class);
    }

    @Test
    void gzippedPayloadIsInflated() throws IOException {
        String rss = "<rss><channel><item><title>Zipped</title><link>https://x/z</link></item></channel></rss>";
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(bytes(rss));
        }

        assertThat(parser.parse(out.toByteArray(), 2)).extracting(Post::title).containsExactly("Zipped");
    }

    @Test
    void truncatedGzipPayloadIsAParseFailure() {
        byte[] broken = new byte[] {0x1f, (byte) 0x8b, 0x08, 0x00, 0x01};
        assertThatThrownBy(() -> parser.parse(broken, 2)).isInstanceOf(FeedParseException.class);
    }

    @Test
    void detectsFormatOnceFromDocumentShape() {
        assertThat(FeedFormat.detect(Jsoup.parse("<feed><entry/></feed>", "", Parser.xmlParser())))
            .isEqualTo(FeedFormat.ATOM);
        assertThat(FeedFormat.detect(Jsoup.parse("<rss><channel><item/></channel></rss>", "", Parser.xmlParser())))
            .isEqualTo(FeedFormat.RSS);
        assertThat(FeedFormat.detect(Jsoup.parse("<rdf><item/></rdf>", "", Parser.xmlParser())))
            .isEqualTo(FeedFormat.UNRECOGNIZED);
    }

    private byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
