package com.mimecast.warden.transform;

import com.mimecast.warden.http.FetchedContent;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ImageInlinerTest {

    private final List<Long> limits = new ArrayList<>();

    private final ImageInliner inliner = new ImageInliner((url, timeout, maxSize) -> {
        limits.add(maxSize);
        return new FetchedContent(new byte[]{1, 2, 3}, url, Map.of("Content-Type", "image/jpeg; charset=binary"));
    }, Duration.ofSeconds(5), 2, 4096);

    @Test
    void testCountLimit() {
        Document document = Jsoup.parse("<p><img src=\"a.jpg\"><img src=\"b.jpg\"><img src=\"c.jpg\"></p>", "https://a.example/");

        assertEquals(2, inliner.inline(document));

        assertEquals(2, document.select("img").size());
        assertEquals("data:image/jpeg;base64,AQID", document.select("img").first().attr("src"));
        assertEquals("100%", document.select("img").first().attr("width"));
        assertEquals("auto", document.select("img").first().attr("height"));
        assertEquals(List.of(4096L, 4096L), limits);
    }

    @Test
    void testSmallAndMissingSourcesDropped() {
        Document document = Jsoup.parse("<img src=\"s.gif\" width=\"20px\" height=\"20px\"><img alt=\"none\">"
                + "<img src=\"wide.jpg\" width=\"100%\" height=\"400\">", "https://a.example/");

        assertEquals(1, inliner.inline(document));

        assertEquals(1, document.select("img").size());
        assertTrue(document.select("img").first().attr("src").startsWith("data:image/jpeg;base64,"));
    }

    @Test
    void testDimension() {
        assertEquals(0, ImageInliner.dimension(""));
        assertEquals(100, ImageInliner.dimension("50%"));
        assertEquals(100, ImageInliner.dimension("auto"));
        assertEquals(320, ImageInliner.dimension("320px"));
        assertEquals(12, ImageInliner.dimension("12.5"));
        assertEquals(100, ImageInliner.dimension("large"));
    }
}
