package com.mimecast.warden.handlers;

import com.mimecast.warden.mime.ParsedMessage;
import com.mimecast.warden.mime.TestMessages;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class UrlExtractorTest {

    @Test
    void testTrailingPunctuationStripped() {
        Set<String> urls = UrlExtractor.extract("Look at https://example.com/a. And http://example.org/b?x=1, too!");

        assertEquals(List.of("https://example.com/a", "http://example.org/b?x=1"), List.copyOf(urls));
    }

    @Test
    void testDuplicatesKeepFirstSeenOrder() {
        Set<String> urls = UrlExtractor.extract("https://b.example https://a.example https://b.example");

        assertEquals(List.of("https://b.example", "https://a.example"), List.copyOf(urls));
    }

    @Test
    void testNoUrls() {
        assertTrue(UrlExtractor.extract("nothing here").isEmpty());
        assertTrue(UrlExtractor.extract((String) null).isEmpty());
    }

    @Test
    void testHtmlPartAndSubject() throws Exception {
        byte[] raw = TestMessages.builder()
                .messageId("<u1>")
                .header("From", "me@home.example")
                .header("Subject", "https://subject.example/s")
                .html("<p>Read <a href=\"https://html.example/page\">this</a></p>")
                .bytes();

        Set<String> urls = UrlExtractor.extract(ParsedMessage.parse(raw));

        assertEquals(List.of("https://html.example/page", "https://subject.example/s"), List.copyOf(urls));
    }
}
