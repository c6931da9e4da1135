package com.mimecast.warden.http;

import com.mimecast.warden.exception.ContentFetchException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fetcher tests against MockWebServer.
 */
class OkHttpFetcherTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private MockWebServer mockWebServer;
    private OkHttpFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        fetcher = new OkHttpFetcher("WardenTest/1.0");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void testFetchSendsHeaders() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "text/html; charset=ISO-8859-1")
                .setBody("<html>ok</html>"));

        FetchedContent content = fetcher.fetch(mockWebServer.url("/page").toString(), TIMEOUT, 1024);

        RecordedRequest request = mockWebServer.takeRequest();
        assertEquals("no-transform", request.getHeader("Cache-Control"));
        assertEquals("WardenTest/1.0", request.getHeader("User-Agent"));

        assertEquals("<html>ok</html>", new String(content.getBody(), StandardCharsets.UTF_8));
        assertEquals("text/html", content.getMimeType());
        assertEquals("ISO-8859-1", content.getCharset());
        assertEquals("text/html; charset=ISO-8859-1", content.getHeader("content-type"));
    }

    @Test
    void testRedirectReportsFinalUrl() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(302)
                .setHeader("Location", "/final"));
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "text/plain")
                .setBody("done"));

        FetchedContent content = fetcher.fetch(mockWebServer.url("/start").toString(), TIMEOUT, 1024);

        assertEquals(mockWebServer.url("/final").toString(), content.getFinalUrl());
        assertEquals(2, mockWebServer.getRequestCount());
    }

    @Test
    void testErrorStatus() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(404));

        ContentFetchException e = assertThrows(ContentFetchException.class,
                () -> fetcher.fetch(mockWebServer.url("/missing").toString(), TIMEOUT, 1024));

        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    void testSizeLimit() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("0123456789"));

        assertThrows(ContentFetchException.class,
                () -> fetcher.fetch(mockWebServer.url("/big").toString(), TIMEOUT, 5));
    }

    @Test
    void testSizeLimitWithoutContentLength() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setChunkedBody("0123456789", 3));

        assertThrows(ContentFetchException.class,
                () -> fetcher.fetch(mockWebServer.url("/chunked").toString(), TIMEOUT, 5));
    }

    @Test
    void testInvalidUrl() {
        assertThrows(ContentFetchException.class, () -> fetcher.fetch("not a url", TIMEOUT, 5));
    }

    @Test
    void testMissingContentTypeDefaults() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("x"));

        FetchedContent content = fetcher.fetch(mockWebServer.url("/raw").toString(), TIMEOUT, 1024);

        assertEquals("application/octet-stream", content.getMimeType());
        assertNull(content.getCharset());
    }
}
