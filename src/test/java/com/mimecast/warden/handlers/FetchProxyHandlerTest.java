package com.mimecast.warden.handlers;

import com.mimecast.warden.config.ProxyConfig;
import com.mimecast.warden.exception.ContentFetchException;
import com.mimecast.warden.http.FetchedContent;
import com.mimecast.warden.http.HttpFetcher;
import com.mimecast.warden.mailbox.FakeMailboxSession;
import com.mimecast.warden.mime.ParsedMessage;
import com.mimecast.warden.mime.TestMessages;
import com.mimecast.warden.smtp.RecordingMailSender;
import com.mimecast.warden.transform.HtmlContentTransformer;
import com.mimecast.warden.transform.ImageInliner;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class FetchProxyHandlerTest {

    private static final String PAGE = "<html><head><title>Story</title></head>"
            + "<body><p>Hello <a href=\"https://news.example/more\">more</a></p><script>x()</script></body></html>";

    @Mock
    private HttpFetcher httpFetcher;

    private AutoCloseable closeable;
    private List<String> operations;
    private RecordingMailSender mailSender;
    private FetchProxyHandler handler;

    @BeforeEach
    void setUp() {
        closeable = MockitoAnnotations.openMocks(this);
        operations = new ArrayList<>();
        mailSender = new RecordingMailSender(operations);
        ProxyConfig config = new ProxyConfig(Map.of(
                "sendFrom", "proxy@home.example",
                "storeTo", "INBOX.Later",
                "kindleSendFrom", "kindle-from@home.example",
                "kindleSendTo", "reader@kindle.example"
        ));
        handler = new FetchProxyHandler(config, httpFetcher, new HtmlContentTransformer(Map.of(), new ImageInliner(httpFetcher, Duration.ofSeconds(10), 100, 1024 * 1024)), mailSender);
    }

    @AfterEach
    void tearDown() throws Exception {
        closeable.close();
    }

    private static FetchedContent html(String url) {
        return new FetchedContent(PAGE.getBytes(StandardCharsets.UTF_8), url, Map.of("Content-Type", "text/html; charset=utf-8"));
    }

    private static byte[] request(String to, String body) {
        return TestMessages.builder()
                .messageId("<req1>")
                .header("From", "me@home.example")
                .header("To", to)
                .header("Subject", "Read later")
                .body(body)
                .bytes();
    }

    @Test
    void testAppendsEachUrl() throws Exception {
        when(httpFetcher.fetch(any(), any(), anyLong())).thenAnswer(i -> html(i.getArgument(0)));
        FakeMailboxSession session = new FakeMailboxSession(operations)
                .addMessage(1L, request("proxy@home.example", "See https://a.example/x and https://b.example/y."));

        assertTrue(handler.handle(session, List.of(1L), new HashSet<>(), null).isOk());

        assertEquals(List.of("fetch [1]", "append INBOX.Later", "append INBOX.Later"), operations);
        verify(httpFetcher).fetch(eq("https://a.example/x"), any(), anyLong());
        verify(httpFetcher).fetch(eq("https://b.example/y"), any(), anyLong());
        assertTrue(mailSender.getAttempts().isEmpty());

        ParsedMessage stored = ParsedMessage.parse(session.getAppended().get(0));
        assertEquals("Story", stored.getSubject());
        assertEquals("<req1>", stored.getHeader("In-Reply-To"));
        assertTrue(stored.getMessageId().endsWith("@proxy>"));
    }

    @Test
    void testFailingUrlDoesNotStopOthers() throws Exception {
        when(httpFetcher.fetch(eq("https://a.example/x"), any(), anyLong())).thenThrow(new ContentFetchException("HTTP 404"));
        when(httpFetcher.fetch(eq("https://b.example/y"), any(), anyLong())).thenAnswer(i -> html(i.getArgument(0)));
        FakeMailboxSession session = new FakeMailboxSession(operations)
                .addMessage(1L, request("proxy@home.example", "https://a.example/x\nhttps://b.example/y"));

        assertTrue(handler.handle(session, List.of(1L), new HashSet<>(), null).isOk());

        assertEquals(1, session.count("append"));
    }

    @Test
    void testKindleTextRequestIsSent() throws Exception {
        when(httpFetcher.fetch(any(), any(), anyLong())).thenAnswer(i -> html(i.getArgument(0)));
        FakeMailboxSession session = new FakeMailboxSession(operations)
                .addMessage(1L, request("txt+kindle@home.example", "https://a.example/x"));

        handler.handle(session, List.of(1L), new HashSet<>(), null);

        assertEquals(List.of("fetch [1]", "append INBOX.Later", "send reader@kindle.example"), operations);
        RecordingMailSender.Sent sent = mailSender.getAttempts().get(0);
        assertEquals("kindle-from@home.example", sent.getFrom());
        assertEquals("[TL]: Story", sent.getMessage().getSubject());
    }

    @Test
    void testInlineTextInBody() throws Exception {
        when(httpFetcher.fetch(any(), any(), anyLong())).thenAnswer(i -> html(i.getArgument(0)));
        ProxyOptions options = ProxyOptions.parse("txt+wolinks+inline@home.example", new ProxyConfig(Map.of()), "me@home.example");

        MimeMessage message = handler.buildMessage("https://a.example/x", "Read later", "<req1>", options);

        assertEquals("[TP]: Story", message.getSubject());
        String body = (String) message.getContent();
        assertTrue(body.startsWith("URL: https://a.example/x"));
        assertTrue(body.contains("Hello more"));
        assertFalse(body.contains("x()"));
        assertFalse(body.contains("news.example/more"));
    }

    @Test
    void testBinaryAttachmentGetsPdfExtension() throws Exception {
        when(httpFetcher.fetch(any(), any(), anyLong())).thenReturn(new FetchedContent(
                new byte[]{'%', 'P', 'D', 'F'}, "https://docs.example/paper", Map.of("Content-Type", "application/pdf")));
        ProxyOptions options = ProxyOptions.parse("proxy@home.example", new ProxyConfig(Map.of()), "me@home.example");

        MimeMessage message = handler.buildMessage("https://docs.example/paper", "Paper", "<req1>", options);

        jakarta.mail.Multipart multipart = (jakarta.mail.Multipart) message.getContent();
        assertEquals("Paper: docs example paper.pdf", multipart.getBodyPart(1).getFileName());
    }

    @Test
    void testFilenameFromDisposition() {
        FetchedContent content = new FetchedContent(new byte[0], "https://a.example/f",
                Map.of("content-disposition", "attachment; filename=\"report.csv\""));

        assertEquals("report.csv", FetchProxyHandler.filename(content));
    }

    @Test
    void testFixExtension() {
        assertEquals("a example.txt", FetchProxyHandler.fixExtension("a example", "plain"));
        assertEquals("page.html", FetchProxyHandler.fixExtension("page.html", "html"));
        assertEquals("data", FetchProxyHandler.fixExtension("data", "csv"));
    }
}
