package com.mimecast.warden.handlers;

import com.mimecast.warden.mime.ParsedMessage;
import com.mimecast.warden.mime.TestMessages;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SenderResolverTest {

    private static ParsedMessage message(String from, String replyTo, String sender) throws Exception {
        return ParsedMessage.parse(TestMessages.builder()
                .header("From", from)
                .header("Reply-To", replyTo)
                .header("Sender", sender)
                .body("x")
                .bytes());
    }

    @Test
    void testReplyAddressPriority() throws Exception {
        assertEquals("r@x.example", SenderResolver.resolveReplyAddress(message("f@x.example", "r@x.example", "s@x.example")));
        assertEquals("f@x.example", SenderResolver.resolveReplyAddress(message("f@x.example", null, "s@x.example")));
        assertEquals("s@x.example", SenderResolver.resolveReplyAddress(message(null, null, "s@x.example")));
        assertNull(SenderResolver.resolveReplyAddress(message(null, null, null)));
    }

    @Test
    void testOriginatorIgnoresReplyTo() throws Exception {
        assertEquals("f@x.example", SenderResolver.resolveOriginator(message("f@x.example", "r@x.example", null)));
        assertEquals("s@x.example", SenderResolver.resolveOriginator(message(null, "r@x.example", "s@x.example")));
    }

    @Test
    void testExtractEmailAddress() {
        assertEquals("boss@workplace.edu", SenderResolver.extractEmailAddress("The Boss <boss@workplace.edu>"));
        assertEquals("plain@x.example", SenderResolver.extractEmailAddress(" plain@x.example "));
        assertNull(SenderResolver.extractEmailAddress(""));
    }
}
