package com.mimecast.warden.mime;

import jakarta.mail.Multipart;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MessageBuilderTest {

    @Test
    void testReplyHeaders() throws Exception {
        MimeMessage message = new MessageBuilder()
                .subject("Meeting", "Re:")
                .from("Away <away@example.com>")
                .to("boss@workplace.edu")
                .replyTo("me@workplace.edu")
                .inReplyTo("<m1>")
                .messageIdDomain("away")
                .contentLanguage("de")
                .body("Ich bin weg.")
                .build();

        assertEquals("Re: Meeting", message.getSubject());
        assertEquals("<m1>", message.getHeader("In-Reply-To", null));
        assertEquals("<m1>", message.getHeader("References", null));
        assertEquals("de", message.getHeader("Content-Language", null));
        assertEquals("me@workplace.edu", message.getReplyTo()[0].toString());
        assertTrue(message.getMessageID().matches("<[0-9a-f-]{36}@away>"));
        assertEquals("Ich bin weg.", message.getContent());
    }

    @Test
    void testMessageIdDomainFromSender() throws Exception {
        MimeMessage message = new MessageBuilder().from("Warden <warden@home.example>").build();

        assertTrue(message.getMessageID().endsWith("@home.example>"));
    }

    @Test
    void testExplicitMessageIdSurvivesWrite() throws Exception {
        MimeMessage message = new MessageBuilder().messageId("<fixed@example.com>").body("x").build();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        message.writeTo(out);

        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Message-ID: <fixed@example.com>"));
    }

    @Test
    void testAttachment() throws Exception {
        byte[] original = TestMessages.plain("<m1>", "boss@workplace.edu", "Budget", "Numbers");
        MimeMessage message = new MessageBuilder()
                .subject("Budget", "Fwd:")
                .body("Forwarded.")
                .attachment(original, "message/rfc822", null)
                .build();

        Multipart multipart = (Multipart) message.getContent();
        assertEquals(2, multipart.getCount());
        assertTrue(multipart.getBodyPart(1).isMimeType("message/rfc822"));
        assertTrue(message.isMimeType("multipart/mixed"));
    }
}
