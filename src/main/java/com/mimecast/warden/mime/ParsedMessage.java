package com.mimecast.warden.mime;

import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Header and body view over a raw RFC 822 message.
 */
public class ParsedMessage {
    private static final Logger log = LogManager.getLogger(ParsedMessage.class);

    private static final Session SESSION = Session.getInstance(new Properties());

    private final byte[] raw;
    private final MimeMessage message;

    private ParsedMessage(byte[] raw, MimeMessage message) {
        this.raw = raw;
        this.message = message;
    }

    /**
     * Parses raw message bytes.
     *
     * @param raw RFC 822 bytes.
     * @return ParsedMessage instance.
     * @throws MessagingException Unparsable message.
     */
    public static ParsedMessage parse(byte[] raw) throws MessagingException {
        return new ParsedMessage(raw, new MimeMessage(SESSION, new ByteArrayInputStream(raw)));
    }

    public byte[] getRaw() {
        return raw;
    }

    /**
     * Gets the first value of a header, unfolded, or null.
     *
     * @param name Header name.
     * @return Header value.
     */
    public String getHeader(String name) {
        try {
            String value = message.getHeader(name, null);
            return value != null ? MimeUtility.unfold(value).trim() : null;
        } catch (MessagingException e) {
            log.warn("Unable to read header {}: {}", name, e.getMessage());
            return null;
        }
    }

    public String getMessageId() {
        return getHeader("Message-ID");
    }

    /**
     * Gets the decoded subject.
     *
     * @return Subject or null.
     */
    public String getSubject() {
        String subject = getHeader("Subject");
        if (subject == null) {
            return null;
        }
        try {
            return MimeUtility.decodeText(subject);
        } catch (UnsupportedEncodingException e) {
            return subject;
        }
    }

    public String getFrom() {
        return getHeader("From");
    }

    public String getReplyTo() {
        return getHeader("Reply-To");
    }

    public String getSender() {
        return getHeader("Sender");
    }

    public String getTo() {
        return getHeader("To");
    }

    public String getContentLanguage() {
        return getHeader("Content-Language");
    }

    /**
     * Collects decoded text/plain and text/html parts, depth first.
     *
     * @return List of text parts.
     */
    public List<TextPart> getTextParts() {
        List<TextPart> parts = new ArrayList<>();
        try {
            collect(message, parts);
        } catch (MessagingException | IOException e) {
            log.warn("Unable to walk message parts: {}", e.getMessage());
        }
        return parts;
    }

    private static void collect(Part part, List<TextPart> parts) throws MessagingException, IOException {
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart child = multipart.getBodyPart(i);
                collect(child, parts);
            }
        } else if (part.isMimeType("text/plain") || part.isMimeType("text/html")) {
            String text = decode(part);
            if (text != null && !text.isEmpty()) {
                parts.add(new TextPart(new ContentType(part.getContentType()).getBaseType().toLowerCase(), text));
            }
        }
    }

    /**
     * Decodes a text part, falling back to UTF-8 when the declared charset is unknown.
     */
    private static String decode(Part part) throws MessagingException, IOException {
        try {
            Object content = part.getContent();
            if (content instanceof String) {
                return (String) content;
            }
        } catch (UnsupportedEncodingException e) {
            log.debug("Unknown charset, decoding as UTF-8: {}", e.getMessage());
        }
        try (InputStream in = part.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
