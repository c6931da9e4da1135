package com.mimecast.warden.mime;

import jakarta.activation.DataHandler;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import org.apache.commons.lang3.StringUtils;

import java.util.Date;
import java.util.Properties;
import java.util.UUID;

/**
 * Fluent builder for outgoing messages.
 *
 * <p>Handles:
 * <ul>
 *     <li>Subject prefixes such as {@code Re:} and {@code Fwd:}</li>
 *     <li>Threading headers: In-Reply-To and References</li>
 *     <li>Message-ID, either supplied or generated with a UUID and chosen domain</li>
 *     <li>Optional single attachment, which turns the body into multipart/mixed</li>
 * </ul>
 * <p>Example:
 * <pre>
 * MimeMessage reply = new MessageBuilder()
 *         .subject("Hello", "Re:")
 *         .from("Answermachine &lt;away@example.com&gt;")
 *         .to("someone@example.org")
 *         .inReplyTo("&lt;abc@example.org&gt;")
 *         .messageIdDomain("away")
 *         .body("I am away.")
 *         .build();
 * </pre>
 */
public class MessageBuilder {

    private static final Session SESSION = Session.getInstance(new Properties());

    private String subject = "";
    private String from;
    private String to;
    private String replyTo;
    private String inReplyTo;
    private String messageId;
    private String messageIdDomain;
    private String contentLanguage;
    private String body = "";
    private byte[] attachment;
    private String attachmentType;
    private String attachmentName;

    public MessageBuilder subject(String subject) {
        return subject(subject, null);
    }

    /**
     * Sets the subject with an optional prefix.
     *
     * @param subject Subject, null treated as empty.
     * @param prefix  Prefix, may be null.
     * @return Self.
     */
    public MessageBuilder subject(String subject, String prefix) {
        String base = StringUtils.defaultString(subject);
        this.subject = StringUtils.isNotEmpty(prefix) ? prefix + " " + base : base;
        return this;
    }

    public MessageBuilder from(String from) {
        this.from = from;
        return this;
    }

    public MessageBuilder to(String to) {
        this.to = to;
        return this;
    }

    public MessageBuilder replyTo(String replyTo) {
        this.replyTo = replyTo;
        return this;
    }

    /**
     * Sets In-Reply-To and References.
     *
     * @param messageId Message-ID replied to or forwarded.
     * @return Self.
     */
    public MessageBuilder inReplyTo(String messageId) {
        this.inReplyTo = messageId;
        return this;
    }

    /**
     * Sets an explicit Message-ID, overriding any domain.
     *
     * @param messageId Message-ID including angle brackets.
     * @return Self.
     */
    public MessageBuilder messageId(String messageId) {
        this.messageId = messageId;
        return this;
    }

    public MessageBuilder messageIdDomain(String domain) {
        this.messageIdDomain = domain;
        return this;
    }

    public MessageBuilder contentLanguage(String contentLanguage) {
        this.contentLanguage = contentLanguage;
        return this;
    }

    public MessageBuilder body(String body) {
        this.body = StringUtils.defaultString(body);
        return this;
    }

    /**
     * Adds an attachment.
     *
     * @param bytes       Content.
     * @param contentType MIME type, for example {@code message/rfc822}.
     * @param filename    File name, may be null.
     * @return Self.
     */
    public MessageBuilder attachment(byte[] bytes, String contentType, String filename) {
        this.attachment = bytes;
        this.attachmentType = contentType;
        this.attachmentName = filename;
        return this;
    }

    /**
     * Builds the message and fixes its headers.
     *
     * @return MimeMessage ready to send or append.
     * @throws MessagingException Invalid address or content.
     */
    public MimeMessage build() throws MessagingException {
        MimeMessage message = new FixedIdMessage(StringUtils.isNotBlank(messageId) ? messageId : generateMessageId());

        message.setSubject(subject, "UTF-8");
        if (from != null) {
            message.setFrom(new InternetAddress(from));
        }
        if (to != null) {
            message.setRecipients(MimeMessage.RecipientType.TO, InternetAddress.parse(to));
        }
        if (StringUtils.isNotBlank(replyTo)) {
            message.setReplyTo(InternetAddress.parse(replyTo));
        }
        message.setSentDate(new Date());

        if (StringUtils.isNotBlank(inReplyTo)) {
            message.setHeader("In-Reply-To", inReplyTo);
            message.setHeader("References", inReplyTo);
        }

        if (attachment != null) {
            MimeBodyPart text = new MimeBodyPart();
            text.setText(body, "UTF-8");

            MimeBodyPart file = new MimeBodyPart();
            file.setDataHandler(new DataHandler(new ByteArrayDataSource(attachment, attachmentType)));
            file.setHeader("Content-Type", attachmentType);
            if (StringUtils.isNotBlank(attachmentName)) {
                file.setFileName(attachmentName);
            }

            MimeMultipart mixed = new MimeMultipart("mixed");
            mixed.addBodyPart(text);
            mixed.addBodyPart(file);
            message.setContent(mixed);
        } else {
            message.setText(body, "UTF-8");
        }

        if (StringUtils.isNotBlank(contentLanguage)) {
            message.setHeader("Content-Language", contentLanguage);
        }

        message.saveChanges();
        return message;
    }

    private String generateMessageId() {
        String domain = messageIdDomain;
        if (StringUtils.isBlank(domain) && from != null && from.contains("@")) {
            domain = StringUtils.substringBefore(StringUtils.substringAfterLast(from, "@"), ">").trim();
        }
        return "<" + UUID.randomUUID() + "@" + StringUtils.defaultIfBlank(domain, "localhost") + ">";
    }

    /**
     * MimeMessage keeping a Message-ID chosen at build time instead of regenerating it on save.
     */
    private static class FixedIdMessage extends MimeMessage {
        private final String id;

        FixedIdMessage(String id) {
            super(SESSION);
            this.id = id;
        }

        @Override
        protected void updateMessageID() throws MessagingException {
            setHeader("Message-ID", id);
        }
    }
}
