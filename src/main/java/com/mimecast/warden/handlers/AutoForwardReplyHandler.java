package com.mimecast.warden.handlers;

import com.mimecast.warden.config.AutoReplyConfig;
import com.mimecast.warden.mailbox.MailboxSession;
import com.mimecast.warden.mime.MessageBuilder;
import com.mimecast.warden.mime.ParsedMessage;
import com.mimecast.warden.smtp.Credentials;
import com.mimecast.warden.smtp.MailSender;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;

/**
 * Forwards a message internally and tells its sender where it went.
 * <p>
 * The forward goes first, carrying the original as a message/rfc822 attachment.
 * <br>The reply to the sender follows whether or not the forward was delivered.
 */
public class AutoForwardReplyHandler extends AbstractContentHandler {
    private static final Logger log = LogManager.getLogger(AutoForwardReplyHandler.class);

    private final AutoReplyConfig config;
    private final String defaultLanguage;

    /**
     * Constructs a new AutoForwardReplyHandler instance.
     *
     * @param config          Addresses and templates.
     * @param defaultLanguage Fallback template language.
     * @param mailSender      Outgoing delivery.
     */
    public AutoForwardReplyHandler(AutoReplyConfig config, String defaultLanguage, MailSender mailSender) {
        super(mailSender);
        this.config = config;
        this.defaultLanguage = defaultLanguage;
    }

    @Override
    public ContentHandlerKind getKind() {
        return ContentHandlerKind.AUTO_FORWARD_REPLY;
    }

    @Override
    protected void process(MailboxSession session, ParsedMessage message, Credentials credentials) {
        String sender = SenderResolver.resolveReplyAddress(message);
        String language = LanguageResolver.resolve(message.getContentLanguage(), config.getReply().keySet(), defaultLanguage);
        log.info("Auto forward and reply ({}): {}", language, sender);

        MimeMessage forward = null;
        try {
            forward = new MessageBuilder()
                    .subject(message.getSubject(), "Fwd:")
                    .from(config.getForwardBy())
                    .to(config.getForwardTo())
                    .replyTo(sender)
                    .inReplyTo(message.getMessageId())
                    .body(LanguageResolver.template(config.getForwardNote(), language, defaultLanguage)
                            .replace("{sender}", StringUtils.defaultString(sender)))
                    .attachment(message.getRaw(), "message/rfc822", null)
                    .build();
        } catch (MessagingException e) {
            log.warn("Unable to build forward for {}: {}", message.getMessageId(), e.getMessage());
        }
        if (forward != null) {
            send(credentials, config.getForwardBy(), config.getForwardTo(), forward);
        }

        if (sender == null) {
            log.warn("No sender to reply to for {}", message.getMessageId());
            return;
        }

        MimeMessage reply = null;
        try {
            reply = new MessageBuilder()
                    .subject(message.getSubject(), "Re:")
                    .from(config.getReplyFrom())
                    .to(sender)
                    .replyTo(config.getForwardTo())
                    .inReplyTo(message.getMessageId())
                    .messageIdDomain("away")
                    .contentLanguage(language)
                    .body(LanguageResolver.template(config.getReply(), language, defaultLanguage))
                    .build();
        } catch (MessagingException e) {
            log.warn("Unable to build reply to {}: {}", sender, e.getMessage());
        }
        if (reply != null) {
            send(credentials, config.getReplyFrom(), sender, reply);
        }
    }
}
