package com.mimecast.warden.handlers;

import com.mimecast.warden.config.RejectConfig;
import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.mailbox.MailboxResponse;
import com.mimecast.warden.mailbox.MailboxSession;
import com.mimecast.warden.mime.MessageBuilder;
import com.mimecast.warden.mime.ParsedMessage;
import com.mimecast.warden.rules.HandlerStep;
import com.mimecast.warden.smtp.Credentials;
import com.mimecast.warden.smtp.MailSender;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.util.List;

/**
 * Removes unwanted mail and sends its sender a polite rejection.
 * <p>
 * The whole batch is deleted and expunged as soon as the fetch is answered, even when it fails,
 * <br>and before any dedup check, so removal never depends on reply construction or delivery.
 */
public class RejectAndDeleteHandler extends AbstractContentHandler {
    private static final Logger log = LogManager.getLogger(RejectAndDeleteHandler.class);

    private final RejectConfig config;
    private final String defaultLanguage;

    /**
     * Constructs a new RejectAndDeleteHandler instance.
     *
     * @param config          Sender address and templates.
     * @param defaultLanguage Fallback template language.
     * @param mailSender      Outgoing delivery.
     */
    public RejectAndDeleteHandler(RejectConfig config, String defaultLanguage, MailSender mailSender) {
        super(mailSender);
        this.config = config;
        this.defaultLanguage = defaultLanguage;
    }

    @Override
    public ContentHandlerKind getKind() {
        return ContentHandlerKind.REJECT_AND_DELETE;
    }

    @Override
    protected void afterFetch(MailboxSession session, List<Long> uids) throws TransportException {
        MailboxResponse<Void> deleted = session.storeFlags(uids, HandlerStep.DELETED);
        MailboxResponse<Void> expunged = session.expunge();
        log.info("Deleted {} message(s): {} {}", uids.size(), deleted.getStatus(), expunged.getStatus());
    }

    @Override
    protected void process(MailboxSession session, ParsedMessage message, Credentials credentials) {
        String sender = SenderResolver.resolveReplyAddress(message);
        if (sender == null) {
            log.warn("No sender to reject for {}", message.getMessageId());
            return;
        }

        String language = LanguageResolver.resolve(message.getContentLanguage(), config.getReply().keySet(), defaultLanguage);
        log.info("Reject ({}): {}", language, sender);

        MimeMessage reply;
        try {
            reply = new MessageBuilder()
                    .subject(message.getSubject(), "Re:")
                    .from(config.getReplyFrom())
                    .to(sender)
                    .inReplyTo(message.getMessageId())
                    .messageIdDomain("noteventrashcan")
                    .contentLanguage(language)
                    .body(LanguageResolver.template(config.getReply(), language, defaultLanguage))
                    .build();
        } catch (MessagingException e) {
            log.warn("Unable to build rejection to {}: {}", sender, e.getMessage());
            return;
        }
        send(credentials, config.getReplyFrom(), sender, reply);
    }
}
