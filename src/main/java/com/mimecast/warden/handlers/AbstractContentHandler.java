package com.mimecast.warden.handlers;

import com.mimecast.warden.dedup.CanonicalId;
import com.mimecast.warden.exception.DeliveryException;
import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.mailbox.FetchedMessage;
import com.mimecast.warden.mailbox.MailboxResponse;
import com.mimecast.warden.mailbox.MailboxSession;
import com.mimecast.warden.mime.ParsedMessage;
import com.mimecast.warden.rules.StepResult;
import com.mimecast.warden.rules.StepStatus;
import com.mimecast.warden.smtp.Credentials;
import com.mimecast.warden.smtp.MailSender;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.util.List;
import java.util.Set;

/**
 * Common shape of content handlers.
 * <p>
 * Fetches the matched messages, then for each one in fetch order parses it, checks and marks its
 * <br>canonical identifier and hands it to {@link #process}. The step status is the fetch status.
 */
public abstract class AbstractContentHandler implements ContentHandler {
    private static final Logger log = LogManager.getLogger(AbstractContentHandler.class);

    protected final MailSender mailSender;

    protected AbstractContentHandler(MailSender mailSender) {
        this.mailSender = mailSender;
    }

    @Override
    public StepResult handle(MailboxSession session, List<Long> uids, Set<String> seen, Credentials credentials) throws TransportException {
        MailboxResponse<List<FetchedMessage>> fetched = session.fetch(uids);
        afterFetch(session, uids);
        if (!fetched.isOk()) {
            return StepResult.of(fetched, seen);
        }

        for (FetchedMessage item : fetched.getData()) {
            ParsedMessage message;
            try {
                message = ParsedMessage.parse(item.getRaw());
            } catch (MessagingException e) {
                log.warn("Skipping unparsable message UID {}: {}", item.getUid(), e.getMessage());
                continue;
            }

            String id = CanonicalId.of(message.getMessageId(), item.getRaw());
            if (seen.contains(id)) {
                log.debug("{} already handled {}", getKind(), id);
                continue;
            }
            seen.add(id);

            process(session, message, credentials);
        }

        return new StepResult(StepStatus.OK, fetched.getData(), seen);
    }

    /**
     * Runs once the fetch is answered, whatever its status, and before any message is processed.
     *
     * @param session Mailbox session.
     * @param uids    Matched UIDs.
     * @throws TransportException Connection failure.
     */
    protected void afterFetch(MailboxSession session, List<Long> uids) throws TransportException {
        // Nothing by default.
    }

    /**
     * Processes one message not seen before.
     *
     * @param session     Mailbox session.
     * @param message     Parsed message.
     * @param credentials Delivery credentials.
     * @throws TransportException Connection failure.
     */
    protected abstract void process(MailboxSession session, ParsedMessage message, Credentials credentials) throws TransportException;

    /**
     * Sends a message, logging instead of propagating delivery failures.
     *
     * @param credentials Delivery credentials.
     * @param from        Envelope sender.
     * @param to          Envelope recipient.
     * @param message     Message.
     * @return True if sent.
     */
    protected boolean send(Credentials credentials, String from, String to, MimeMessage message) {
        try {
            mailSender.send(credentials, from, to, message);
            return true;
        } catch (DeliveryException e) {
            log.warn("{} send to {} failed: {}", getKind(), to, e.getMessage());
            return false;
        }
    }
}
