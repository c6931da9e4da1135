package com.mimecast.warden.handlers;

import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.mailbox.MailboxSession;
import com.mimecast.warden.rules.StepResult;
import com.mimecast.warden.smtp.Credentials;

import java.util.List;
import java.util.Set;

/**
 * Pipeline step that reads matched messages and produces outgoing side effects.
 * <p>Implementations should:
 * <ul>
 *   <li>Fetch the matched messages</li>
 *   <li>Skip any message whose canonical identifier is already in the seen set</li>
 *   <li>Add every processed identifier to the seen set, whatever the delivery outcome</li>
 *   <li>Recover from delivery failures per message</li>
 * </ul>
 */
public interface ContentHandler {

    /**
     * Processes the matched messages.
     *
     * @param session     Mailbox session.
     * @param uids        Matched UIDs.
     * @param seen        Identifiers already handled, updated in place.
     * @param credentials Delivery credentials.
     * @return Step result carrying the seen set.
     * @throws TransportException Connection failure.
     */
    StepResult handle(MailboxSession session, List<Long> uids, Set<String> seen, Credentials credentials) throws TransportException;

    /**
     * Gets the kind of this handler.
     *
     * @return Kind.
     */
    ContentHandlerKind getKind();
}
