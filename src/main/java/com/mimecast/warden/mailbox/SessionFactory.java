package com.mimecast.warden.mailbox;

import com.mimecast.warden.exception.TransportException;

/**
 * Establishes mailbox sessions for the connection supervisor.
 */
@FunctionalInterface
public interface SessionFactory {

    /**
     * Connects, authenticates and selects the configured mailbox.
     *
     * @return Open session.
     * @throws TransportException Unable to establish the session.
     */
    MailboxSession open() throws TransportException;
}
