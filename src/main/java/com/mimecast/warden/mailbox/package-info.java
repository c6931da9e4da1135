/**
 * Mailbox session primitives and their Jakarta Mail IMAP implementation.
 *
 * <p>The rule engine only sees {@link com.mimecast.warden.mailbox.MailboxSession}.
 * <br>{@link com.mimecast.warden.mailbox.ImapSessionFactory} connects, logs in and selects the inbox.
 */
package com.mimecast.warden.mailbox;
