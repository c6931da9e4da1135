package com.mimecast.warden.mailbox;

import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.exception.UnsupportedCapabilityException;

import java.time.Duration;
import java.util.Date;
import java.util.List;

/**
 * Authenticated session on one selected mailbox.
 *
 * <p>These are the primitives the rule engine drives. A non-OK {@link MailboxResponse} is a protocol
 * <br>error and only affects the calling pipeline; a {@link TransportException} means the session is gone.
 * <p>Sessions are not thread-safe and are owned by a single event loop.
 */
public interface MailboxSession extends AutoCloseable {

    /**
     * UID SEARCH with a raw IMAP query.
     *
     * @param query Compiled search query.
     * @return Matching UIDs in server order.
     * @throws TransportException Connection failure.
     */
    MailboxResponse<List<Long>> search(String query) throws TransportException;

    /**
     * UID FETCH of the full RFC 822 content.
     *
     * @param uids UIDs to fetch.
     * @return Fetched messages in server order.
     * @throws TransportException Connection failure.
     */
    MailboxResponse<List<FetchedMessage>> fetch(List<Long> uids) throws TransportException;

    /**
     * UID STORE +FLAGS.
     *
     * @param uids  UIDs.
     * @param flags Flag expression, for example {@code (\Seen)}.
     * @return Response.
     * @throws TransportException Connection failure.
     */
    MailboxResponse<Void> storeFlags(List<Long> uids, String flags) throws TransportException;

    /**
     * UID COPY to another folder.
     *
     * @param uids   UIDs.
     * @param folder Destination folder.
     * @return Response.
     * @throws TransportException Connection failure.
     */
    MailboxResponse<Void> copy(List<Long> uids, String folder) throws TransportException;

    /**
     * EXPUNGE the selected mailbox.
     *
     * @return Response.
     * @throws TransportException Connection failure.
     */
    MailboxResponse<Void> expunge() throws TransportException;

    /**
     * APPEND a raw message to a folder.
     *
     * @param folder Destination folder.
     * @param flags  Flag expression, may be empty.
     * @param time   Internal date.
     * @param raw    RFC 822 bytes.
     * @return Response.
     * @throws TransportException Connection failure.
     */
    MailboxResponse<Void> append(String folder, String flags, Date time, byte[] raw) throws TransportException;

    /**
     * Blocks until the mailbox changes or the timeout elapses.
     *
     * @param timeout Maximum wait.
     * @return OK with a notification description or null data when the wait timed out quietly,
     * non-OK when the session should end.
     * @throws TransportException Connection failure.
     */
    MailboxResponse<String> waitForChange(Duration timeout) throws TransportException;

    /**
     * Fails fast when change notification is unsupported by the store.
     *
     * @throws UnsupportedCapabilityException IDLE missing.
     * @throws TransportException             Connection failure.
     */
    void requireChangeNotification() throws UnsupportedCapabilityException, TransportException;

    /**
     * Closes the session, logging rather than throwing on failure.
     */
    @Override
    void close();
}
