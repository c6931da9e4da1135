package com.mimecast.warden.mailbox;

import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.exception.UnsupportedCapabilityException;
import com.sun.mail.iap.Response;
import com.sun.mail.imap.IMAPFolder;
import com.sun.mail.imap.IMAPStore;
import com.sun.mail.imap.protocol.IMAPResponse;
import jakarta.mail.FolderClosedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.StoreClosedException;
import jakarta.mail.internet.MimeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Jakarta Mail backed mailbox session on one selected folder.
 *
 * <p>Searches are sent as raw {@code UID SEARCH} commands so compiled filter strings reach the server untouched.
 * <br>The change-notification wait uses IMAP IDLE. Jakarta Mail has no IDLE timeout, so a timer touches the
 * <br>folder when the bound elapses, which makes the library send DONE and return.
 *
 * @see ImapSessionFactory
 */
public class ImapMailboxSession implements MailboxSession {
    private static final Logger log = LogManager.getLogger(ImapMailboxSession.class);

    private final Session session;
    private final IMAPStore store;
    private final IMAPFolder folder;
    private final ScheduledExecutorService idleTimer;

    /**
     * Constructs a new ImapMailboxSession instance over an open folder.
     *
     * @param session Jakarta Mail session.
     * @param store   Connected store.
     * @param folder  Folder opened read-write.
     */
    public ImapMailboxSession(Session session, IMAPStore store, IMAPFolder folder) {
        this.session = session;
        this.store = store;
        this.folder = folder;
        this.idleTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "warden-idle-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public MailboxResponse<List<Long>> search(String query) throws TransportException {
        try {
            Object result = folder.doCommand(protocol -> {
                Response[] responses = protocol.command("UID SEARCH " + query, null);
                Response tagged = responses[responses.length - 1];

                List<Long> uids = new ArrayList<>();
                for (Response response : responses) {
                    if (response instanceof IMAPResponse && ((IMAPResponse) response).keyEquals("SEARCH")) {
                        long uid;
                        while ((uid = response.readLong()) != -1) {
                            uids.add(uid);
                        }
                    }
                }
                protocol.notifyResponseHandlers(responses);

                return new MailboxResponse<>(statusOf(tagged), tagged.getRest(), uids);
            });

            @SuppressWarnings("unchecked")
            MailboxResponse<List<Long>> response = (MailboxResponse<List<Long>>) result;
            log.debug("UID SEARCH {}: {}", query, response);
            return response;
        } catch (MessagingException e) {
            throw transport("UID SEARCH", e);
        }
    }

    @Override
    public MailboxResponse<List<FetchedMessage>> fetch(List<Long> uids) throws TransportException {
        List<FetchedMessage> fetched = new ArrayList<>();
        try {
            for (Message message : messages(uids)) {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                message.writeTo(out);
                fetched.add(new FetchedMessage(folder.getUID(message), out.toByteArray()));
            }
            return MailboxResponse.ok(fetched);
        } catch (FolderClosedException | StoreClosedException e) {
            throw transport("UID FETCH", e);
        } catch (MessagingException | IOException e) {
            log.error("UID FETCH failed: {}", e.getMessage());
            return MailboxResponse.no(e.getMessage());
        }
    }

    @Override
    public MailboxResponse<Void> storeFlags(List<Long> uids, String flags) throws TransportException {
        try {
            folder.setFlags(messages(uids), FlagParser.parse(flags), true);
            return MailboxResponse.ok(null);
        } catch (FolderClosedException | StoreClosedException e) {
            throw transport("UID STORE", e);
        } catch (MessagingException | IllegalArgumentException e) {
            log.error("UID STORE {} failed: {}", flags, e.getMessage());
            return MailboxResponse.no(e.getMessage());
        }
    }

    @Override
    public MailboxResponse<Void> copy(List<Long> uids, String target) throws TransportException {
        try {
            folder.copyMessages(messages(uids), store.getFolder(target));
            return MailboxResponse.ok(null);
        } catch (FolderClosedException | StoreClosedException e) {
            throw transport("UID COPY", e);
        } catch (MessagingException e) {
            log.error("UID COPY to {} failed: {}", target, e.getMessage());
            return MailboxResponse.no(e.getMessage());
        }
    }

    @Override
    public MailboxResponse<Void> expunge() throws TransportException {
        try {
            folder.expunge();
            return MailboxResponse.ok(null);
        } catch (FolderClosedException | StoreClosedException e) {
            throw transport("EXPUNGE", e);
        } catch (MessagingException e) {
            log.error("EXPUNGE failed: {}", e.getMessage());
            return MailboxResponse.no(e.getMessage());
        }
    }

    @Override
    public MailboxResponse<Void> append(String target, String flags, Date time, byte[] raw) throws TransportException {
        try {
            MimeMessage message = new MimeMessage(session, new ByteArrayInputStream(raw)) {
                @Override
                public Date getReceivedDate() {
                    return time;
                }
            };
            message.setFlags(FlagParser.parse(flags), true);
            store.getFolder(target).appendMessages(new Message[]{message});
            return MailboxResponse.ok(null);
        } catch (FolderClosedException | StoreClosedException e) {
            throw transport("APPEND", e);
        } catch (MessagingException | IllegalArgumentException e) {
            log.error("APPEND to {} failed: {}", target, e.getMessage());
            return MailboxResponse.no(e.getMessage());
        }
    }

    @Override
    public MailboxResponse<String> waitForChange(Duration timeout) throws TransportException {
        AtomicBoolean timedOut = new AtomicBoolean(false);
        ScheduledFuture<?> wake = idleTimer.schedule(() -> {
            timedOut.set(true);
            interruptIdle();
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            int before = folder.getMessageCount();
            folder.idle(true);
            int after = folder.getMessageCount();
            if (timedOut.get() && before == after) {
                return MailboxResponse.ok(null);
            }
            return MailboxResponse.ok("EXISTS " + after);
        } catch (FolderClosedException | StoreClosedException e) {
            throw transport("IDLE", e);
        } catch (MessagingException e) {
            log.error("IDLE failed: {}", e.getMessage());
            return MailboxResponse.no(e.getMessage());
        } finally {
            wake.cancel(false);
        }
    }

    @Override
    public void requireChangeNotification() throws UnsupportedCapabilityException, TransportException {
        try {
            if (!store.hasCapability("IDLE")) {
                throw new UnsupportedCapabilityException("IDLE");
            }
        } catch (MessagingException e) {
            throw transport("CAPABILITY", e);
        }
    }

    @Override
    public void close() {
        idleTimer.shutdownNow();
        try {
            if (folder.isOpen()) {
                folder.close(false);
            }
            if (store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            log.error("Error closing IMAP connection: {}", e.getMessage());
        }
    }

    /**
     * Any folder call from another thread terminates a pending IDLE.
     */
    private void interruptIdle() {
        try {
            folder.getMessageCount();
        } catch (MessagingException e) {
            log.debug("IDLE wake-up failed: {}", e.getMessage());
        }
    }

    /**
     * Resolves UIDs to messages, dropping UIDs no longer present.
     */
    private Message[] messages(List<Long> uids) throws MessagingException {
        long[] array = uids.stream().mapToLong(Long::longValue).toArray();
        List<Message> present = new ArrayList<>();
        for (Message message : folder.getMessagesByUID(array)) {
            if (message != null) {
                present.add(message);
            }
        }
        return present.toArray(new Message[0]);
    }

    private static ResponseStatus statusOf(Response response) {
        if (response.isOK()) {
            return ResponseStatus.OK;
        }
        return response.isNO() ? ResponseStatus.NO : ResponseStatus.BAD;
    }

    private static TransportException transport(String command, MessagingException e) {
        return new TransportException(command + " failed: " + e.getMessage(), e);
    }
}
