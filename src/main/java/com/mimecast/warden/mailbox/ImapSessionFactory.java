package com.mimecast.warden.mailbox;

import com.mimecast.warden.config.ImapConfig;
import com.mimecast.warden.exception.TransportException;
import com.sun.mail.imap.IMAPFolder;
import com.sun.mail.imap.IMAPStore;
import jakarta.mail.Folder;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Properties;

/**
 * Opens {@link ImapMailboxSession} instances using Jakarta Mail.
 *
 * <p>Port 993 selects implicit TLS, other ports use STARTTLS when offered.
 */
public class ImapSessionFactory implements SessionFactory {
    private static final Logger log = LogManager.getLogger(ImapSessionFactory.class);

    private final ImapConfig config;
    private final String password;

    /**
     * Constructs a new ImapSessionFactory instance.
     *
     * @param config   IMAP settings.
     * @param password Login password.
     */
    public ImapSessionFactory(ImapConfig config, String password) {
        this.config = config;
        this.password = password;
    }

    /**
     * Builds Jakarta Mail session properties for IMAP/IMAPS.
     *
     * @return Properties.
     */
    Properties buildProperties() {
        Properties props = new Properties();
        String port = String.valueOf(config.getPort());
        boolean ssl = "993".equals(port);
        String protocol = ssl ? "imaps" : "imap";

        props.put("mail.store.protocol", protocol);
        props.put("mail." + protocol + ".host", config.getHost());
        props.put("mail." + protocol + ".port", port);
        props.put("mail." + protocol + ".ssl.enable", String.valueOf(ssl));
        props.put("mail." + protocol + ".starttls.enable", String.valueOf(!ssl));
        props.put("mail." + protocol + ".connectiontimeout", "10000");
        props.put("mail." + protocol + ".timeout", "60000");
        props.put("mail.debug", String.valueOf(config.isDebug()));

        return props;
    }

    @Override
    public MailboxSession open() throws TransportException {
        Properties props = buildProperties();
        Session session = Session.getInstance(props);
        IMAPStore store = null;
        try {
            store = (IMAPStore) session.getStore(props.getProperty("mail.store.protocol"));
            store.connect(config.getHost(), config.getPort(), config.getUser(), password);

            IMAPFolder folder = (IMAPFolder) store.getFolder(config.getInbox());
            folder.open(Folder.READ_WRITE);
            log.info("Connected to {}:{} as {} and selected {}", config.getHost(), config.getPort(), config.getUser(), config.getInbox());

            return new ImapMailboxSession(session, store, folder);
        } catch (MessagingException e) {
            closeQuietly(store);
            throw new TransportException("Unable to open " + config.getInbox() + " on " + config.getHost() + ": " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(IMAPStore store) {
        if (store != null && store.isConnected()) {
            try {
                store.close();
            } catch (MessagingException e) {
                log.debug("Error closing store after failed connect: {}", e.getMessage());
            }
        }
    }
}
