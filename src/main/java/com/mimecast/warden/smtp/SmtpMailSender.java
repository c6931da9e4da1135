package com.mimecast.warden.smtp;

import com.mimecast.warden.exception.DeliveryException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Properties;

/**
 * Jakarta Mail SMTP sender.
 * <p>
 * Opens one authenticated connection per message.
 */
public class SmtpMailSender implements MailSender {
    private static final Logger log = LogManager.getLogger(SmtpMailSender.class);

    @Override
    public void send(Credentials credentials, String from, String to, MimeMessage message) throws DeliveryException {
        String protocol = credentials.isSsl() ? "smtps" : "smtp";
        Session session = Session.getInstance(buildProperties(credentials, protocol, from));

        Transport transport = null;
        try {
            InternetAddress[] recipients = InternetAddress.parse(to);
            transport = session.getTransport(protocol);
            transport.connect(credentials.getHost(), credentials.getPort(), credentials.getUser(), credentials.getPassword());
            transport.sendMessage(message, recipients);
            log.info("Sent \"{}\" from {} to {}", message.getSubject(), from, to);
        } catch (MessagingException e) {
            throw new DeliveryException("Delivery to " + to + " failed: " + e.getMessage(), e);
        } finally {
            if (transport != null) {
                try {
                    transport.close();
                } catch (MessagingException e) {
                    log.debug("Error closing transport: {}", e.getMessage());
                }
            }
        }
    }

    /**
     * Builds session properties.
     *
     * @param credentials Credentials.
     * @param protocol    smtp or smtps.
     * @param from        Envelope sender.
     * @return Properties instance.
     */
    static Properties buildProperties(Credentials credentials, String protocol, String from) {
        Properties props = new Properties();
        String prefix = "mail." + protocol + ".";
        props.put(prefix + "host", credentials.getHost());
        props.put(prefix + "port", String.valueOf(credentials.getPort()));
        props.put(prefix + "auth", "true");
        props.put(prefix + "connectiontimeout", "10000");
        props.put(prefix + "timeout", "30000");
        props.put(prefix + "writetimeout", "20000");
        if (!credentials.isSsl()) {
            props.put(prefix + "starttls.enable", "true");
            props.put(prefix + "starttls.required", "true");
        }
        String address = envelopeAddress(from);
        if (address != null) {
            props.put(prefix + "from", address);
        }
        return props;
    }

    private static String envelopeAddress(String from) {
        if (from == null || from.isBlank()) {
            return null;
        }
        try {
            return new InternetAddress(from).getAddress();
        } catch (AddressException e) {
            log.warn("Unparsable envelope sender {}: {}", from, e.getMessage());
            return null;
        }
    }
}
