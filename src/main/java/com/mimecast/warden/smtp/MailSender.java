package com.mimecast.warden.smtp;

import com.mimecast.warden.exception.DeliveryException;
import jakarta.mail.internet.MimeMessage;

/**
 * Outgoing delivery collaborator.
 * <p>Failures are reported and never retried here.
 */
@FunctionalInterface
public interface MailSender {

    /**
     * Sends a message.
     *
     * @param credentials Delivery credentials.
     * @param from        Envelope sender.
     * @param to          Envelope recipient.
     * @param message     Message.
     * @throws DeliveryException Delivery failed.
     */
    void send(Credentials credentials, String from, String to, MimeMessage message) throws DeliveryException;
}
