package com.mimecast.warden.handlers;

import com.mimecast.warden.mime.ParsedMessage;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;

/**
 * Utility class for resolving where responses to a message go.
 */
public class SenderResolver {
    private static final Logger log = LogManager.getLogger(SenderResolver.class);

    private SenderResolver() {
        throw new IllegalStateException("Static utility class");
    }

    /**
     * Resolves the reply address.
     * <p>Priority order:
     * <ol>
     *   <li>Reply-To header</li>
     *   <li>From header</li>
     *   <li>Sender header</li>
     * </ol>
     *
     * @param message Parsed message.
     * @return Header value or null if none found.
     */
    public static String resolveReplyAddress(ParsedMessage message) {
        return firstNonBlank(message.getReplyTo(), message.getFrom(), message.getSender());
    }

    /**
     * Resolves the originator, ignoring Reply-To.
     * <p>Priority order: From, then Sender.
     *
     * @param message Parsed message.
     * @return Header value or null if none found.
     */
    public static String resolveOriginator(ParsedMessage message) {
        return firstNonBlank(message.getFrom(), message.getSender());
    }

    /**
     * Extracts the bare address from a header value such as {@code Name <user@example.com>}.
     *
     * @param value Header value.
     * @return Address, or the trimmed value when it cannot be parsed.
     */
    public static String extractEmailAddress(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            InternetAddress[] addresses = InternetAddress.parseHeader(value, false);
            if (addresses.length > 0 && addresses[0].getAddress() != null) {
                return addresses[0].getAddress();
            }
        } catch (AddressException e) {
            log.debug("Unable to parse address {}: {}", value, e.getMessage());
        }
        return value.trim();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (StringUtils.isNotBlank(value)) {
                return value;
            }
        }
        return null;
    }
}
