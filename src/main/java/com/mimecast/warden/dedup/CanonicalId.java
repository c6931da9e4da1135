package com.mimecast.warden.dedup;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Derives the dedup key of a message.
 *
 * <p>The key is the content-level Message-ID. Messages without one are keyed by a digest of their
 * <br>raw bytes so they still take part in the window.
 */
public class CanonicalId {

    private CanonicalId() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets the canonical identifier.
     *
     * @param messageId Message-ID header value, may be null.
     * @param raw       Raw message bytes.
     * @return Identifier string.
     */
    public static String of(String messageId, byte[] raw) {
        if (StringUtils.isNotBlank(messageId)) {
            return messageId.trim();
        }
        return "sha256:" + DigestUtils.sha256Hex(raw);
    }
}
