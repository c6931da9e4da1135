package com.mimecast.warden.config;

import java.util.Map;

/**
 * Addresses and templates for the auto forward and reply handler.
 *
 * <p>Templates are maps of language tag to text. The forward note may reference {@code {sender}}.
 */
public class AutoReplyConfig extends BasicConfig {

    public AutoReplyConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Internal address receiving forwards.
     *
     * @return Address.
     */
    public String getForwardTo() {
        return getStringProperty("forwardTo", "");
    }

    /**
     * Sender of the forward.
     *
     * @return Address.
     */
    public String getForwardBy() {
        return getStringProperty("forwardBy", "");
    }

    /**
     * Sender of the external reply.
     *
     * @return Address.
     */
    public String getReplyFrom() {
        return getStringProperty("replyFrom", "");
    }

    public Map<String, String> getReply() {
        return getStringMapProperty("reply");
    }

    public Map<String, String> getForwardNote() {
        return getStringMapProperty("forwardNote");
    }
}
