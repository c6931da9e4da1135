package com.mimecast.warden.config;

import java.util.Map;

/**
 * Sender and templates for the reject and delete handler.
 */
public class RejectConfig extends BasicConfig {

    public RejectConfig(Map<String, Object> map) {
        super(map);
    }

    public String getReplyFrom() {
        return getStringProperty("replyFrom", "");
    }

    public Map<String, String> getReply() {
        return getStringMapProperty("reply");
    }
}
