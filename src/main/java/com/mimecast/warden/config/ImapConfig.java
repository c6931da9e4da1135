package com.mimecast.warden.config;

import java.time.Duration;
import java.util.Map;

/**
 * Mailbox store connection settings.
 */
public class ImapConfig extends BasicConfig {

    /**
     * Default IDLE wait, just under the 30 minute server inactivity limit of RFC 2177.
     */
    public static final long DEFAULT_IDLE_TIMEOUT_SECONDS = 29 * 60 - 1;

    public ImapConfig(Map<String, Object> map) {
        super(map);
    }

    public String getHost() {
        return getStringProperty("host", "localhost");
    }

    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 993L));
    }

    public String getUser() {
        return getStringProperty("user", "");
    }

    /**
     * Gets the mailbox to select.
     *
     * @return Folder name.
     */
    public String getInbox() {
        return getStringProperty("inbox", "INBOX");
    }

    /**
     * Gets the bound on a single change-notification wait.
     *
     * @return Duration.
     */
    public Duration getIdleTimeout() {
        return Duration.ofSeconds(getLongProperty("idleTimeoutSeconds", DEFAULT_IDLE_TIMEOUT_SECONDS));
    }

    public boolean isDebug() {
        return getBooleanProperty("debug", false);
    }
}
