package com.mimecast.warden.config;

import java.util.Map;

/**
 * Outgoing delivery settings.
 */
public class SmtpConfig extends BasicConfig {

    public SmtpConfig(Map<String, Object> map) {
        super(map);
    }

    public String getHost() {
        return getStringProperty("host", "localhost");
    }

    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 465L));
    }

    /**
     * Gets the SMTP login, empty meaning reuse the IMAP login.
     *
     * @return User name.
     */
    public String getUser() {
        return getStringProperty("user", "");
    }

    /**
     * Implicit TLS (SMTPS) unless disabled.
     *
     * @return Boolean.
     */
    public boolean isSsl() {
        return getBooleanProperty("ssl", true);
    }
}
