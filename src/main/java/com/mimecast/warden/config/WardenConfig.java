package com.mimecast.warden.config;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Root configuration, loaded once and shared read-only by reference.
 *
 * <p>Sections:
 * <ul>
 *     <li><b>imap</b> - {@link ImapConfig}</li>
 *     <li><b>smtp</b> - {@link SmtpConfig}</li>
 *     <li><b>autoForwardReply</b> - {@link AutoReplyConfig}</li>
 *     <li><b>rejectAndDelete</b> - {@link RejectConfig}</li>
 *     <li><b>fetchProxy</b> - {@link ProxyConfig}</li>
 *     <li><b>retry</b> - supervisor backoff bounds</li>
 * </ul>
 */
public class WardenConfig extends ConfigFoundation {

    private final ImapConfig imap;
    private final SmtpConfig smtp;
    private final AutoReplyConfig autoReply;
    private final RejectConfig reject;
    private final ProxyConfig proxy;

    public WardenConfig() {
        this((Map<String, Object>) null);
    }

    /**
     * Constructs a new WardenConfig instance.
     *
     * @param map Configuration map.
     */
    public WardenConfig(Map<String, Object> map) {
        super(map);
        this.imap = new ImapConfig(getMapProperty("imap"));
        this.smtp = new SmtpConfig(getMapProperty("smtp"));
        this.autoReply = new AutoReplyConfig(getMapProperty("autoForwardReply"));
        this.reject = new RejectConfig(getMapProperty("rejectAndDelete"));
        this.proxy = new ProxyConfig(getMapProperty("fetchProxy"));
    }

    /**
     * Constructs a new WardenConfig instance from a JSON5 file.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public WardenConfig(Path path) throws IOException {
        this(readFile(path));
    }

    public ImapConfig getImap() {
        return imap;
    }

    public SmtpConfig getSmtp() {
        return smtp;
    }

    public AutoReplyConfig getAutoForwardReply() {
        return autoReply;
    }

    public RejectConfig getRejectAndDelete() {
        return reject;
    }

    public ProxyConfig getFetchProxy() {
        return proxy;
    }

    /**
     * Language used when the message carries none of the template languages.
     *
     * @return Language tag.
     */
    public String getDefaultLanguage() {
        return getStringProperty("defaultLanguage", "en");
    }

    public Duration getInitialDelay() {
        return Duration.ofSeconds(getLongProperty("retry.initialDelaySeconds", 60L));
    }

    public Duration getMaxDelay() {
        return Duration.ofSeconds(getLongProperty("retry.maxDelaySeconds", 3600L));
    }
}
