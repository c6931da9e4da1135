package com.mimecast.warden.config;

import com.mimecast.warden.transform.SiteTransform;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for the fetch and proxy handler.
 *
 * <p>Site transforms are resolved from their names once, when the config is built,
 * <br>so a typo fails at load time rather than while a message is being processed.
 */
public class ProxyConfig extends BasicConfig {

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X) "
            + "AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.0 Mobile/15E148 Safari/604.1";

    private final Map<String, SiteTransform> siteTransforms;

    /**
     * Constructs a new ProxyConfig instance.
     *
     * @param map Configuration map.
     * @throws IllegalArgumentException Unknown site transform name.
     */
    public ProxyConfig(Map<String, Object> map) {
        super(map);
        Map<String, SiteTransform> transforms = new LinkedHashMap<>();
        getStringMapProperty("siteTransforms").forEach((suffix, name) -> transforms.put(suffix, SiteTransform.fromName(name)));
        this.siteTransforms = Collections.unmodifiableMap(transforms);
    }

    public String getSendFrom() {
        return getStringProperty("sendFrom", "");
    }

    /**
     * Folder proxied content is appended to.
     *
     * @return Folder name.
     */
    public String getStoreTo() {
        return getStringProperty("storeTo", "INBOX.Later");
    }

    public String getKindleSendFrom() {
        return getStringProperty("kindleSendFrom", "");
    }

    public String getKindleSendTo() {
        return getStringProperty("kindleSendTo", "");
    }

    public Duration getFetchTimeout() {
        return Duration.ofSeconds(getLongProperty("fetchTimeoutSeconds", 30L));
    }

    public long getMaxDownloadSize() {
        return getLongProperty("maxDownloadSize", 100L * 1024 * 1024);
    }

    public Duration getImageTimeout() {
        return Duration.ofSeconds(getLongProperty("imageTimeoutSeconds", 10L));
    }

    /**
     * Most images inlined into one page.
     *
     * @return Image count.
     */
    public int getMaxImages() {
        return Math.toIntExact(getLongProperty("maxImages", 100L));
    }

    public long getMaxImageSize() {
        return getLongProperty("maxImageSize", 10L * 1024 * 1024);
    }

    public String getUserAgent() {
        return getStringProperty("userAgent", DEFAULT_USER_AGENT);
    }

    /**
     * Gets the domain suffix to transform mapping.
     *
     * @return Unmodifiable map in definition order.
     */
    public Map<String, SiteTransform> getSiteTransforms() {
        return siteTransforms;
    }
}
