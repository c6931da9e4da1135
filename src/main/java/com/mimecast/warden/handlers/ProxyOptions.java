package com.mimecast.warden.handlers;

import com.mimecast.warden.config.ProxyConfig;
import com.mimecast.warden.transform.TransformOptions;

import java.util.Locale;

/**
 * Fetch proxy options encoded in the address the request was sent to.
 * <p>Options are case-insensitive substrings of the To header, for example
 * <br>{@code txt+kindle+81823@example.com} asks for text sent to the Kindle address.
 * <ul>
 *   <li>txt: convert to plain text</li>
 *   <li>bleach: sanitize HTML</li>
 *   <li>images: request image inlining</li>
 *   <li>wolinks: plain text without links</li>
 *   <li>inline: content in the body instead of an attachment</li>
 *   <li>kindle: also send by SMTP to the Kindle address</li>
 * </ul>
 */
public final class ProxyOptions {

    private final boolean text;
    private final boolean bleach;
    private final boolean images;
    private final boolean withoutLinks;
    private final boolean inline;
    private final boolean sendUsingSmtp;
    private final String sendFrom;
    private final String sendTo;

    private ProxyOptions(String to, ProxyConfig config, String sender) {
        String lower = to != null ? to.toLowerCase(Locale.ROOT) : "";
        this.text = lower.contains("txt");
        this.bleach = lower.contains("bleach");
        this.images = lower.contains("images");
        this.withoutLinks = lower.contains("wolinks");
        this.inline = lower.contains("inline");
        this.sendUsingSmtp = lower.contains("kindle");
        this.sendFrom = sendUsingSmtp ? config.getKindleSendFrom() : config.getSendFrom();
        this.sendTo = sendUsingSmtp ? config.getKindleSendTo() : sender;
    }

    /**
     * Parses options.
     *
     * @param to     To header of the request.
     * @param config Proxy configuration.
     * @param sender Originator of the request.
     * @return ProxyOptions instance.
     */
    public static ProxyOptions parse(String to, ProxyConfig config, String sender) {
        return new ProxyOptions(to, config, sender);
    }

    public TransformOptions toTransformOptions() {
        return new TransformOptions(text, withoutLinks, bleach, images);
    }

    public boolean isText() {
        return text;
    }

    public boolean isBleach() {
        return bleach;
    }

    public boolean isImages() {
        return images;
    }

    public boolean isWithoutLinks() {
        return withoutLinks;
    }

    public boolean isInline() {
        return inline;
    }

    public boolean isSendUsingSmtp() {
        return sendUsingSmtp;
    }

    public String getSendFrom() {
        return sendFrom;
    }

    public String getSendTo() {
        return sendTo;
    }
}
