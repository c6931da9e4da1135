package com.mimecast.warden.handlers;

import com.mimecast.warden.mime.ParsedMessage;
import com.mimecast.warden.mime.TextPart;
import com.mimecast.warden.transform.HtmlContentTransformer;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds URLs in message text.
 * <p>Matching is heuristic: anything from {@code http://} or {@code https://} up to a character
 * <br>that never appears in URLs, minus trailing prose punctuation.
 */
public class UrlExtractor {

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s<>\"{}|\\\\^`\\[\\]'()]+");

    private static final String TRAILING_PUNCTUATION = ".,;:!?*";

    private UrlExtractor() {
        throw new IllegalStateException("Static utility class");
    }

    /**
     * Extracts unique URLs from all text parts and the subject.
     * <p>HTML parts are rendered to text with link targets first.
     *
     * @param message Parsed message.
     * @return URLs in first-seen order.
     */
    public static Set<String> extract(ParsedMessage message) {
        Set<String> urls = new LinkedHashSet<>();
        for (TextPart part : message.getTextParts()) {
            String text = part.isHtml()
                    ? HtmlContentTransformer.toText(Jsoup.parse(part.getText()), true)
                    : part.getText();
            urls.addAll(extract(text));
        }
        if (message.getSubject() != null) {
            urls.addAll(extract(message.getSubject()));
        }
        return urls;
    }

    /**
     * Extracts unique URLs from text.
     *
     * @param text Text to scan.
     * @return URLs in first-seen order.
     */
    public static Set<String> extract(String text) {
        Set<String> urls = new LinkedHashSet<>();
        if (text == null) {
            return urls;
        }
        Matcher matcher = URL_PATTERN.matcher(text);
        while (matcher.find()) {
            String url = StringUtils.stripEnd(matcher.group(), TRAILING_PUNCTUATION);
            if (!url.isEmpty()) {
                urls.add(url);
            }
        }
        return urls;
    }
}
