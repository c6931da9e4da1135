package com.mimecast.warden.http;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Downloaded resource: body bytes, final URL after redirects and response headers.
 */
public final class FetchedContent {

    private final byte[] body;
    private final String finalUrl;
    private final Map<String, String> headers;

    /**
     * Constructs a new FetchedContent instance.
     *
     * @param body     Body bytes.
     * @param finalUrl URL after redirects.
     * @param headers  Response headers, names matched case-insensitively.
     */
    public FetchedContent(byte[] body, String finalUrl, Map<String, String> headers) {
        this.body = body;
        this.finalUrl = finalUrl;
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
    }

    public byte[] getBody() {
        return body;
    }

    public String getFinalUrl() {
        return finalUrl;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    /**
     * Gets the lower case base content type without parameters.
     *
     * @return Content type, {@code application/octet-stream} when absent.
     */
    public String getMimeType() {
        String value = headers.get("Content-Type");
        if (value == null || value.isBlank()) {
            return "application/octet-stream";
        }
        return value.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Gets the charset parameter of the content type.
     *
     * @return Charset name or null.
     */
    public String getCharset() {
        String value = headers.get("Content-Type");
        if (value == null) {
            return null;
        }
        for (String param : value.split(";")) {
            String[] pair = param.trim().split("=", 2);
            if (pair.length == 2 && pair[0].trim().equalsIgnoreCase("charset")) {
                return pair[1].trim().replace("\"", "");
            }
        }
        return null;
    }
}
