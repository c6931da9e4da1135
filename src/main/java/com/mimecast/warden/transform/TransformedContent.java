package com.mimecast.warden.transform;

/**
 * Result of transforming fetched content.
 * <p>Text bodies are always UTF-8.
 */
public final class TransformedContent {

    private final byte[] body;
    private final String mimeType;
    private final String title;
    private final String prefix;

    public TransformedContent(byte[] body, String mimeType, String title, String prefix) {
        this.body = body;
        this.mimeType = mimeType;
        this.title = title;
        this.prefix = prefix;
    }

    public byte[] getBody() {
        return body;
    }

    /**
     * Gets the base MIME type of the body, for example {@code text/plain}.
     *
     * @return MIME type.
     */
    public String getMimeType() {
        return mimeType;
    }

    /**
     * Gets the document title, or null when the content has none.
     *
     * @return Title.
     */
    public String getTitle() {
        return title;
    }

    /**
     * Gets the subject prefix describing the applied transformations, empty when none.
     *
     * @return Prefix.
     */
    public String getPrefix() {
        return prefix;
    }

    public boolean isText() {
        return mimeType != null && mimeType.startsWith("text/");
    }
}
