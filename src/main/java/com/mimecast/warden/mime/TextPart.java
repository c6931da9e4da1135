package com.mimecast.warden.mime;

/**
 * Decoded text part of a message.
 */
public final class TextPart {

    private final String contentType;
    private final String text;

    public TextPart(String contentType, String text) {
        this.contentType = contentType;
        this.text = text;
    }

    /**
     * Gets the base content type, lower case, for example {@code text/html}.
     *
     * @return Content type.
     */
    public String getContentType() {
        return contentType;
    }

    public String getText() {
        return text;
    }

    public boolean isHtml() {
        return "text/html".equals(contentType);
    }
}
