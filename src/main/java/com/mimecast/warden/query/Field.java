package com.mimecast.warden.query;

/**
 * Envelope fields a filter expression can match against.
 */
public enum Field {
    FROM,
    TO,
    CC,
    SUBJECT;

    /**
     * Gets the IMAP SEARCH keyword for this field.
     *
     * @return Keyword string.
     */
    public String keyword() {
        return name();
    }
}
