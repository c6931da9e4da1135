package com.mimecast.warden.exception;

import java.io.IOException;

/**
 * Fetching or transforming a proxied URL failed.
 */
public class ContentFetchException extends IOException {

    /**
     * Constructs a new ContentFetchException instance.
     *
     * @param message Exception message.
     */
    public ContentFetchException(String message) {
        super(message);
    }

    /**
     * Constructs a new ContentFetchException instance with cause.
     *
     * @param message Exception message.
     * @param cause   Underlying cause.
     */
    public ContentFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
