package com.mimecast.warden.exception;

import java.io.IOException;

/**
 * Connection or socket level failure talking to the mailbox store.
 *
 * <p>The connection supervisor retries these with exponential backoff in daemon mode.
 * <br>In single-pass mode they are propagated to the caller.
 */
public class TransportException extends IOException {

    /**
     * Constructs a new TransportException instance.
     *
     * @param message Exception message.
     */
    public TransportException(String message) {
        super(message);
    }

    /**
     * Constructs a new TransportException instance with cause.
     *
     * @param message Exception message.
     * @param cause   Underlying cause.
     */
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
