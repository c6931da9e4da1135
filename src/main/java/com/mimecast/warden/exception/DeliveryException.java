package com.mimecast.warden.exception;

/**
 * Outgoing message could not be transmitted.
 *
 * <p>Always recovered by the caller: logged and processing continues with the next item.
 */
public class DeliveryException extends Exception {

    /**
     * Constructs a new DeliveryException instance.
     *
     * @param message Exception message.
     */
    public DeliveryException(String message) {
        super(message);
    }

    /**
     * Constructs a new DeliveryException instance with cause.
     *
     * @param message Exception message.
     * @param cause   Underlying cause.
     */
    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
