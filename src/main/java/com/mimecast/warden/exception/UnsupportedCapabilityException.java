package com.mimecast.warden.exception;

import javax.naming.ConfigurationException;

/**
 * The connected store lacks a capability the event loop requires (IDLE).
 *
 * <p>This is a fatal configuration error and is never retried.
 */
public class UnsupportedCapabilityException extends ConfigurationException {

    private final String capability;

    /**
     * Constructs a new UnsupportedCapabilityException instance.
     *
     * @param capability Missing capability name.
     */
    public UnsupportedCapabilityException(String capability) {
        super("Server does not support " + capability + " command");
        this.capability = capability;
    }

    /**
     * Gets the missing capability.
     *
     * @return Capability name.
     */
    public String getCapability() {
        return capability;
    }
}
