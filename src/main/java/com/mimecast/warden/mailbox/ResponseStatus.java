package com.mimecast.warden.mailbox;

/**
 * Completion status of a mailbox command.
 */
public enum ResponseStatus {
    OK,
    NO,
    BAD;

    public boolean isOk() {
        return this == OK;
    }
}
