package com.mimecast.warden.rules;

import com.mimecast.warden.mailbox.ResponseStatus;

/**
 * Outcome of one pipeline step.
 */
public enum StepStatus {
    OK,
    FAIL;

    public static StepStatus of(ResponseStatus status) {
        return status != null && status.isOk() ? OK : FAIL;
    }
}
