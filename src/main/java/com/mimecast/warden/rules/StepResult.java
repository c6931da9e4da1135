package com.mimecast.warden.rules;

import com.mimecast.warden.mailbox.MailboxResponse;

import java.util.Set;

/**
 * Result of one pipeline step: status, raw response data and the seen set to hand to the next step.
 */
public final class StepResult {

    private final StepStatus status;
    private final Object data;
    private final Set<String> seen;

    /**
     * Constructs a new StepResult instance.
     *
     * @param status Step status.
     * @param data   Raw data from the mailbox, may be null.
     * @param seen   Seen identifiers after the step.
     */
    public StepResult(StepStatus status, Object data, Set<String> seen) {
        this.status = status;
        this.data = data;
        this.seen = seen;
    }

    /**
     * Maps a mailbox response.
     *
     * @param response Mailbox response.
     * @param seen     Seen identifiers, passed through.
     * @return StepResult instance.
     */
    public static StepResult of(MailboxResponse<?> response, Set<String> seen) {
        return new StepResult(StepStatus.of(response.getStatus()), response.isOk() ? response.getData() : response.getText(), seen);
    }

    public StepStatus getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == StepStatus.OK;
    }

    public Object getData() {
        return data;
    }

    public Set<String> getSeen() {
        return seen;
    }

    @Override
    public String toString() {
        return "StepResult{" + status + ", " + data + "}";
    }
}
