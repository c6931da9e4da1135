package com.mimecast.warden.mailbox;

/**
 * Result of a mailbox command: completion status, server text and optional data.
 *
 * @param <T> Data type.
 */
public final class MailboxResponse<T> {

    private final ResponseStatus status;
    private final String text;
    private final T data;

    /**
     * Constructs a new MailboxResponse instance.
     *
     * @param status Completion status.
     * @param text   Server response text.
     * @param data   Response data, may be null.
     */
    public MailboxResponse(ResponseStatus status, String text, T data) {
        this.status = status;
        this.text = text != null ? text : "";
        this.data = data;
    }

    public static <T> MailboxResponse<T> ok(T data) {
        return new MailboxResponse<>(ResponseStatus.OK, "completed", data);
    }

    public static <T> MailboxResponse<T> no(String text) {
        return new MailboxResponse<>(ResponseStatus.NO, text, null);
    }

    public ResponseStatus getStatus() {
        return status;
    }

    public boolean isOk() {
        return status.isOk();
    }

    public String getText() {
        return text;
    }

    public T getData() {
        return data;
    }

    @Override
    public String toString() {
        return status + " " + text;
    }
}
