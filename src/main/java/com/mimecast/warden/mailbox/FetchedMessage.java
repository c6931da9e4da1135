package com.mimecast.warden.mailbox;

/**
 * One item returned by a fetch: the message UID and its raw RFC 822 bytes.
 */
public final class FetchedMessage {

    private final long uid;
    private final byte[] raw;

    public FetchedMessage(long uid, byte[] raw) {
        this.uid = uid;
        this.raw = raw;
    }

    public long getUid() {
        return uid;
    }

    public byte[] getRaw() {
        return raw;
    }
}
