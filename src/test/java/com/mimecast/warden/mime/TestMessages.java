package com.mimecast.warden.mime;

import java.nio.charset.StandardCharsets;

/**
 * Raw RFC 822 fixtures.
 */
public final class TestMessages {

    private TestMessages() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Builds a plain text message.
     *
     * @param messageId Message-ID or null to omit it.
     * @param from      From header.
     * @param subject   Subject header.
     * @param body      Body text.
     * @return Raw bytes.
     */
    public static byte[] plain(String messageId, String from, String subject, String body) {
        return builder().messageId(messageId).header("From", from).header("Subject", subject).body(body).bytes();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates headers and a body.
     */
    public static final class Builder {
        private final StringBuilder headers = new StringBuilder();
        private String contentType = "text/plain; charset=utf-8";
        private String body = "";

        public Builder messageId(String messageId) {
            return messageId != null ? header("Message-ID", messageId) : this;
        }

        public Builder header(String name, String value) {
            if (value != null) {
                headers.append(name).append(": ").append(value).append("\r\n");
            }
            return this;
        }

        public Builder html(String html) {
            this.contentType = "text/html; charset=utf-8";
            this.body = html;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public byte[] bytes() {
            String raw = headers
                    + "MIME-Version: 1.0\r\n"
                    + "Content-Type: " + contentType + "\r\n"
                    + "\r\n"
                    + body.replace("\n", "\r\n") + "\r\n";
            return raw.getBytes(StandardCharsets.UTF_8);
        }
    }
}
