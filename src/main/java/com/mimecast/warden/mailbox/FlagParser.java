package com.mimecast.warden.mailbox;

import jakarta.mail.Flags;

/**
 * Parses IMAP flag expressions such as {@code (\Seen \Flagged)} into Jakarta Mail flags.
 * <p>System flags start with a backslash, anything else is a user keyword.
 */
public class FlagParser {

    private FlagParser() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Parses a flag expression.
     *
     * @param expression Flag expression, parentheses optional, may be empty.
     * @return Flags instance.
     * @throws IllegalArgumentException Unknown or read-only system flag.
     */
    public static Flags parse(String expression) {
        Flags flags = new Flags();
        if (expression == null) {
            return flags;
        }

        String trimmed = expression.trim();
        if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        if (trimmed.isEmpty()) {
            return flags;
        }

        for (String token : trimmed.split("\\s+")) {
            if (token.startsWith("\\")) {
                flags.add(systemFlag(token));
            } else {
                flags.add(token);
            }
        }
        return flags;
    }

    private static Flags.Flag systemFlag(String token) {
        switch (token.toLowerCase()) {
            case "\\seen":
                return Flags.Flag.SEEN;
            case "\\deleted":
                return Flags.Flag.DELETED;
            case "\\answered":
                return Flags.Flag.ANSWERED;
            case "\\flagged":
                return Flags.Flag.FLAGGED;
            case "\\draft":
                return Flags.Flag.DRAFT;
            default:
                throw new IllegalArgumentException("Unsupported system flag: " + token);
        }
    }
}
