package com.mimecast.warden.handlers;

import java.util.Optional;

/**
 * Content handler kinds and their configuration names.
 */
public enum ContentHandlerKind {
    AUTO_FORWARD_REPLY("autoForwardReply"),
    REJECT_AND_DELETE("rejectAndDelete"),
    FETCH_PROXY("fetchProxy");

    private final String configName;

    ContentHandlerKind(String configName) {
        this.configName = configName;
    }

    /**
     * Gets the name used in rule and handler configuration.
     *
     * @return Name.
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * Finds a kind by configuration name, case-insensitive.
     *
     * @param name Name.
     * @return Optional kind.
     */
    public static Optional<ContentHandlerKind> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ContentHandlerKind kind : values()) {
            if (kind.configName.equalsIgnoreCase(name.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
