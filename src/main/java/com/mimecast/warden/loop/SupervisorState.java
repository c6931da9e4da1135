package com.mimecast.warden.loop;

/**
 * Connection supervisor states.
 */
public enum SupervisorState {
    CONNECTING,
    ACTIVE,
    BACKOFF,
    TERMINAL
}
