package com.mimecast.warden.rules;

/**
 * Kinds of pipeline step.
 */
public enum StepKind {
    EXPUNGE,
    DELETE,
    COPY,
    MOVE,
    SET_FLAGS,
    SET_FLAGS_AND_MOVE,
    CONTENT
}
