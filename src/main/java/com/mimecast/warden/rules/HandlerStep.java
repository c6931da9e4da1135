package com.mimecast.warden.rules;

import com.mimecast.warden.handlers.ContentHandler;

import java.util.Objects;

/**
 * One step of a rule pipeline.
 * <p>A tagged value: the kind selects the operation and only the parameters that kind needs are set.
 * <p>Use the static factories:
 * <pre>
 * List.of(HandlerStep.setFlagsAndMove("(\\Seen)", "INBOX.Archive"), HandlerStep.expunge());
 * </pre>
 */
public final class HandlerStep {

    /**
     * Flag expression marking messages deleted.
     */
    public static final String DELETED = "(\\Deleted)";

    private final StepKind kind;
    private final String folder;
    private final String flags;
    private final ContentHandler handler;

    private HandlerStep(StepKind kind, String folder, String flags, ContentHandler handler) {
        this.kind = kind;
        this.folder = folder;
        this.flags = flags;
        this.handler = handler;
    }

    public static HandlerStep expunge() {
        return new HandlerStep(StepKind.EXPUNGE, null, null, null);
    }

    public static HandlerStep delete() {
        return new HandlerStep(StepKind.DELETE, null, null, null);
    }

    public static HandlerStep copy(String folder) {
        return new HandlerStep(StepKind.COPY, require(folder, "folder"), null, null);
    }

    /**
     * Copy then delete when the copy succeeded.
     *
     * @param folder Destination folder.
     * @return HandlerStep instance.
     */
    public static HandlerStep move(String folder) {
        return new HandlerStep(StepKind.MOVE, require(folder, "folder"), null, null);
    }

    public static HandlerStep setFlags(String flags) {
        return new HandlerStep(StepKind.SET_FLAGS, null, require(flags, "flags"), null);
    }

    /**
     * Set flags then move when the store succeeded.
     *
     * @param flags  Flag expression.
     * @param folder Destination folder.
     * @return HandlerStep instance.
     */
    public static HandlerStep setFlagsAndMove(String flags, String folder) {
        return new HandlerStep(StepKind.SET_FLAGS_AND_MOVE, require(folder, "folder"), require(flags, "flags"), null);
    }

    public static HandlerStep content(ContentHandler handler) {
        return new HandlerStep(StepKind.CONTENT, null, null, Objects.requireNonNull(handler, "handler"));
    }

    private static String require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Step " + name + " must not be empty");
        }
        return value;
    }

    public StepKind getKind() {
        return kind;
    }

    public String getFolder() {
        return folder;
    }

    public String getFlags() {
        return flags;
    }

    public ContentHandler getHandler() {
        return handler;
    }

    @Override
    public String toString() {
        switch (kind) {
            case COPY:
            case MOVE:
                return kind + "(" + folder + ")";
            case SET_FLAGS:
                return kind + "(" + flags + ")";
            case SET_FLAGS_AND_MOVE:
                return kind + "(" + flags + ", " + folder + ")";
            case CONTENT:
                return kind + "(" + handler.getKind() + ")";
            default:
                return kind.toString();
        }
    }
}
