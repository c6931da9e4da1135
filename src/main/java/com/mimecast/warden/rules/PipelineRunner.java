package com.mimecast.warden.rules;

import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.mailbox.MailboxSession;
import com.mimecast.warden.smtp.Credentials;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Runs a rule pipeline over one matched UID set.
 * <p>
 * Steps run strictly in order and the pipeline stops at the first step that does not return OK.
 * <br>A stop request is honoured between steps, never inside one.
 */
public class PipelineRunner {
    private static final Logger log = LogManager.getLogger(PipelineRunner.class);

    private final Credentials credentials;
    private final BooleanSupplier stopRequested;

    /**
     * Constructs a new PipelineRunner instance.
     *
     * @param credentials   Delivery credentials handed to content handlers.
     * @param stopRequested Checked before each step.
     */
    public PipelineRunner(Credentials credentials, BooleanSupplier stopRequested) {
        this.credentials = credentials;
        this.stopRequested = stopRequested;
    }

    /**
     * Runs the steps.
     *
     * @param session Mailbox session.
     * @param uids    Matched UIDs.
     * @param steps   Steps in order.
     * @param seen    Seen identifiers for this rule scope.
     * @return Result of the last step run.
     * @throws TransportException Connection failure.
     */
    public StepResult run(MailboxSession session, List<Long> uids, List<HandlerStep> steps, Set<String> seen) throws TransportException {
        StepResult result = new StepResult(StepStatus.OK, null, seen);
        for (HandlerStep step : steps) {
            if (stopRequested.getAsBoolean()) {
                log.info("Stop requested, skipping {}", step);
                break;
            }

            result = execute(session, uids, step, result.getSeen());
            if (!result.isOk()) {
                log.warn("Step {} failed: {}", step, result.getData());
                break;
            }
        }
        return result;
    }

    /**
     * Executes a single step.
     *
     * @param session Mailbox session.
     * @param uids    Matched UIDs.
     * @param step    Step.
     * @param seen    Seen identifiers.
     * @return Step result.
     * @throws TransportException Connection failure.
     */
    StepResult execute(MailboxSession session, List<Long> uids, HandlerStep step, Set<String> seen) throws TransportException {
        log.debug("Running {} on {} message(s)", step, uids.size());
        switch (step.getKind()) {
            case EXPUNGE:
                return StepResult.of(session.expunge(), seen);

            case DELETE:
                return StepResult.of(session.storeFlags(uids, HandlerStep.DELETED), seen);

            case COPY:
                return StepResult.of(session.copy(uids, step.getFolder()), seen);

            case MOVE:
                return move(session, uids, step.getFolder(), seen);

            case SET_FLAGS:
                return StepResult.of(session.storeFlags(uids, step.getFlags()), seen);

            case SET_FLAGS_AND_MOVE:
                StepResult flagged = StepResult.of(session.storeFlags(uids, step.getFlags()), seen);
                return flagged.isOk() ? move(session, uids, step.getFolder(), seen) : flagged;

            case CONTENT:
                return step.getHandler().handle(session, uids, seen, credentials);

            default:
                throw new IllegalStateException("Unhandled step kind " + step.getKind());
        }
    }

    private StepResult move(MailboxSession session, List<Long> uids, String folder, Set<String> seen) throws TransportException {
        StepResult copied = StepResult.of(session.copy(uids, folder), seen);
        if (!copied.isOk()) {
            return copied;
        }
        return StepResult.of(session.storeFlags(uids, HandlerStep.DELETED), seen);
    }
}
