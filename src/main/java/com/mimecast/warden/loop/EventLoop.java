package com.mimecast.warden.loop;

import com.mimecast.warden.dedup.DedupWindow;
import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.exception.UnsupportedCapabilityException;
import com.mimecast.warden.mailbox.MailboxResponse;
import com.mimecast.warden.mailbox.MailboxSession;
import com.mimecast.warden.rules.RuleEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;

/**
 * Drives rule passes inside one established session.
 * <p>
 * One pass runs straight away since mail may already be waiting, then one pass per change
 * <br>notification. A wait that times out without change is simply reissued.
 * <p>The dedup window outlives sessions so a reconnect does not repeat side effects.
 */
public class EventLoop {
    private static final Logger log = LogManager.getLogger(EventLoop.class);

    private final RuleEngine ruleEngine;
    private final DedupWindow window;
    private final Duration idleTimeout;
    private final ShutdownSignal shutdown;

    /**
     * Constructs a new EventLoop instance.
     *
     * @param ruleEngine  Rule engine.
     * @param window      Dedup window owned by this loop.
     * @param idleTimeout Bound on each change-notification wait.
     * @param shutdown    Stop request.
     */
    public EventLoop(RuleEngine ruleEngine, DedupWindow window, Duration idleTimeout, ShutdownSignal shutdown) {
        this.ruleEngine = ruleEngine;
        this.window = window;
        this.idleTimeout = idleTimeout;
        this.shutdown = shutdown;
    }

    /**
     * Runs until the session ends, a stop is requested or, in single-pass mode, one pass is done.
     *
     * @param session Mailbox session.
     * @param once    Single-pass mode.
     * @throws UnsupportedCapabilityException Change notification unsupported.
     * @throws TransportException             Connection or search failure.
     */
    public void run(MailboxSession session, boolean once) throws UnsupportedCapabilityException, TransportException {
        if (!once) {
            session.requireChangeNotification();
        }

        wakeUp(session, "session start");
        if (once) {
            return;
        }

        while (!shutdown.isRequested()) {
            MailboxResponse<String> notification = session.waitForChange(idleTimeout);
            if (!notification.isOk()) {
                log.warn("Change notification ended session: {}", notification);
                return;
            }
            if (shutdown.isRequested()) {
                break;
            }
            if (notification.getData() == null) {
                log.debug("Idle timed out, reissuing");
                continue;
            }
            wakeUp(session, notification.getData());
        }
        log.info("Stop requested, leaving event loop");
    }

    /**
     * Runs one pass of the rule table with a freshly rotated dedup window.
     *
     * @param session Mailbox session.
     * @param status  Notification status for the log.
     * @throws TransportException Connection or search failure.
     */
    void wakeUp(MailboxSession session, String status) throws TransportException {
        log.info("Mailbox changed: {}", status);
        window.rotate();
        ruleEngine.runPass(session, window);
    }

    public DedupWindow getWindow() {
        return window;
    }
}
