package com.mimecast.warden.main;

import com.mimecast.warden.dedup.DedupWindow;
import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.exception.UnsupportedCapabilityException;
import com.mimecast.warden.loop.Backoff;
import com.mimecast.warden.loop.ConnectionSupervisor;
import com.mimecast.warden.loop.EventLoop;
import com.mimecast.warden.loop.ShutdownSignal;
import com.mimecast.warden.loop.Sleeper;
import com.mimecast.warden.mailbox.SessionFactory;
import com.mimecast.warden.rules.PipelineRunner;
import com.mimecast.warden.rules.RuleEngine;
import com.mimecast.warden.rules.RuleTable;
import com.mimecast.warden.smtp.Credentials;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Core entry point wiring the rule engine, event loop and connection supervisor.
 *
 * <p>{@link #run} blocks. In single-pass mode it returns after one pass, otherwise it runs until
 * {@link #shutdown()} is called.
 *
 * @see ConnectionSupervisor
 */
public class Warden {
    private static final Logger log = LogManager.getLogger(Warden.class);

    private final SessionFactory sessionFactory;
    private final Duration idleTimeout;
    private final ShutdownSignal shutdown;
    private final Sleeper sleeper;
    private final CountDownLatch stopped = new CountDownLatch(1);

    /**
     * Constructs a new Warden instance.
     *
     * @param sessionFactory Mailbox session factory.
     * @param idleTimeout    Change-notification wait bound.
     * @param shutdown       Stop request.
     */
    public Warden(SessionFactory sessionFactory, Duration idleTimeout, ShutdownSignal shutdown) {
        this(sessionFactory, idleTimeout, shutdown, shutdown::sleep);
    }

    /**
     * Constructs a new Warden instance with a custom backoff sleeper.
     *
     * @param sessionFactory Mailbox session factory.
     * @param idleTimeout    Change-notification wait bound.
     * @param shutdown       Stop request.
     * @param sleeper        Backoff wait.
     */
    public Warden(SessionFactory sessionFactory, Duration idleTimeout, ShutdownSignal shutdown, Sleeper sleeper) {
        this.sessionFactory = sessionFactory;
        this.idleTimeout = idleTimeout;
        this.shutdown = shutdown;
        this.sleeper = sleeper;
    }

    /**
     * Runs the rule table against the mailbox.
     *
     * @param ruleTable    Rules.
     * @param credentials  Outgoing delivery credentials.
     * @param once         Single pass instead of daemon.
     * @param initialDelay First reconnect delay.
     * @param maxDelay     Reconnect delay cap.
     * @throws UnsupportedCapabilityException Store lacks change notification.
     * @throws TransportException             Connection failure in single-pass mode.
     */
    public void run(RuleTable ruleTable, Credentials credentials, boolean once, Duration initialDelay, Duration maxDelay)
            throws UnsupportedCapabilityException, TransportException {
        log.info("Starting with {} rule(s) in {} mode", ruleTable.size(), once ? "single-pass" : "daemon");
        try {
            RuleEngine engine = new RuleEngine(ruleTable, new PipelineRunner(credentials, shutdown::isRequested));
            EventLoop loop = new EventLoop(engine, new DedupWindow(), idleTimeout, shutdown);
            new ConnectionSupervisor(sessionFactory, loop, new Backoff(initialDelay, maxDelay), shutdown, sleeper)
                    .run(once);
        } finally {
            stopped.countDown();
        }
    }

    /**
     * Requests a stop. The step in flight completes first.
     */
    public void shutdown() {
        shutdown.request();
    }

    /**
     * Waits for {@link #run} to return.
     *
     * @param timeout Maximum wait.
     * @return True if stopped in time.
     * @throws InterruptedException Interrupted.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
