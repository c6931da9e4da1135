package com.mimecast.warden.loop;

import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.exception.UnsupportedCapabilityException;
import com.mimecast.warden.mailbox.MailboxSession;
import com.mimecast.warden.mailbox.SessionFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;

/**
 * Keeps an event loop connected.
 * <p>
 * Transient failures move to backoff and are retried with a doubling, capped delay.
 * <br>A session that ends normally reconnects at once and resets the delay.
 * <br>Missing capabilities are fatal and never retried. In single-pass mode every failure propagates.
 */
public class ConnectionSupervisor {
    private static final Logger log = LogManager.getLogger(ConnectionSupervisor.class);

    private final SessionFactory sessionFactory;
    private final EventLoop eventLoop;
    private final Backoff backoff;
    private final ShutdownSignal shutdown;
    private final Sleeper sleeper;

    private volatile SupervisorState state = SupervisorState.CONNECTING;

    /**
     * Constructs a new ConnectionSupervisor sleeping on the shutdown signal.
     *
     * @param sessionFactory Session factory.
     * @param eventLoop      Event loop.
     * @param backoff        Reconnect delay.
     * @param shutdown       Stop request.
     */
    public ConnectionSupervisor(SessionFactory sessionFactory, EventLoop eventLoop, Backoff backoff, ShutdownSignal shutdown) {
        this(sessionFactory, eventLoop, backoff, shutdown, shutdown::sleep);
    }

    /**
     * Constructs a new ConnectionSupervisor instance.
     *
     * @param sessionFactory Session factory.
     * @param eventLoop      Event loop.
     * @param backoff        Reconnect delay.
     * @param shutdown       Stop request.
     * @param sleeper        Backoff wait.
     */
    public ConnectionSupervisor(SessionFactory sessionFactory, EventLoop eventLoop, Backoff backoff, ShutdownSignal shutdown, Sleeper sleeper) {
        this.sessionFactory = sessionFactory;
        this.eventLoop = eventLoop;
        this.backoff = backoff;
        this.shutdown = shutdown;
        this.sleeper = sleeper;
    }

    /**
     * Runs until shutdown or, in single-pass mode, until one pass completes.
     *
     * @param once Single-pass mode.
     * @throws UnsupportedCapabilityException Change notification unsupported.
     * @throws TransportException             Connection failure in single-pass mode.
     */
    public void run(boolean once) throws UnsupportedCapabilityException, TransportException {
        while (!shutdown.isRequested()) {
            state = SupervisorState.CONNECTING;
            try (MailboxSession session = sessionFactory.open()) {
                state = SupervisorState.ACTIVE;
                eventLoop.run(session, once);
            } catch (UnsupportedCapabilityException e) {
                state = SupervisorState.TERMINAL;
                log.fatal("Store does not support {}", e.getCapability());
                throw e;
            } catch (TransportException e) {
                if (once) {
                    state = SupervisorState.TERMINAL;
                    throw e;
                }
                if (!backOff(e)) {
                    break;
                }
                continue;
            } catch (RuntimeException e) {
                if (once) {
                    state = SupervisorState.TERMINAL;
                    throw e;
                }
                log.error("Unexpected error: {}", e.getMessage(), e);
                if (!backOff(e)) {
                    break;
                }
                continue;
            }

            if (once) {
                break;
            }
            backoff.reset();
        }
        state = SupervisorState.TERMINAL;
        log.info("Supervisor stopped");
    }

    /**
     * Waits before the next attempt.
     *
     * @param e Failure.
     * @return False if the wait was interrupted or a stop was requested.
     */
    private boolean backOff(Exception e) {
        if (shutdown.isRequested()) {
            log.info("Connection failed during shutdown: {}", e.getMessage());
            return false;
        }
        state = SupervisorState.BACKOFF;
        Duration delay = backoff.next();
        log.error("Connection failed: {}. Retrying in {} ms", e.getMessage(), delay.toMillis());
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Backoff interrupted");
            return false;
        }
        return !shutdown.isRequested();
    }

    /**
     * Requests a stop; the in-flight step finishes first.
     */
    public void requestShutdown() {
        shutdown.request();
    }

    public SupervisorState getState() {
        return state;
    }

    public Backoff getBackoff() {
        return backoff;
    }
}
