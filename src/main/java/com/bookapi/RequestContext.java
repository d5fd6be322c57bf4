package com.bookapi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-request deadline and cancellation handle, passed from the HTTP layer
 * down to the gateway. At most one statement is attached at a time since
 * every handler issues a single statement.
 */
public class RequestContext {

    private static final Logger log = LoggerFactory.getLogger(RequestContext.class);

    private final Instant deadline;
    private volatile boolean cancelled;
    private Statement statement;

    public RequestContext(Instant deadline) {
        this.deadline = deadline;
    }

    /** A context with no deadline, for callers outside the HTTP server. */
    public static RequestContext background() {
        return new RequestContext(null);
    }

    public static RequestContext withTimeout(Duration timeout) {
        return new RequestContext(Instant.now().plus(timeout));
    }

    public Instant getDeadline() { return deadline; }

    public boolean isCancelled() {
        return cancelled || (deadline != null && !Instant.now().isBefore(deadline));
    }

    /**
     * Registers the statement about to run and applies the remaining time as
     * its query timeout.
     *
     * @throws PersistenceException if the context is already cancelled or expired
     */
    public synchronized void attach(Statement stmt) throws SQLException {
        if (isCancelled()) {
            throw PersistenceException.cancelled("Request cancelled before statement execution");
        }
        if (deadline != null) {
            long remainingMillis = Duration.between(Instant.now(), deadline).toMillis();
            stmt.setQueryTimeout((int) Math.max(1, (remainingMillis + 999) / 1000));
        }
        this.statement = stmt;
    }

    public synchronized void detach(Statement stmt) {
        if (this.statement == stmt) {
            this.statement = null;
        }
    }

    /** Marks the request cancelled and cancels the running statement, if any. */
    public void cancel() {
        cancelled = true;
        Statement running;
        synchronized (this) {
            running = statement;
        }
        if (running != null) {
            try {
                running.cancel();
            } catch (SQLException e) {
                log.warn("Failed to cancel running statement: {}", e.getMessage());
            }
        }
    }
}
