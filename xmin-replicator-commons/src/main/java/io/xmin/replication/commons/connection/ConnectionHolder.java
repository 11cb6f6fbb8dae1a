package io.xmin.replication.commons.connection;

import io.xmin.replication.commons.lifecycle.CancellationToken;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * Keeps one connection open across cycles and replaces it with exponential backoff once it breaks.
 */
public class ConnectionHolder implements Closeable {
    private static final Logger LOG = LogManager.getLogger(ConnectionHolder.class);

    private static final long MAXIMUM_BACKOFF_MILLIS = 30000L;

    private final ConnectionProvider provider;
    private final int attempts;
    private final long backoffMillis;
    private final CancellationToken cancellationToken;

    private Connection connection;

    public ConnectionHolder(ConnectionProvider provider, int attempts, long backoffMillis, CancellationToken cancellationToken) {
        if (attempts < 1) {
            throw new IllegalArgumentException("at least one connection attempt is required");
        }

        this.provider = provider;
        this.attempts = attempts;
        this.backoffMillis = backoffMillis;
        this.cancellationToken = cancellationToken;
    }

    public synchronized Connection get() throws SQLException {
        if (this.connection == null || this.connection.isClosed()) {
            this.connection = this.connect();
        }

        return this.connection;
    }

    public synchronized Connection reconnect() throws SQLException {
        this.discard();
        this.connection = this.connect();
        return this.connection;
    }

    public String describe() {
        return this.provider.describe();
    }

    private Connection connect() throws SQLException {
        SQLException lastException = null;
        long sleepMillis = this.backoffMillis;

        for (int attempt = 1; attempt <= this.attempts; attempt++) {
            try {
                Connection connection = this.provider.getConnection();

                if (attempt > 1) {
                    ConnectionHolder.LOG.info("connected to {} after {} attempts", this.provider.describe(), attempt);
                }

                return connection;
            } catch (SQLException exception) {
                lastException = exception;

                ConnectionHolder.LOG.warn(
                        "cannot connect to {} (attempt {}/{}): {}",
                        this.provider.describe(), attempt, this.attempts, exception.getMessage()
                );

                if (attempt < this.attempts && this.backOff(sleepMillis)) {
                    break;
                }

                sleepMillis = Math.min(sleepMillis * 2, ConnectionHolder.MAXIMUM_BACKOFF_MILLIS);
            }
        }

        throw new SQLException(String.format("cannot connect to %s", this.provider.describe()), "08001", lastException);
    }

    private boolean backOff(long sleepMillis) throws SQLException {
        try {
            return this.cancellationToken.sleep(Duration.ofMillis(sleepMillis));
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new SQLException("interrupted while reconnecting", "08001", exception);
        }
    }

    private void discard() {
        if (this.connection != null) {
            try {
                this.connection.close();
            } catch (SQLException exception) {
                ConnectionHolder.LOG.debug("error closing broken connection to {}", this.provider.describe(), exception);
            } finally {
                this.connection = null;
            }
        }
    }

    @Override
    public synchronized void close() {
        this.discard();
    }
}
