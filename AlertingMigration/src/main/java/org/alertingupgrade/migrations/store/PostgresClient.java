package org.alertingupgrade.migrations.store;

import java.sql.Connection;
import java.sql.SQLException;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PostgresClient implements DatabaseClient, AutoCloseable {
    private final HikariDataSource dataSource;
    private final ThreadLocal<Connection> boundConnection = new ThreadLocal<>();

    public PostgresClient(String jdbcUrl, String username, String password) {
        log.debug("Initializing PostgresClient with jdbcUrl={}, username={}", jdbcUrl, username);
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(4);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);

        this.dataSource = new HikariDataSource(config);
        log.debug("PostgresClient initialized successfully");
    }

    @Override
    public <T> T executeInTransaction(TransactionFunction<T> operation) throws SQLException {
        var bound = boundConnection.get();
        if (bound != null) {
            return operation.apply(bound);
        }
        // standalone statements may be retried; work inside a bound transaction never is
        return retryOnce(() -> {
            try (var conn = dataSource.getConnection()) {
                conn.setAutoCommit(false);
                try {
                    T result = operation.apply(conn);
                    conn.commit();
                    return result;
                } catch (SQLException | RuntimeException e) {
                    log.debug("Transaction failed, rolling back: {}", e.getMessage());
                    conn.rollback();
                    throw e;
                }
            }
        });
    }

    @Override
    public <T> T executeInBoundTransaction(TransactionalWork<T> work) throws SQLException {
        if (boundConnection.get() != null) {
            return work.execute();
        }
        try (var conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            boundConnection.set(conn);
            try {
                T result = work.execute();
                conn.commit();
                log.debug("Bound transaction committed successfully");
                return result;
            } catch (Throwable t) {
                log.debug("Bound transaction failed, rolling back: {}", t.getMessage());
                conn.rollback();
                throw t;
            } finally {
                boundConnection.remove();
            }
        }
    }

    private <T> T retryOnce(SqlOperation<T> operation) throws SQLException {
        try {
            return operation.execute();
        } catch (SQLException e) {
            if (isTransientError(e)) {
                log.debug("Transient error detected, retrying once: {}", e.getMessage());
                return operation.execute();
            }
            throw e;
        }
    }

    private boolean isTransientError(SQLException e) {
        String sqlState = e.getSQLState();
        return sqlState != null && (
            sqlState.startsWith("08") ||  // Connection exception
            sqlState.equals("40001") ||   // Serialization failure
            sqlState.equals("40P01")      // Deadlock detected
        );
    }

    @FunctionalInterface
    private interface SqlOperation<T> {
        T execute() throws SQLException;
    }

    @Override
    public void close() {
        if (dataSource != null) {
            log.debug("Closing PostgresClient connection pool");
            dataSource.close();
        }
    }
}
