package org.alertingupgrade.migrations.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

public interface DatabaseClient extends AutoCloseable {
    /** Joins the transaction bound to the calling thread, or runs in a transaction of its own */
    <T> T executeInTransaction(TransactionFunction<T> operation) throws SQLException;

    /**
     * Binds one transaction to the calling thread for the duration of {@code work}. Nested calls join it.
     * Any exception thrown by {@code work} rolls everything back.
     */
    <T> T executeInBoundTransaction(TransactionalWork<T> work) throws SQLException;

    default <T> T executeQuery(String sql, ResultSetMapper<T> mapper, Object... params) throws SQLException {
        return executeInTransaction(conn -> {
            try (var stmt = conn.prepareStatement(sql)) {
                bind(stmt, params);
                try (var rs = stmt.executeQuery()) {
                    return mapper.map(rs);
                }
            }
        });
    }

    default int executeUpdate(String sql, Object... params) throws SQLException {
        return executeInTransaction(conn -> {
            try (var stmt = conn.prepareStatement(sql)) {
                bind(stmt, params);
                return stmt.executeUpdate();
            }
        });
    }

    static void bind(PreparedStatement stmt, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            stmt.setObject(i + 1, params[i]);
        }
    }

    @FunctionalInterface
    interface TransactionFunction<T> {
        T apply(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    interface ResultSetMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
