package org.alertingupgrade.migrations.lock;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import org.alertingupgrade.migrations.store.DatabaseClient;
import org.alertingupgrade.migrations.store.MigrationStoreException;

import lombok.extern.slf4j.Slf4j;

/**
 * Locks are rows of {@code server_lock}. A row whose {@code last_execution} is older than the lease is stale and
 * is taken over with an optimistic update on {@code version}. Each statement runs in its own transaction so the
 * lock is visible to other processes while the action runs.
 */
@Slf4j
public class JdbcServerLockService implements ServerLockService {
    private final DatabaseClient dbClient;
    private final Clock clock;

    public JdbcServerLockService(DatabaseClient dbClient, Clock clock) {
        this.dbClient = dbClient;
        this.clock = clock;
    }

    @Override
    public void lockExecuteAndRelease(String actionName, Duration lease, Runnable action) {
        var held = acquire(actionName, lease)
            .orElseThrow(() -> new ServerLockHeldException(actionName));
        log.debug("Acquired server lock '{}' at version {}", actionName, held.version());
        try {
            action.run();
        } finally {
            release(actionName, held);
        }
    }

    /** The row as written by this process, empty when another process holds the lease */
    private Optional<LockRow> acquire(String actionName, Duration lease) {
        long now = clock.instant().getEpochSecond();
        try {
            var inserted = dbClient.executeUpdate(
                "INSERT INTO server_lock (operation_uid, version, last_execution) VALUES (?, 1, ?) "
                    + "ON CONFLICT (operation_uid) DO NOTHING",
                actionName, now);
            if (inserted == 1) {
                return Optional.of(new LockRow(1, now));
            }

            var existing = dbClient.executeQuery(
                "SELECT version, last_execution FROM server_lock WHERE operation_uid = ?",
                rs -> rs.next()
                    ? Optional.of(new LockRow(rs.getLong("version"), rs.getLong("last_execution")))
                    : Optional.<LockRow>empty(),
                actionName);
            if (existing.isEmpty()) {
                // released between our insert and select; try once more from scratch
                var reinserted = dbClient.executeUpdate(
                    "INSERT INTO server_lock (operation_uid, version, last_execution) VALUES (?, 1, ?) "
                        + "ON CONFLICT (operation_uid) DO NOTHING",
                    actionName, now);
                return reinserted == 1 ? Optional.of(new LockRow(1, now)) : Optional.empty();
            }
            long version = existing.get().version();
            long lastExecution = existing.get().lastExecution();
            if (now - lastExecution < lease.getSeconds()) {
                return Optional.empty();
            }
            log.atWarn().setMessage("Taking over expired server lock '{}' last acquired at {}")
                .addArgument(actionName)
                .addArgument(lastExecution)
                .log();
            var updated = dbClient.executeUpdate(
                "UPDATE server_lock SET version = ?, last_execution = ? WHERE operation_uid = ? AND version = ?",
                version + 1, now, actionName, version);
            return updated == 1 ? Optional.of(new LockRow(version + 1, now)) : Optional.empty();
        } catch (SQLException e) {
            throw new MigrationStoreException("acquire server lock " + actionName, e);
        }
    }

    /** Leaves the row alone when another process took the lease over in the meantime */
    private void release(String actionName, LockRow held) {
        try {
            var deleted = dbClient.executeUpdate(
                "DELETE FROM server_lock WHERE operation_uid = ? AND version = ? AND last_execution = ?",
                actionName, held.version(), held.lastExecution());
            if (deleted == 0) {
                log.atWarn().setMessage("Server lock '{}' was taken over by another process, not releasing it")
                    .addArgument(actionName)
                    .log();
                return;
            }
            log.debug("Released server lock '{}'", actionName);
        } catch (SQLException e) {
            throw new MigrationStoreException("release server lock " + actionName, e);
        }
    }

    private record LockRow(long version, long lastExecution) {}
}
