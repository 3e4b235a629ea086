package org.alertingupgrade.migrations.lock;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.alertingupgrade.migrations.testutils.PostgresTestBase;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcServerLockServiceTest extends PostgresTestBase {
    private static final String ACTION = "alerting migration";
    private static final Duration LEASE = Duration.ofMinutes(10);

    @Test
    void lockIsHeldOnlyWhileTheActionRuns() throws Exception {
        var locks = new JdbcServerLockService(dbClient, testClock);
        var runs = new AtomicInteger();

        locks.lockExecuteAndRelease(ACTION, LEASE, () -> {
            runs.incrementAndGet();
            try {
                assertEquals(1, count("SELECT COUNT(*) FROM server_lock WHERE operation_uid = ?", ACTION));
            } catch (SQLException e) {
                throw new IllegalStateException(e);
            }
        });
        locks.lockExecuteAndRelease(ACTION, LEASE, runs::incrementAndGet);

        assertEquals(2, runs.get());
        assertEquals(0, count("SELECT COUNT(*) FROM server_lock"));
    }

    @Test
    void heldLockIsNotEntered() throws Exception {
        var now = testClock.instant().getEpochSecond();
        dbClient.executeUpdate("INSERT INTO server_lock (operation_uid, version, last_execution) VALUES (?, 1, ?)",
            ACTION, now - 60);
        var locks = new JdbcServerLockService(dbClient, testClock);
        var runs = new AtomicInteger();

        assertThrows(ServerLockHeldException.class,
            () -> locks.lockExecuteAndRelease(ACTION, LEASE, runs::incrementAndGet));

        assertEquals(0, runs.get());
        assertEquals(1, count("SELECT COUNT(*) FROM server_lock"));
    }

    @Test
    void expiredLockIsTakenOver() throws Exception {
        var now = testClock.instant().getEpochSecond();
        dbClient.executeUpdate("INSERT INTO server_lock (operation_uid, version, last_execution) VALUES (?, 3, ?)",
            ACTION, now - LEASE.getSeconds() - 1);
        var locks = new JdbcServerLockService(dbClient, testClock);
        var runs = new AtomicInteger();

        locks.lockExecuteAndRelease(ACTION, LEASE, runs::incrementAndGet);

        assertEquals(1, runs.get());
        assertEquals(0, count("SELECT COUNT(*) FROM server_lock"));
    }

    @Test
    void lockTakenOverByAnotherProcessIsNotReleased() throws Exception {
        var locks = new JdbcServerLockService(dbClient, testClock);

        locks.lockExecuteAndRelease(ACTION, LEASE, () -> {
            try {
                dbClient.executeUpdate("UPDATE server_lock SET version = version + 1, last_execution = ? "
                    + "WHERE operation_uid = ?", testClock.instant().getEpochSecond() + 1, ACTION);
            } catch (SQLException e) {
                throw new IllegalStateException(e);
            }
        });

        assertEquals(1, count("SELECT COUNT(*) FROM server_lock WHERE operation_uid = ? AND version = 2", ACTION));
    }

    @Test
    void lockIsReleasedWhenTheActionFails() throws Exception {
        var locks = new JdbcServerLockService(dbClient, testClock);

        assertThrows(IllegalStateException.class, () -> locks.lockExecuteAndRelease(ACTION, LEASE, () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, count("SELECT COUNT(*) FROM server_lock"));
    }
}
