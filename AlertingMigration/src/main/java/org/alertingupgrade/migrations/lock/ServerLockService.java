package org.alertingupgrade.migrations.lock;

import java.time.Duration;

/** A lock shared by every process using the same database */
public interface ServerLockService {
    /**
     * Runs {@code action} while holding the named lock, then releases it. A lock whose lease has expired may be
     * taken over.
     *
     * @throws ServerLockHeldException when another holder's lease is still valid; {@code action} did not run
     */
    void lockExecuteAndRelease(String actionName, Duration lease, Runnable action);
}
