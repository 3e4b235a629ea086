package org.alertingupgrade.migrations.lock;

import org.alertingupgrade.migrations.common.MigrationException;

public class ServerLockHeldException extends MigrationException {
    public ServerLockHeldException(String actionName) {
        super("server lock for '" + actionName + "' is held by another process");
    }
}
