package org.alertingupgrade.migrations.notifier;

import org.alertingupgrade.migrations.common.MigrationException;

public class AlertmanagerConfigException extends MigrationException {
    public AlertmanagerConfigException(String message) {
        super(message);
    }

    public AlertmanagerConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
