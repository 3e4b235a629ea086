package org.alertingupgrade.migrations.notifier;

import org.alertingupgrade.migrations.common.MigrationException;

public class ContactPointException extends MigrationException {
    public ContactPointException(String message) {
        super(message);
    }

    public ContactPointException(String message, Throwable cause) {
        super(message, cause);
    }
}
