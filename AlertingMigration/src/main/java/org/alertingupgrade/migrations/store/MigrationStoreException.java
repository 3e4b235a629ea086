package org.alertingupgrade.migrations.store;

import org.alertingupgrade.migrations.common.MigrationException;

public class MigrationStoreException extends MigrationException {
    public MigrationStoreException(String operation, Throwable cause) {
        super(String.format("Store operation '%s' failed: %s", operation, cause.getMessage()), cause);
    }
}
