package org.alertingupgrade.migrations.secrets;

import org.alertingupgrade.migrations.common.MigrationException;

public class EncryptionException extends MigrationException {
    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
