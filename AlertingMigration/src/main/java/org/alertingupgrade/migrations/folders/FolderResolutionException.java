package org.alertingupgrade.migrations.folders;

import org.alertingupgrade.migrations.common.MigrationException;

public class FolderResolutionException extends MigrationException {
    public FolderResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
