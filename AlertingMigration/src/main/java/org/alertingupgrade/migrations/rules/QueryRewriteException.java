package org.alertingupgrade.migrations.rules;

import org.alertingupgrade.migrations.common.MigrationException;

public class QueryRewriteException extends MigrationException {
    public QueryRewriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
