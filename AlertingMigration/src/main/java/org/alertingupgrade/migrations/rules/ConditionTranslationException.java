package org.alertingupgrade.migrations.rules;

import org.alertingupgrade.migrations.common.MigrationException;

public class ConditionTranslationException extends MigrationException {
    public ConditionTranslationException(String message) {
        super(message);
    }

    public ConditionTranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
