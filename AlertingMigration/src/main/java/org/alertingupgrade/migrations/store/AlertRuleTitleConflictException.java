package org.alertingupgrade.migrations.store;

import org.alertingupgrade.migrations.common.MigrationException;

import lombok.Getter;

/** A rule with the same title already exists in the target folder */
public class AlertRuleTitleConflictException extends MigrationException {
    @Getter
    private final String title;

    public AlertRuleTitleConflictException(String title, String namespaceUid, Throwable cause) {
        super("alert rule title '" + title + "' already exists in folder " + namespaceUid, cause);
        this.title = title;
    }
}
