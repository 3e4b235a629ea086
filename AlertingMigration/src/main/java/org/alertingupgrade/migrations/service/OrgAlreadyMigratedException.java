package org.alertingupgrade.migrations.service;

import org.alertingupgrade.migrations.common.MigrationException;

import lombok.Getter;

public class OrgAlreadyMigratedException extends MigrationException {
    @Getter
    private final long orgId;

    public OrgAlreadyMigratedException(long orgId) {
        super("organization has already been migrated");
        this.orgId = orgId;
    }
}
