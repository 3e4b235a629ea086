package org.alertingupgrade.migrations.service;

import org.alertingupgrade.migrations.common.MigrationException;

/** Rolling back to legacy alerting deletes unified alerting data, so it needs an explicit opt-in */
public class ForceMigrationRequiredException extends MigrationException {
    public static final String MESSAGE = "Grafana has already been migrated to Unified Alerting. Any alert rules "
        + "created while using Unified Alerting will be deleted by rolling back. Set force_migration=true in your "
        + "grafana.ini and restart Grafana to roll back and delete Unified Alerting configuration data.";

    public ForceMigrationRequiredException() {
        super(MESSAGE);
    }
}
