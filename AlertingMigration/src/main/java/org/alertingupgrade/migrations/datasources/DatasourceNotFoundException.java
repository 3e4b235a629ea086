package org.alertingupgrade.migrations.datasources;

import org.alertingupgrade.migrations.common.MigrationException;

public class DatasourceNotFoundException extends MigrationException {
    public DatasourceNotFoundException(long orgId, long datasourceId) {
        super("datasource " + datasourceId + " not found in org " + orgId);
    }

    public DatasourceNotFoundException(long orgId, long datasourceId, Throwable cause) {
        super("failed to look up datasource " + datasourceId + " in org " + orgId, cause);
    }
}
