package org.alertingupgrade.migrations.datasources;

/** Resolves the numeric datasource ids legacy conditions carry */
public interface DatasourceCache {
    /**
     * @throws DatasourceNotFoundException when no datasource with this id exists in the org
     */
    Datasource getDatasource(long orgId, long datasourceId);
}
