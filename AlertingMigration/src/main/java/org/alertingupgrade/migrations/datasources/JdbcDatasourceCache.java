package org.alertingupgrade.migrations.datasources;

import java.sql.SQLException;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

import org.alertingupgrade.migrations.store.DatabaseClient;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;

public class JdbcDatasourceCache implements DatasourceCache {
    static final long MAX_ENTRIES = 10_000;

    private final DatabaseClient dbClient;
    private final LoadingCache<DatasourceKey, Optional<Datasource>> cache;

    public JdbcDatasourceCache(DatabaseClient dbClient) {
        this.dbClient = dbClient;
        this.cache = CacheBuilder.newBuilder()
            .maximumSize(MAX_ENTRIES)
            .build(new CacheLoader<>() {
                @Override
                public Optional<Datasource> load(DatasourceKey key) throws SQLException {
                    return loadDatasource(key);
                }
            });
    }

    @Override
    public Datasource getDatasource(long orgId, long datasourceId) {
        try {
            return cache.get(new DatasourceKey(orgId, datasourceId))
                .orElseThrow(() -> new DatasourceNotFoundException(orgId, datasourceId));
        } catch (ExecutionException | UncheckedExecutionException e) {
            throw new DatasourceNotFoundException(orgId, datasourceId, e.getCause());
        }
    }

    private Optional<Datasource> loadDatasource(DatasourceKey key) throws SQLException {
        return dbClient.executeQuery(
            "SELECT id, org_id, uid, type, name FROM data_source WHERE org_id = ? AND id = ?",
            rs -> rs.next()
                ? Optional.of(Datasource.builder()
                    .id(rs.getLong("id"))
                    .orgId(rs.getLong("org_id"))
                    .uid(rs.getString("uid"))
                    .type(rs.getString("type"))
                    .name(rs.getString("name"))
                    .build())
                : Optional.<Datasource>empty(),
            key.orgId(), key.datasourceId());
    }

    private record DatasourceKey(long orgId, long datasourceId) {}
}
