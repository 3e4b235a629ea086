package org.alertingupgrade.migrations.store;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Optional;

import lombok.AllArgsConstructor;

@AllArgsConstructor
public class JdbcKvStore implements KvStore {
    private final DatabaseClient dbClient;
    private final Clock clock;

    @Override
    public Optional<String> get(long orgId, String namespace, String key) {
        try {
            return dbClient.executeQuery(
                "SELECT value FROM kv_store WHERE org_id = ? AND namespace = ? AND key = ?",
                rs -> rs.next() ? Optional.ofNullable(rs.getString("value")) : Optional.<String>empty(),
                orgId, namespace, key);
        } catch (SQLException e) {
            throw new MigrationStoreException("kv get " + namespace + "/" + key, e);
        }
    }

    @Override
    public void set(long orgId, String namespace, String key, String value) {
        var now = Timestamp.from(clock.instant());
        try {
            dbClient.executeUpdate(
                "INSERT INTO kv_store (org_id, namespace, key, value, created, updated) VALUES (?, ?, ?, ?, ?, ?) "
                    + "ON CONFLICT (org_id, namespace, key) DO UPDATE SET value = EXCLUDED.value, updated = EXCLUDED.updated",
                orgId, namespace, key, value, now, now);
        } catch (SQLException e) {
            throw new MigrationStoreException("kv set " + namespace + "/" + key, e);
        }
    }

    @Override
    public void deleteNamespace(long orgId, String namespace) {
        try {
            dbClient.executeUpdate("DELETE FROM kv_store WHERE org_id = ? AND namespace = ?", orgId, namespace);
        } catch (SQLException e) {
            throw new MigrationStoreException("kv delete " + namespace, e);
        }
    }
}
