package org.alertingupgrade.migrations.folders;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.alertingupgrade.migrations.store.DatabaseClient;
import org.alertingupgrade.migrations.store.MigrationStoreException;

import lombok.AllArgsConstructor;

/** ACL entries live in {@code dashboard_acl}; {@code dashboard.has_acl} says whether they apply */
@AllArgsConstructor
public class JdbcPermissionService implements PermissionService {
    private final DatabaseClient dbClient;
    private final Clock clock;

    @Override
    public Optional<List<ResourcePermission>> getAcl(long orgId, long resourceId) {
        try {
            boolean hasAcl = dbClient.executeQuery(
                "SELECT has_acl FROM dashboard WHERE org_id = ? AND id = ?",
                rs -> rs.next() && rs.getBoolean("has_acl"),
                orgId, resourceId);
            if (!hasAcl) {
                return Optional.empty();
            }
            return Optional.of(dbClient.executeQuery(
                "SELECT user_id, team_id, role, permission FROM dashboard_acl WHERE org_id = ? AND dashboard_id = ? "
                    + "ORDER BY id",
                rs -> {
                    var permissions = new ArrayList<ResourcePermission>();
                    while (rs.next()) {
                        long userId = rs.getLong("user_id");
                        boolean hasUser = !rs.wasNull() && userId != 0;
                        long teamId = rs.getLong("team_id");
                        boolean hasTeam = !rs.wasNull() && teamId != 0;
                        permissions.add(ResourcePermission.builder()
                            .userId(hasUser ? userId : null)
                            .teamId(hasTeam ? teamId : null)
                            .role(rs.getString("role"))
                            .permission(PermissionLevel.fromValue(rs.getInt("permission")))
                            .build());
                    }
                    return permissions;
                },
                orgId, resourceId));
        } catch (SQLException e) {
            throw new MigrationStoreException("getAcl", e);
        }
    }

    @Override
    public void setAcl(long orgId, long resourceId, List<ResourcePermission> permissions) {
        var now = Timestamp.from(clock.instant());
        try {
            dbClient.executeUpdate("DELETE FROM dashboard_acl WHERE org_id = ? AND dashboard_id = ?", orgId, resourceId);
            for (var permission : permissions) {
                dbClient.executeUpdate(
                    "INSERT INTO dashboard_acl (org_id, dashboard_id, user_id, team_id, role, permission, created, updated) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                    orgId, resourceId, permission.getUserId(), permission.getTeamId(), permission.getRole(),
                    permission.getPermission().getValue(), now, now);
            }
            dbClient.executeUpdate("UPDATE dashboard SET has_acl = TRUE WHERE org_id = ? AND id = ?", orgId, resourceId);
        } catch (SQLException e) {
            throw new MigrationStoreException("setAcl", e);
        }
    }
}
