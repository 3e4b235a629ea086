package org.alertingupgrade.migrations.folders;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.alertingupgrade.migrations.common.ShortUid;
import org.alertingupgrade.migrations.store.DatabaseClient;
import org.alertingupgrade.migrations.store.MigrationStoreException;

import lombok.extern.slf4j.Slf4j;

/** Folders are {@code dashboard} rows flagged {@code is_folder} */
@Slf4j
public class JdbcFolderService implements FolderService {
    private static final String FOLDER_COLUMNS = "id, org_id, uid, title, folder_uid";

    private final DatabaseClient dbClient;
    private final Clock clock;
    private final Supplier<String> uidSupplier;

    public JdbcFolderService(DatabaseClient dbClient, Clock clock) {
        this(dbClient, clock, ShortUid::generate);
    }

    public JdbcFolderService(DatabaseClient dbClient, Clock clock, Supplier<String> uidSupplier) {
        this.dbClient = dbClient;
        this.clock = clock;
        this.uidSupplier = uidSupplier;
    }

    @Override
    public Optional<Folder> getFolderById(long orgId, long folderId) {
        return findOne("getFolderById",
            "SELECT " + FOLDER_COLUMNS + " FROM dashboard WHERE org_id = ? AND id = ? AND is_folder = TRUE",
            orgId, folderId);
    }

    @Override
    public Optional<Folder> getFolderByUid(long orgId, String uid) {
        return findOne("getFolderByUid",
            "SELECT " + FOLDER_COLUMNS + " FROM dashboard WHERE org_id = ? AND uid = ? AND is_folder = TRUE",
            orgId, uid);
    }

    @Override
    public Optional<Folder> getFolderByTitle(long orgId, String title) {
        return findOne("getFolderByTitle",
            "SELECT " + FOLDER_COLUMNS + " FROM dashboard WHERE org_id = ? AND title = ? AND is_folder = TRUE "
                + "AND folder_uid IS NULL ORDER BY id LIMIT 1",
            orgId, title);
    }

    @Override
    public List<Folder> getFoldersByTitle(long orgId, String title) {
        try {
            return dbClient.executeQuery(
                "SELECT " + FOLDER_COLUMNS + " FROM dashboard WHERE org_id = ? AND title = ? AND is_folder = TRUE "
                    + "AND folder_uid IS NULL ORDER BY id",
                rs -> {
                    var folders = new ArrayList<Folder>();
                    for (var folder = readFolder(rs); folder.isPresent(); folder = readFolder(rs)) {
                        folders.add(folder.get());
                    }
                    return folders;
                },
                orgId, title);
        } catch (SQLException e) {
            throw new MigrationStoreException("getFoldersByTitle", e);
        }
    }

    @Override
    public Folder createFolder(long orgId, String title) {
        var uid = uidSupplier.get();
        var now = Timestamp.from(clock.instant());
        try {
            long id = dbClient.executeQuery(
                "INSERT INTO dashboard (org_id, uid, title, folder_id, is_folder, has_acl, created, updated) "
                    + "VALUES (?, ?, ?, 0, TRUE, FALSE, ?, ?) RETURNING id",
                rs -> {
                    rs.next();
                    return rs.getLong(1);
                },
                orgId, uid, title, now, now);
            log.debug("Created folder {} with id {} in org {}", uid, id, orgId);
            return Folder.builder().id(id).orgId(orgId).uid(uid).title(title).build();
        } catch (SQLException e) {
            throw new MigrationStoreException("createFolder", e);
        }
    }

    @Override
    public void deleteFolder(ServiceIdentity identity, long orgId, String uid) {
        if (!identity.can(ServiceIdentity.FOLDERS_DELETE)) {
            throw new SecurityException(identity.getName() + " is not allowed to delete folders");
        }
        try {
            dbClient.executeUpdate("DELETE FROM dashboard_acl WHERE org_id = ? AND dashboard_id IN "
                + "(SELECT id FROM dashboard WHERE org_id = ? AND uid = ? AND is_folder = TRUE)", orgId, orgId, uid);
            dbClient.executeUpdate("DELETE FROM dashboard WHERE org_id = ? AND uid = ? AND is_folder = TRUE",
                orgId, uid);
        } catch (SQLException e) {
            throw new MigrationStoreException("deleteFolder", e);
        }
    }

    private Optional<Folder> findOne(String operation, String sql, Object... params) {
        try {
            return dbClient.executeQuery(sql, JdbcFolderService::readFolder, params);
        } catch (SQLException e) {
            throw new MigrationStoreException(operation, e);
        }
    }

    private static Optional<Folder> readFolder(ResultSet rs) throws SQLException {
        if (!rs.next()) {
            return Optional.empty();
        }
        return Optional.of(Folder.builder()
            .id(rs.getLong("id"))
            .orgId(rs.getLong("org_id"))
            .uid(rs.getString("uid"))
            .title(rs.getString("title"))
            .parentUid(rs.getString("folder_uid"))
            .build());
    }
}
