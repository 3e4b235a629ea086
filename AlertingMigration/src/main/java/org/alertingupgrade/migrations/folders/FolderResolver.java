package org.alertingupgrade.migrations.folders;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.alertingupgrade.migrations.common.MigrationException;
import org.alertingupgrade.migrations.legacy.Dashboard;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses the folder that receives a dashboard's rules.
 * <p>
 * Rules are readable by whoever can read their folder, while legacy alerts were readable by whoever could
 * read their dashboard. The dashboard's own folder is reused when both grant the same permissions. Otherwise
 * the rules go to a new folder carrying the dashboard's permissions, shared by all dashboards of the same
 * parent folder with the same permissions.
 * <p>
 * One instance per migration operation; it caches lookups and remembers the folders it created.
 */
@Slf4j
public class FolderResolver {
    public static final String GENERAL_ALERTING_FOLDER_TITLE = "General Alerting";
    public static final String ORIGINAL_FOLDER_NOT_FOUND_WARNING =
        "dashboard alerts moved to general alerting folder during upgrade: original folder not found";
    public static final String PERMISSION_CHANGES_WARNING =
        "dashboard alerts moved to new folder during upgrade: folder permission changes were needed";

    public static final List<ResourcePermission> DEFAULT_PERMISSIONS = List.of(
        ResourcePermission.forRole("Viewer", PermissionLevel.VIEW),
        ResourcePermission.forRole("Editor", PermissionLevel.EDIT)
    );

    private final long orgId;
    private final FolderService folderService;
    private final PermissionService permissionService;

    private final Map<Long, Optional<Folder>> foldersById = new HashMap<>();
    private final Map<String, List<ResourcePermission>> folderPermissionsByUid = new HashMap<>();
    /** parent folder id, then permission hash, to the folder created for that combination */
    private final Map<Long, Map<String, Folder>> permissionsMap = new HashMap<>();
    @Getter
    private final List<Folder> createdFolders = new ArrayList<>();
    private Folder generalAlertingFolder;

    public FolderResolver(long orgId, FolderService folderService, PermissionService permissionService) {
        this.orgId = orgId;
        this.folderService = folderService;
        this.permissionService = permissionService;
    }

    /**
     * @throws FolderResolutionException when a folder or permission lookup, or a folder creation, fails
     */
    public FolderResolution resolve(Dashboard dashboard) {
        try {
            return doResolve(dashboard);
        } catch (MigrationException | SecurityException e) {
            throw new FolderResolutionException(
                "failed to resolve alerting folder for dashboard " + dashboard.getUid() + ": " + e.getMessage(), e);
        }
    }

    private FolderResolution doResolve(Dashboard dashboard) {
        Folder legacyFolder = null;
        List<ResourcePermission> parentPermissions;
        if (dashboard.isInGeneralFolder()) {
            parentPermissions = DEFAULT_PERMISSIONS;
        } else {
            var folder = folderById(dashboard.getFolderId());
            if (folder.isEmpty()) {
                log.atWarn().setMessage("Folder {} of dashboard {} not found, using the {} folder")
                    .addArgument(dashboard.getFolderId())
                    .addArgument(dashboard.getUid())
                    .addArgument(GENERAL_ALERTING_FOLDER_TITLE)
                    .log();
                return FolderResolution.builder()
                    .targetFolder(generalAlertingFolder())
                    .warning(ORIGINAL_FOLDER_NOT_FOUND_WARNING)
                    .build();
            }
            legacyFolder = folder.get();
            parentPermissions = folderPermissions(legacyFolder);
        }

        var dashboardPermissions = dashboard.isHasAcl()
            ? permissionService.getAcl(orgId, dashboard.getId()).orElse(parentPermissions)
            : parentPermissions;

        var dashboardHash = PermissionHash.of(dashboardPermissions);
        if (dashboardHash.equals(PermissionHash.of(parentPermissions))) {
            return FolderResolution.builder()
                .legacyFolder(legacyFolder)
                .targetFolder(legacyFolder != null ? legacyFolder : generalAlertingFolder())
                .build();
        }

        var byHash = permissionsMap.computeIfAbsent(dashboard.getFolderId(), k -> new HashMap<>());
        var target = byHash.get(dashboardHash);
        if (target == null) {
            target = createPermissionFolder(dashboard, dashboardHash, dashboardPermissions);
            byHash.put(dashboardHash, target);
        }
        return FolderResolution.builder()
            .legacyFolder(legacyFolder)
            .targetFolder(target)
            .warning(PERMISSION_CHANGES_WARNING)
            .build();
    }

    private Folder createPermissionFolder(Dashboard dashboard, String hash, List<ResourcePermission> permissions) {
        var title = dashboard.getTitle() + " Alerts - " + hash;
        if (title.length() > Folder.MAX_TITLE_LENGTH) {
            title = title.substring(0, Folder.MAX_TITLE_LENGTH);
        }
        for (var existing : folderService.getFoldersByTitle(orgId, title)) {
            if (PermissionHash.of(folderPermissions(existing)).equals(hash)) {
                log.debug("Reusing folder '{}' ({}) for the alerts of dashboard {}", title, existing.getUid(),
                    dashboard.getUid());
                return existing;
            }
            log.atWarn().setMessage("Folder '{}' ({}) no longer has the permissions of dashboard {}, not reusing it")
                .addArgument(title)
                .addArgument(existing.getUid())
                .addArgument(dashboard.getUid())
                .log();
        }
        var folder = folderService.createFolder(orgId, title);
        permissionService.setAcl(orgId, folder.getId(), permissions);
        folderPermissionsByUid.put(folder.getUid(), permissions);
        createdFolders.add(folder);
        log.info("Created folder '{}' ({}) for the alerts of dashboard {}", folder.getTitle(), folder.getUid(),
            dashboard.getUid());
        return folder;
    }

    private Folder generalAlertingFolder() {
        if (generalAlertingFolder == null) {
            var existing = folderService.getFolderByTitle(orgId, GENERAL_ALERTING_FOLDER_TITLE);
            if (existing.isPresent()) {
                generalAlertingFolder = existing.get();
            } else {
                generalAlertingFolder = folderService.createFolder(orgId, GENERAL_ALERTING_FOLDER_TITLE);
                createdFolders.add(generalAlertingFolder);
                log.info("Created folder '{}' ({})", GENERAL_ALERTING_FOLDER_TITLE, generalAlertingFolder.getUid());
            }
        }
        return generalAlertingFolder;
    }

    private Optional<Folder> folderById(long folderId) {
        return foldersById.computeIfAbsent(folderId, id -> folderService.getFolderById(orgId, id));
    }

    private List<ResourcePermission> folderPermissions(Folder folder) {
        return folderPermissionsByUid.computeIfAbsent(folder.getUid(),
            uid -> permissionService.getAcl(orgId, folder.getId()).orElse(DEFAULT_PERMISSIONS));
    }
}
