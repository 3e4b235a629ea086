package org.alertingupgrade.migrations.folders;

import java.util.List;

import org.alertingupgrade.migrations.legacy.Dashboard;
import org.alertingupgrade.migrations.testutils.InMemoryFolderService;
import org.alertingupgrade.migrations.testutils.InMemoryPermissionService;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FolderResolverTest {
    private static final long ORG = 1;
    private static final List<ResourcePermission> ADMIN_ONLY =
        List.of(ResourcePermission.forRole("Admin", PermissionLevel.ADMIN));

    private InMemoryFolderService folders;
    private InMemoryPermissionService permissions;
    private FolderResolver resolver;

    @BeforeEach
    void setUp() {
        folders = new InMemoryFolderService();
        permissions = new InMemoryPermissionService();
        folders.addFolder(20, ORG, "ops", "Ops");
        resolver = new FolderResolver(ORG, folders, permissions);
    }

    private static Dashboard.DashboardBuilder dashboard(long id, long folderId) {
        return Dashboard.builder().id(id).orgId(ORG).uid("dash-" + id).title("Dash " + id).folderId(folderId);
    }

    @Test
    void dashboardInheritingItsFolderKeepsIt() {
        var resolution = resolver.resolve(dashboard(1, 20).build());
        assertThat(resolution.getTargetFolder().getUid(), equalTo("ops"));
        assertThat(resolution.getLegacyFolder().getUid(), equalTo("ops"));
        assertThat(resolution.getWarning(), nullValue());
        assertThat(resolver.getCreatedFolders(), empty());
    }

    @Test
    void generalLevelDashboardGoesToGeneralAlerting() {
        var resolution = resolver.resolve(dashboard(1, Dashboard.GENERAL_FOLDER_ID).build());
        assertThat(resolution.getTargetFolder().getTitle(), equalTo(FolderResolver.GENERAL_ALERTING_FOLDER_TITLE));
        assertThat(resolution.getLegacyFolder(), nullValue());
        assertThat(resolver.getCreatedFolders(), hasSize(1));

        // created once and reused
        var again = resolver.resolve(dashboard(2, Dashboard.GENERAL_FOLDER_ID).build());
        assertThat(again.getTargetFolder(), sameInstance(resolution.getTargetFolder()));
        assertThat(resolver.getCreatedFolders(), hasSize(1));
    }

    @Test
    void existingGeneralAlertingFolderIsReusedButNotClaimed() {
        folders.addFolder(30, ORG, "ga", FolderResolver.GENERAL_ALERTING_FOLDER_TITLE);
        var resolution = resolver.resolve(dashboard(1, Dashboard.GENERAL_FOLDER_ID).build());
        assertThat(resolution.getTargetFolder().getUid(), equalTo("ga"));
        assertThat(resolver.getCreatedFolders(), empty());
    }

    @Test
    void missingFolderFallsBackWithWarning() {
        var resolution = resolver.resolve(dashboard(1, 999).build());
        assertThat(resolution.getTargetFolder().getTitle(), equalTo(FolderResolver.GENERAL_ALERTING_FOLDER_TITLE));
        assertThat(resolution.getWarning(), equalTo(FolderResolver.ORIGINAL_FOLDER_NOT_FOUND_WARNING));
    }

    @Test
    void divergingAclGetsSharedPermissionFolder() {
        permissions.setAcl(ORG, 1, ADMIN_ONLY);
        permissions.setAcl(ORG, 2, ADMIN_ONLY);

        var first = resolver.resolve(dashboard(1, 20).hasAcl(true).build());
        var second = resolver.resolve(dashboard(2, 20).hasAcl(true).build());

        var hash = PermissionHash.of(ADMIN_ONLY);
        assertThat(first.getTargetFolder().getTitle(), equalTo("Dash 1 Alerts - " + hash));
        assertThat(first.getLegacyFolder().getUid(), equalTo("ops"));
        assertThat(first.getWarning(), equalTo(FolderResolver.PERMISSION_CHANGES_WARNING));
        assertThat(second.getTargetFolder().getUid(), equalTo(first.getTargetFolder().getUid()));
        assertThat(resolver.getCreatedFolders(), hasSize(1));
        assertThat(permissions.getAcl(ORG, first.getTargetFolder().getId()).orElseThrow(), equalTo(ADMIN_ONLY));
    }

    @Test
    void sameAclUnderAnotherParentGetsAnotherFolder() {
        folders.addFolder(21, ORG, "dev", "Dev");
        permissions.setAcl(ORG, 1, ADMIN_ONLY);
        permissions.setAcl(ORG, 2, ADMIN_ONLY);

        var first = resolver.resolve(dashboard(1, 20).hasAcl(true).build());
        var second = resolver.resolve(dashboard(2, 21).hasAcl(true).build());

        assertThat(second.getTargetFolder().getUid(), not(equalTo(first.getTargetFolder().getUid())));
    }

    @Test
    void existingPermissionFolderIsReusedWhenItsAclMatches() {
        var hash = PermissionHash.of(ADMIN_ONLY);
        var existing = folders.addFolder(40, ORG, "perm", "Dash 1 Alerts - " + hash);
        permissions.setAcl(ORG, existing.getId(), ADMIN_ONLY);
        permissions.setAcl(ORG, 1, ADMIN_ONLY);

        var resolution = resolver.resolve(dashboard(1, 20).hasAcl(true).build());

        assertThat(resolution.getTargetFolder().getUid(), equalTo("perm"));
        assertThat(resolver.getCreatedFolders(), empty());
    }

    @Test
    void permissionFolderWithChangedAclIsNotReused() {
        var hash = PermissionHash.of(ADMIN_ONLY);
        var stale = folders.addFolder(40, ORG, "stale", "Dash 1 Alerts - " + hash);
        permissions.setAcl(ORG, stale.getId(), List.of(ResourcePermission.forRole("Viewer", PermissionLevel.EDIT)));
        permissions.setAcl(ORG, 1, ADMIN_ONLY);

        var resolution = resolver.resolve(dashboard(1, 20).hasAcl(true).build());

        assertThat(resolution.getTargetFolder().getUid(), not(equalTo("stale")));
        assertThat(resolution.getTargetFolder().getTitle(), equalTo("Dash 1 Alerts - " + hash));
        assertThat(resolver.getCreatedFolders(), hasSize(1));
        assertThat(permissions.getAcl(ORG, resolution.getTargetFolder().getId()).orElseThrow(), equalTo(ADMIN_ONLY));
    }

    @Test
    void aclEqualToParentKeepsParent() {
        permissions.setAcl(ORG, 20, ADMIN_ONLY);
        permissions.setAcl(ORG, 1, ADMIN_ONLY);
        var resolution = resolver.resolve(dashboard(1, 20).hasAcl(true).build());
        assertThat(resolution.getTargetFolder().getUid(), equalTo("ops"));
    }

    @Test
    void longTitlesAreTruncated() {
        permissions.setAcl(ORG, 1, ADMIN_ONLY);
        var resolution = resolver.resolve(dashboard(1, 20).title("t".repeat(400)).hasAcl(true).build());
        assertThat(resolution.getTargetFolder().getTitle().length(), equalTo(Folder.MAX_TITLE_LENGTH));
        assertThat(resolution.getTargetFolder().getTitle(), startsWith("ttt"));
    }

    @Test
    void lookupFailuresAreWrapped() {
        var failing = mock(FolderService.class);
        when(failing.getFolderById(anyLong(), anyLong())).thenThrow(new SecurityException("denied"));
        when(failing.getFolderByTitle(anyLong(), anyString())).thenThrow(new SecurityException("denied"));
        var failingResolver = new FolderResolver(ORG, failing, permissions);
        var e = assertThrows(FolderResolutionException.class, () -> failingResolver.resolve(dashboard(1, 20).build()));
        assertThat(e.getMessage(), startsWith("failed to resolve alerting folder for dashboard dash-1"));
    }
}
