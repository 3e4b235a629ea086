package org.alertingupgrade.migrations.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything a migration created for one org. Read at the start of every operation and written back at its end;
 * revert only removes folders listed in {@link #createdFolders}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrgMigrationState {
    private long orgId;
    @Builder.Default
    private List<DashboardUpgrade> migratedDashboards = new ArrayList<>();
    @Builder.Default
    private List<ContactPair> migratedChannels = new ArrayList<>();
    @Builder.Default
    private List<String> createdFolders = new ArrayList<>();
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static OrgMigrationState empty(long orgId) {
        return OrgMigrationState.builder().orgId(orgId).build();
    }

    public Optional<DashboardUpgrade> getDashboardUpgrade(long dashboardId) {
        return migratedDashboards.stream().filter(du -> du.getDashboardId() == dashboardId).findFirst();
    }

    /** Removes and returns the entry of the dashboard */
    public Optional<DashboardUpgrade> popDashboardUpgrade(long dashboardId) {
        var existing = getDashboardUpgrade(dashboardId);
        existing.ifPresent(migratedDashboards::remove);
        return existing;
    }

    public Optional<ContactPair> getContactPair(long channelId) {
        return migratedChannels.stream()
            .filter(p -> p.getLegacyChannel() != null && p.getLegacyChannel().getId() == channelId)
            .findFirst();
    }

    /** Removes and returns the entry of the channel */
    public Optional<ContactPair> popContactPair(long channelId) {
        var existing = getContactPair(channelId);
        existing.ifPresent(migratedChannels::remove);
        return existing;
    }

    /** Whether any other dashboard entry still puts its rules in this folder */
    public boolean isFolderInUse(String folderUid) {
        return migratedDashboards.stream().anyMatch(du -> folderUid.equals(du.getNewFolderUid()));
    }

    /** Top-level errors plus every dashboard, alert and channel error */
    public int countErrors() {
        int count = errors.size();
        for (var du : migratedDashboards) {
            count += du.getErrors().size();
            count += (int) du.getMigratedAlerts().stream().filter(p -> p.getError() != null).count();
        }
        count += (int) migratedChannels.stream().filter(p -> p.getError() != null).count();
        return count;
    }
}
