package org.alertingupgrade.migrations.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.alertingupgrade.migrations.legacy.LegacyAlert;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardUpgrade {
    @Builder.Default
    private List<AlertPair> migratedAlerts = new ArrayList<>();
    private long dashboardId;
    private String dashboardUid;
    private String dashboardName;
    private String folderUid;
    private String folderName;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String newFolderUid;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String newFolderName;
    private boolean provisioned;
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public static DashboardUpgrade forDashboard(long dashboardId) {
        return DashboardUpgrade.builder().dashboardId(dashboardId).build();
    }

    public AlertPair addAlert(LegacyAlert alert) {
        var pair = AlertPair.builder().legacyAlert(LegacyAlertSummary.from(alert)).build();
        migratedAlerts.add(pair);
        return pair;
    }

    /** Records the dashboard level error and the same error against each alert */
    public void setErrors(List<LegacyAlert> alerts, String error) {
        errors.add(error);
        addAlertErrors(alerts, error);
    }

    public void addAlertErrors(List<LegacyAlert> alerts, String error) {
        for (var alert : alerts) {
            addAlert(alert).setError(error);
        }
    }

    public Optional<AlertPair> popAlertPair(long panelId) {
        var existing = migratedAlerts.stream()
            .filter(p -> p.getLegacyAlert() != null && p.getLegacyAlert().getPanelId() == panelId)
            .findFirst();
        existing.ifPresent(migratedAlerts::remove);
        return existing;
    }

    public boolean hasNewFolder() {
        return newFolderUid != null && !newFolderUid.isEmpty() && !newFolderUid.equals(folderUid);
    }
}
