package org.alertingupgrade.migrations.cli;

import java.util.ArrayList;
import java.util.List;

import org.alertingupgrade.migrations.ledger.ContactPair;
import org.alertingupgrade.migrations.ledger.DashboardUpgrade;

import lombok.experimental.UtilityClass;

/** Console rendering and error collection for ledger entries */
@UtilityClass
public class LedgerFormat {

    public static String dashboard(DashboardUpgrade du, int level) {
        var sb = new StringBuilder();
        var name = du.getDashboardName() == null ? "<unknown>" : du.getDashboardName();
        sb.append(Format.indentToLevel(level)).append("Dashboard '").append(name).append("' (id ")
            .append(du.getDashboardId());
        if (du.getDashboardUid() != null) {
            sb.append(", uid ").append(du.getDashboardUid());
        }
        sb.append(")");
        if (du.getNewFolderUid() != null) {
            sb.append(" -> folder '").append(du.getNewFolderName()).append("'");
        }
        if (du.isProvisioned()) {
            sb.append(" [provisioned]");
        }
        sb.append(System.lineSeparator());
        for (var warning : du.getWarnings()) {
            sb.append(Format.indentToLevel(level + 1)).append("Warning: ").append(warning)
                .append(System.lineSeparator());
        }
        for (var error : du.getErrors()) {
            sb.append(Format.indentToLevel(level + 1)).append("ERROR: ").append(error)
                .append(System.lineSeparator());
        }
        for (var pair : du.getMigratedAlerts()) {
            var legacy = pair.getLegacyAlert();
            sb.append(Format.indentToLevel(level + 1)).append("Alert '").append(legacy.getName())
                .append("' (panel ").append(legacy.getPanelId()).append("): ");
            if (pair.getError() != null) {
                sb.append("ERROR: ").append(pair.getError());
            } else if (pair.getAlertRule() != null) {
                sb.append("rule '").append(pair.getAlertRule().getTitle()).append("' (uid ")
                    .append(pair.getAlertRule().getUid()).append(")");
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }

    public static String channel(ContactPair pair, int level) {
        var sb = new StringBuilder();
        var legacy = pair.getLegacyChannel();
        sb.append(Format.indentToLevel(level)).append("Channel '").append(legacy.getName()).append("' (")
            .append(legacy.getType()).append(", uid ").append(legacy.getUid()).append("): ");
        if (pair.getError() != null) {
            sb.append("ERROR: ").append(pair.getError());
        } else if (pair.getContactPoint() != null) {
            sb.append("contact point '").append(pair.getContactPoint().getName()).append("'");
        }
        sb.append(System.lineSeparator());
        return sb.toString();
    }

    public static List<String> errors(DashboardUpgrade du) {
        var errors = new ArrayList<String>();
        var name = du.getDashboardUid() == null ? Long.toString(du.getDashboardId()) : du.getDashboardUid();
        du.getErrors().forEach(e -> errors.add("dashboard " + name + ": " + e));
        du.getMigratedAlerts().stream()
            .filter(p -> p.getError() != null)
            .forEach(p -> errors.add("dashboard " + name + ", panel " + p.getLegacyAlert().getPanelId() + ": "
                + p.getError()));
        return errors;
    }

    public static List<String> errors(ContactPair pair) {
        if (pair.getError() == null) {
            return List.of();
        }
        return List.of("channel " + pair.getLegacyChannel().getUid() + ": " + pair.getError());
    }
}
