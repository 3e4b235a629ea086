package org.alertingupgrade.migrations.commands;

import java.util.ArrayList;
import java.util.List;

import org.alertingupgrade.migrations.cli.Format;
import org.alertingupgrade.migrations.cli.LedgerFormat;
import org.alertingupgrade.migrations.ledger.OrgMigrationState;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;

/** The ledger of one org, as produced by migrate-org or read by summary */
@Builder
public class OrgSummaryResult implements MigrationItemResult {
    @Getter
    private final OrgMigrationState summary;
    @Getter
    private final String errorMessage;
    private final int exitCode;

    public int getExitCode() {
        return MigrationItemResult.exitCode(exitCode, errorMessage, collectErrors());
    }

    @Override
    public List<String> collectErrors() {
        var errors = new ArrayList<String>();
        if (summary == null) {
            return errors;
        }
        errors.addAll(summary.getErrors());
        summary.getMigratedDashboards().forEach(du -> errors.addAll(LedgerFormat.errors(du)));
        summary.getMigratedChannels().forEach(pair -> errors.addAll(LedgerFormat.errors(pair)));
        return errors;
    }

    @Override
    public String itemsAsCliOutput() {
        if (summary == null) {
            return "";
        }
        var sb = new StringBuilder();
        sb.append("Org ").append(summary.getOrgId()).append(":").append(System.lineSeparator());
        sb.append(Format.indentToLevel(1)).append("Dashboards: ").append(summary.getMigratedDashboards().size())
            .append(System.lineSeparator());
        summary.getMigratedDashboards().forEach(du -> sb.append(LedgerFormat.dashboard(du, 2)));
        sb.append(Format.indentToLevel(1)).append("Channels: ").append(summary.getMigratedChannels().size())
            .append(System.lineSeparator());
        summary.getMigratedChannels().forEach(pair -> sb.append(LedgerFormat.channel(pair, 2)));
        sb.append(Format.indentToLevel(1)).append("Created folders: ");
        sb.append(summary.getCreatedFolders().isEmpty() ? "<none>" : String.join(", ", summary.getCreatedFolders()));
        sb.append(System.lineSeparator());
        return sb.toString();
    }

    @Override
    public JsonNode itemsAsJson() {
        return summary == null ? null : MAPPER.valueToTree(summary);
    }

    @Override
    public String itemsJsonName() {
        return "summary";
    }
}
