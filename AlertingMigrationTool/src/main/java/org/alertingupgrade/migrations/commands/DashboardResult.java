package org.alertingupgrade.migrations.commands;

import java.util.List;

import org.alertingupgrade.migrations.cli.LedgerFormat;
import org.alertingupgrade.migrations.ledger.DashboardUpgrade;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;

/** Ledger entry of one dashboard after migrate-dashboard or migrate-alert */
@Builder
public class DashboardResult implements MigrationItemResult {
    @Getter
    private final DashboardUpgrade dashboard;
    @Getter
    private final String errorMessage;
    private final int exitCode;

    public int getExitCode() {
        return MigrationItemResult.exitCode(exitCode, errorMessage, collectErrors());
    }

    @Override
    public List<String> collectErrors() {
        return dashboard == null ? List.of() : LedgerFormat.errors(dashboard);
    }

    @Override
    public String itemsAsCliOutput() {
        return dashboard == null ? "" : LedgerFormat.dashboard(dashboard, 0);
    }

    @Override
    public JsonNode itemsAsJson() {
        return dashboard == null ? null : MAPPER.valueToTree(dashboard);
    }

    @Override
    public String itemsJsonName() {
        return "dashboard";
    }
}
