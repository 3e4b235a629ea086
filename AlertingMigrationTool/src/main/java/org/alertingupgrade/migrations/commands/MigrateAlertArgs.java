package org.alertingupgrade.migrations.commands;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "migrate-alert", commandDescription = "Re-migrates the alert of one dashboard panel")
public class MigrateAlertArgs extends OrgArgs {
    @Parameter(names = {"--dashboard-id" }, required = true, description = "Id of the dashboard")
    public long dashboardId;

    @Parameter(names = {"--panel-id" }, required = true, description = "Id of the panel holding the alert")
    public long panelId;
}
