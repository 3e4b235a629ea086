package org.alertingupgrade.migrations.commands;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "migrate-dashboard", commandDescription = "Re-migrates the alerts of one dashboard")
public class MigrateDashboardArgs extends OrgArgs {
    @Parameter(names = {"--dashboard-id" }, required = true, description = "Id of the dashboard")
    public long dashboardId;

    @Parameter(names = {"--skip-existing" }, description = "Leave the dashboard alone when it was already migrated")
    public boolean skipExisting;
}
