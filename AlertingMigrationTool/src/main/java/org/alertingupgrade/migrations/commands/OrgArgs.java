package org.alertingupgrade.migrations.commands;

import com.beust.jcommander.Parameter;

public abstract class OrgArgs extends CommandArgs {
    @Parameter(names = {"--org-id" }, required = true, description = "Id of the org to work on")
    public long orgId;
}
