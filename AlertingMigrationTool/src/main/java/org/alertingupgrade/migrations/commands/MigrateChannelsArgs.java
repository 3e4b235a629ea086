package org.alertingupgrade.migrations.commands;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "migrate-channels", commandDescription = "Re-migrates every notification channel of an org")
public class MigrateChannelsArgs extends OrgArgs {
    @Parameter(names = {"--skip-existing" }, description = "Leave channels that were already migrated alone")
    public boolean skipExisting;
}
