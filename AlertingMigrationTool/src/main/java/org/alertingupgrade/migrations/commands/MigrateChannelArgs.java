package org.alertingupgrade.migrations.commands;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "migrate-channel", commandDescription = "Re-migrates one notification channel")
public class MigrateChannelArgs extends OrgArgs {
    @Parameter(names = {"--channel-id" }, required = true, description = "Id of the notification channel")
    public long channelId;
}
