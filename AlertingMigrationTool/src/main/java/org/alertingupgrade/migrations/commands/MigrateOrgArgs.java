package org.alertingupgrade.migrations.commands;

import com.beust.jcommander.Parameters;

@Parameters(commandNames = "migrate-org", commandDescription = "Migrates every dashboard alert and notification channel of an org")
public class MigrateOrgArgs extends OrgArgs {
}
