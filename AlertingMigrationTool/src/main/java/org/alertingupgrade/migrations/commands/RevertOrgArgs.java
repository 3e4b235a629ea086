package org.alertingupgrade.migrations.commands;

import com.beust.jcommander.Parameters;

@Parameters(commandNames = "revert-org", commandDescription = "Deletes the unified alerting data of an org, including folders the migration created")
public class RevertOrgArgs extends OrgArgs {
}
