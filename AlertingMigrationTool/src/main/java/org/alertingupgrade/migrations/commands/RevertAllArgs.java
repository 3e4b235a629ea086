package org.alertingupgrade.migrations.commands;

import com.beust.jcommander.Parameters;

@Parameters(commandNames = "revert-all", commandDescription = "Deletes the unified alerting data of every org")
public class RevertAllArgs extends CommandArgs {
}
