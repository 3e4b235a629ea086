package org.alertingupgrade.migrations.commands;

import com.beust.jcommander.Parameters;

@Parameters(commandNames = "run",
    commandDescription = "Migrates or reverts all orgs depending on which alerting mode is enabled")
public class RunArgs extends CommandArgs {
}
