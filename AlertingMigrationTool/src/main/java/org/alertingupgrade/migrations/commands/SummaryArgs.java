package org.alertingupgrade.migrations.commands;

import com.beust.jcommander.Parameters;

@Parameters(commandNames = "summary", commandDescription = "Prints the stored migration summary of an org")
public class SummaryArgs extends OrgArgs {
}
