package org.alertingupgrade.migrations.commands;

import org.alertingupgrade.migrations.cli.OutputFormat;

import com.beust.jcommander.Parameter;

public abstract class CommandArgs {
    @Parameter(names = {"--help", "-h"}, help = true, description = "Displays information about how to use this tool")
    public boolean help;

    @Parameter(names = {"--output" }, converter = OutputFormat.OutputFormatConverter.class,
        description = "Output format: human_readable or json. Default: human_readable")
    public OutputFormat outputFormat = OutputFormat.HUMAN_READABLE;
}
