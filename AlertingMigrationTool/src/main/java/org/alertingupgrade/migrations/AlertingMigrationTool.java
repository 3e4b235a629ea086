package org.alertingupgrade.migrations;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.alertingupgrade.migrations.arguments.ArgLogUtils;
import org.alertingupgrade.migrations.arguments.ArgNameConstants;
import org.alertingupgrade.migrations.cli.OutputFormat;
import org.alertingupgrade.migrations.commands.AlertingCommand;
import org.alertingupgrade.migrations.commands.CommandArgs;
import org.alertingupgrade.migrations.commands.MigrateAlertArgs;
import org.alertingupgrade.migrations.commands.MigrateChannelArgs;
import org.alertingupgrade.migrations.commands.MigrateChannelsArgs;
import org.alertingupgrade.migrations.commands.MigrateDashboardArgs;
import org.alertingupgrade.migrations.commands.MigrateOrgArgs;
import org.alertingupgrade.migrations.commands.Result;
import org.alertingupgrade.migrations.commands.RevertAllArgs;
import org.alertingupgrade.migrations.commands.RevertOrgArgs;
import org.alertingupgrade.migrations.commands.RunArgs;
import org.alertingupgrade.migrations.commands.SimpleResult;
import org.alertingupgrade.migrations.commands.SummaryArgs;
import org.alertingupgrade.migrations.common.ObjectMapperFactory;
import org.alertingupgrade.migrations.config.MigrationConfig;
import org.alertingupgrade.migrations.jcommander.EnvVarParameterPuller;
import org.alertingupgrade.migrations.secrets.AesGcmEncryptionService;
import org.alertingupgrade.migrations.service.MigrationComponents;
import org.alertingupgrade.migrations.service.MigrationService;
import org.alertingupgrade.migrations.service.MigrationSettings;
import org.alertingupgrade.migrations.store.PostgresClient;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.FileAppender;

@Slf4j
public class AlertingMigrationTool {

    public static final String ENV_PREFIX = "ALERTING_MIGRATION_";
    public static final String UNIFIED_ALERTING_ENABLED_MESSAGE =
        "This operation is not available with unified alerting enabled";
    /** Grafana's built-in default for {@code secret_key} */
    static final String DEFAULT_SECRET_KEY = "SW2YcwTIb9zpOOhoPsMm";
    /** Appender name from AlertingMigrationTool/src/main/resources/log4j2.properties */
    static final String RUN_LOG_APPENDER = "AlertingMigrationRun";

    public static void main(String[] args) {
        new AlertingMigrationTool().run(args);
    }

    private final AtomicReference<OutputFormat> outputFormat = new AtomicReference<>(OutputFormat.HUMAN_READABLE);

    protected void run(String[] args) {
        System.err.println("Starting program with: " + String.join(" ", ArgLogUtils.getRedactedArgs(
            args,
            ArgNameConstants.joinLists(ArgNameConstants.CENSORED_DB_ARGS, ArgNameConstants.CENSORED_SECRET_ARGS)
        )));

        var toolArgs = new ToolArgs();
        var commandArgs = newCommandArgs();
        var builder = JCommander.newBuilder().addObject(toolArgs);
        commandArgs.values().forEach(builder::addCommand);
        var jCommander = builder.build();

        try {
            var configFile = findConfigFile(args);
            if (configFile != null) {
                EnvVarParameterPuller.injectFromValues(toolArgs, MigrationConfig.loadFrom(configFile).toArgumentValues());
            }
            EnvVarParameterPuller.injectFromEnv(toolArgs, ENV_PREFIX);
            jCommander.parse(args);
        } catch (ParameterException | IOException e) {
            log.atError().setCause(e).setMessage("Invalid parameter").log();
            finish(SimpleResult.error(AlertingCommand.INVALID_PARAMETER_CODE, "Invalid parameter: " + e.getMessage()));
            return;
        }

        var parsedCommand = jCommander.getParsedCommand();
        if (toolArgs.help || parsedCommand == null) {
            printTopLevelHelp(jCommander);
            return;
        }

        var command = ToolCommands.fromString(parsedCommand);
        var arguments = commandArgs.get(command);
        outputFormat.set(arguments.outputFormat);
        if (arguments.help) {
            printCommandUsage(jCommander);
            return;
        }

        finish(runCommand(command, arguments, toolArgs));
    }

    private Result runCommand(ToolCommands command, CommandArgs arguments, ToolArgs toolArgs) {
        var settings = toSettings(toolArgs);
        if (command.isPerItem() && settings.isUnifiedAlertingEnabled()) {
            return SimpleResult.error(UNIFIED_ALERTING_ENABLED_MESSAGE);
        }
        try (var handle = createService(toolArgs, settings)) {
            return new AlertingCommand(handle.getService()).execute(command, arguments);
        } catch (ParameterException pe) {
            log.atError().setCause(pe).setMessage("Invalid parameter").log();
            return SimpleResult.error(AlertingCommand.INVALID_PARAMETER_CODE, "Invalid parameter: " + pe.getMessage());
        } catch (Exception e) {
            log.atError().setCause(e).setMessage("Unexpected failure").log();
            return SimpleResult.error(AlertingCommand.UNEXPECTED_FAILURE_CODE,
                AlertingCommand.createUnexpectedErrorMessage(e));
        }
    }

    private void finish(Result result) {
        // Output format determines which version is printed to the user
        writeOutput(result.asCliOutput());
        writeOutput(result.asJsonOutput());
        reportLogPath();
        exitWithCode(result.getExitCode());
    }

    static MigrationSettings toSettings(ToolArgs toolArgs) {
        var settings = MigrationSettings.builder();
        if (toolArgs.unifiedAlertingEnabled != null) {
            settings.unifiedAlertingEnabled(toolArgs.unifiedAlertingEnabled);
        }
        if (toolArgs.legacyAlertingEnabled != null) {
            settings.legacyAlertingEnabled(toolArgs.legacyAlertingEnabled);
        }
        if (toolArgs.forceMigration != null) {
            settings.forceMigration(toolArgs.forceMigration);
        }
        if (toolArgs.caseInsensitiveTitles != null) {
            settings.caseInsensitiveTitles(toolArgs.caseInsensitiveTitles);
        }
        if (toolArgs.dataPath != null) {
            settings.dataPath(Path.of(toolArgs.dataPath));
        }
        if (toolArgs.lockLeaseMinutes != null) {
            settings.lockLeaseDuration(Duration.ofMinutes(toolArgs.lockLeaseMinutes));
        }
        return settings.build();
    }

    /** Connects to the database named in the arguments; tests override this */
    protected MigrationServiceHandle createService(ToolArgs toolArgs, MigrationSettings settings) {
        if (toolArgs.dbUrl == null || toolArgs.dbUrl.isBlank()) {
            throw new ParameterException("--db-url is required");
        }
        var secretKey = toolArgs.secretKey == null ? DEFAULT_SECRET_KEY : toolArgs.secretKey;
        var dbClient = new PostgresClient(toolArgs.dbUrl, toolArgs.dbUsername, toolArgs.dbPassword);
        var components = MigrationComponents.jdbc(dbClient, new AesGcmEncryptionService(secretKey),
            ObjectMapperFactory.createDefaultMapper(), settings.getDataPath(), Clock.systemUTC());
        return new MigrationServiceHandle(new MigrationService(settings, components), dbClient);
    }

    protected void exitWithCode(int code) {
        System.exit(code);
    }

    protected void writeOutput(String humanReadableOutput) {
        if (outputFormat.get() == OutputFormat.HUMAN_READABLE) {
            log.atInfo().setMessage("{}").addArgument(humanReadableOutput).log();
        }
    }

    protected void writeOutput(JsonNode output) {
        if (outputFormat.get() == OutputFormat.JSON) {
            log.atInfo().setMessage("{}").addArgument(output::toPrettyString).log();
        }
    }

    private static Map<ToolCommands, CommandArgs> newCommandArgs() {
        var commandArgs = new LinkedHashMap<ToolCommands, CommandArgs>();
        commandArgs.put(ToolCommands.MIGRATE_ORG, new MigrateOrgArgs());
        commandArgs.put(ToolCommands.MIGRATE_DASHBOARD, new MigrateDashboardArgs());
        commandArgs.put(ToolCommands.MIGRATE_ALERT, new MigrateAlertArgs());
        commandArgs.put(ToolCommands.MIGRATE_CHANNEL, new MigrateChannelArgs());
        commandArgs.put(ToolCommands.MIGRATE_CHANNELS, new MigrateChannelsArgs());
        commandArgs.put(ToolCommands.SUMMARY, new SummaryArgs());
        commandArgs.put(ToolCommands.REVERT_ORG, new RevertOrgArgs());
        commandArgs.put(ToolCommands.REVERT_ALL, new RevertAllArgs());
        commandArgs.put(ToolCommands.RUN, new RunArgs());
        return commandArgs;
    }

    /** The config file has to be known before parsing, so that command line values can override it */
    static String findConfigFile(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config-file".equals(args[i]) || "-c".equals(args[i])) {
                return args[i + 1];
            }
        }
        return System.getenv(ENV_PREFIX + "CONFIG_FILE");
    }

    private void printTopLevelHelp(JCommander commander) {
        var sb = new StringBuilder();
        sb.append("Usage: [options] [command] [commandOptions]").append(System.lineSeparator());
        sb.append("Options:").append(System.lineSeparator());
        for (var parameter : commander.getParameters()) {
            sb.append("  ").append(parameter.getNames());
            sb.append("    ").append(parameter.getDescription()).append(System.lineSeparator());
        }

        sb.append("Commands:").append(System.lineSeparator());
        for (var command : commander.getCommands().entrySet()) {
            sb.append("  ").append(command.getKey()).append(System.lineSeparator());
        }
        sb.append("\nUse --help with a specific command for more information.");
        writeOutput(sb.toString());
    }

    private void printCommandUsage(JCommander jCommander) {
        var sb = new StringBuilder();
        jCommander.getUsageFormatter().usage(jCommander.getParsedCommand(), sb);
        writeOutput(sb.toString());
    }

    private void reportLogPath() {
        try {
            var loggingContext = (LoggerContext) LogManager.getContext(false);
            var loggingConfig = loggingContext.getConfiguration();
            var runLogAppender = (FileAppender) loggingConfig.getAppender(RUN_LOG_APPENDER);
            if (runLogAppender != null) {
                var logFilePath = Path.of(runLogAppender.getFileName()).normalize();
                writeOutput("Consult " + logFilePath.toAbsolutePath() + " to see detailed logs for this run");
            }
        } catch (ClassCastException e) {
            log.atDebug().setMessage("Run log location is unavailable").setCause(e).log();
        }
    }
}
