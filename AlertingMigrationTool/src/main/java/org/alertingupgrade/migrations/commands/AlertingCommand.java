package org.alertingupgrade.migrations.commands;

import java.util.List;
import java.util.Optional;

import org.alertingupgrade.migrations.ToolCommands;
import org.alertingupgrade.migrations.common.MigrationException;
import org.alertingupgrade.migrations.service.MigrationService;

import com.beust.jcommander.ParameterException;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Runs one parsed command against a {@link MigrationService} and turns the outcome into a {@link Result} */
@Slf4j
@AllArgsConstructor
public class AlertingCommand {
    public static final int INVALID_PARAMETER_CODE = 999;
    public static final int UNEXPECTED_FAILURE_CODE = 888;

    private final MigrationService service;

    public Result execute(ToolCommands command, CommandArgs arguments) {
        try {
            log.info("Running {}", command.getCommandName());
            return dispatch(command, arguments);
        } catch (ParameterException pe) {
            log.atError().setCause(pe).setMessage("Invalid parameter").log();
            return SimpleResult.error(INVALID_PARAMETER_CODE, "Invalid parameter: " + pe.getMessage());
        } catch (MigrationException e) {
            log.atError().setCause(e).setMessage("{} failed").addArgument(command.getCommandName()).log();
            return SimpleResult.error(e.getMessage());
        } catch (Exception e) {
            log.atError().setCause(e).setMessage("Unexpected failure").log();
            return SimpleResult.error(UNEXPECTED_FAILURE_CODE, createUnexpectedErrorMessage(e));
        }
    }

    private Result dispatch(ToolCommands command, CommandArgs arguments) {
        switch (command) {
            case MIGRATE_ORG: {
                var args = (MigrateOrgArgs) arguments;
                return OrgSummaryResult.builder().summary(service.migrateOrg(args.orgId)).build();
            }
            case MIGRATE_DASHBOARD: {
                var args = (MigrateDashboardArgs) arguments;
                return DashboardResult.builder()
                    .dashboard(service.migrateDashboard(args.orgId, args.dashboardId, args.skipExisting))
                    .build();
            }
            case MIGRATE_ALERT: {
                var args = (MigrateAlertArgs) arguments;
                return DashboardResult.builder()
                    .dashboard(service.migrateAlert(args.orgId, args.dashboardId, args.panelId))
                    .build();
            }
            case MIGRATE_CHANNEL: {
                var args = (MigrateChannelArgs) arguments;
                return ChannelsResult.builder()
                    .channels(List.of(service.migrateChannel(args.orgId, args.channelId)))
                    .build();
            }
            case MIGRATE_CHANNELS: {
                var args = (MigrateChannelsArgs) arguments;
                return ChannelsResult.builder()
                    .channels(service.migrateAllChannels(args.orgId, args.skipExisting))
                    .build();
            }
            case SUMMARY: {
                var args = (SummaryArgs) arguments;
                return OrgSummaryResult.builder().summary(service.getOrgMigrationSummary(args.orgId)).build();
            }
            case REVERT_ORG:
                service.revertOrg(((RevertOrgArgs) arguments).orgId);
                return SimpleResult.success();
            case REVERT_ALL:
                service.revertAllOrgs();
                return SimpleResult.success();
            case RUN:
                service.run();
                return SimpleResult.success();
            default:
                throw new ParameterException("Unsupported command " + command.getCommandName());
        }
    }

    public static String createUnexpectedErrorMessage(Throwable e) {
        var causeMessage = Optional.of(e).map(Throwable::getCause).map(Throwable::getMessage).orElse(null);
        return "Unexpected failure: " + e.getMessage() + (causeMessage == null ? "" : ", inner cause: " + causeMessage);
    }
}
