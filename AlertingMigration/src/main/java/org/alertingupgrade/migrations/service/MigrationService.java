package org.alertingupgrade.migrations.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.alertingupgrade.migrations.common.MigrationException;
import org.alertingupgrade.migrations.folders.ServiceIdentity;
import org.alertingupgrade.migrations.ledger.AlertRuleUpgrade;
import org.alertingupgrade.migrations.ledger.ContactPair;
import org.alertingupgrade.migrations.ledger.DashboardUpgrade;
import org.alertingupgrade.migrations.ledger.MigrationLedgerStore;
import org.alertingupgrade.migrations.ledger.OrgMigrationState;
import org.alertingupgrade.migrations.lock.ServerLockHeldException;
import org.alertingupgrade.migrations.notifier.AlertmanagerConfigException;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Entry points for migrating orgs from legacy to unified alerting and for reverting them.
 * <p>
 * All operations are serialized by one in-process lock and each runs in a single database transaction, so a
 * failing operation leaves no partial writes behind (silence files excepted). Failures of single alerts,
 * dashboards and channels are recorded in the org's ledger instead of failing the operation.
 */
@Slf4j
public class MigrationService {
    /** Name of the server lock that keeps processes sharing a database from running {@link #run()} together */
    public static final String ACTION_NAME = "alerting migration";

    private final MigrationSettings settings;
    private final MigrationComponents components;
    private final MigrationLedgerStore ledger;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, MigrationState> transitionalStates = new ConcurrentHashMap<>();

    public MigrationService(MigrationSettings settings, MigrationComponents components) {
        this.settings = settings;
        this.components = components;
        this.ledger = components.getLedgerStore();
    }

    /**
     * Re-migrates the alert of one panel into the folder the dashboard was migrated to before. Folder changes
     * are left to {@link #migrateDashboard}.
     */
    public DashboardUpgrade migrateAlert(long orgId, long dashboardId, long panelId) {
        return inOperation(orgId, () -> {
            var state = ledger.getOrgMigrationState(orgId);
            var store = components.getStore();
            var alert = store.getDashboardAlert(orgId, dashboardId, panelId)
                .orElseThrow(() -> new MigrationException(
                    "alert of dashboard " + dashboardId + " panel " + panelId + " not found"));

            var du = state.getDashboardUpgrade(dashboardId).orElseGet(() -> {
                var created = DashboardUpgrade.forDashboard(dashboardId);
                state.getMigratedDashboards().add(created);
                return created;
            });
            du.popAlertPair(panelId).ifPresent(previous -> {
                var rule = previous.getAlertRule();
                if (rule != null && rule.getUid() != null && !rule.getUid().isEmpty()) {
                    store.deleteAlertRules(orgId, List.of(rule.getUid()));
                }
            });

            var dashboard = store.getDashboard(orgId, dashboardId)
                .orElseThrow(() -> new MigrationException("dashboard with id " + dashboardId + " not found"));
            var provisioned = store.isProvisioned(orgId, dashboardId);
            if (provisioned != du.isProvisioned()) {
                throw new MigrationException("provisioned status has changed for dashboard " + dashboard.getUid()
                    + ", must re-upgrade entire dashboard");
            }
            var folderUid = du.getNewFolderUid();
            var folder = Optional.ofNullable(folderUid)
                .filter(uid -> !uid.isEmpty())
                .flatMap(uid -> components.getFolderService().getFolderByUid(orgId, uid))
                .orElseThrow(() -> new MigrationException("folder with uid " + folderUid + " not found"));

            var om = newOrgMigration(state);
            var pair = du.addAlert(alert);
            try {
                var migrated = om.migrateAlert(alert, dashboard, folder, om.titleDeduplicator(folder.getUid()),
                    provisioned);
                pair.setAlertRule(AlertRuleUpgrade.from(migrated.getRule()));
            } catch (MigrationException e) {
                log.atWarn().setMessage("Failed to migrate alert '{}' ({}) of dashboard {}")
                    .addArgument(alert.getName())
                    .addArgument(alert.getId())
                    .addArgument(dashboard.getUid())
                    .setCause(e)
                    .log();
                pair.setError(OrgMigration.alertError(alert, e));
            }
            om.finish();
            ledger.setOrgMigrationState(state);
            return du;
        });
    }

    /**
     * Migrates all alerts of a dashboard. An earlier migration of the dashboard is removed first unless
     * {@code skipExisting} is set, in which case its ledger entry is returned as is.
     */
    public DashboardUpgrade migrateDashboard(long orgId, long dashboardId, boolean skipExisting) {
        return inOperation(orgId, () -> {
            var state = ledger.getOrgMigrationState(orgId);
            var existing = state.getDashboardUpgrade(dashboardId);
            if (skipExisting && existing.isPresent()) {
                log.info("Dashboard {} is already migrated, skipping it", dashboardId);
                return existing.get();
            }

            var om = newOrgMigration(state);
            state.popDashboardUpgrade(dashboardId).ifPresent(om::cleanupDashboard);

            var alerts = components.getStore().getDashboardAlerts(orgId, dashboardId);
            var du = om.migrateDashboard(dashboardId, alerts);
            state.getMigratedDashboards().add(du);
            om.finish();
            ledger.setOrgMigrationState(state);
            return du;
        });
    }

    /**
     * Replaces the receiver and route of one channel in the org's Alertmanager configuration.
     *
     * @throws AlertmanagerConfigException when the resulting configuration does not validate
     */
    public ContactPair migrateChannel(long orgId, long channelId) {
        return inOperation(orgId, () -> {
            var state = ledger.getOrgMigrationState(orgId);
            var channel = components.getStore().getNotificationChannel(orgId, channelId)
                .orElseThrow(() -> new MigrationException("notification channel " + channelId + " not found"));

            var om = newOrgMigration(state);
            var config = om.loadAlertmanagerConfig();
            state.popContactPair(channelId).ifPresent(previous -> OrgMigration.removeChannel(config, previous));

            var pair = om.migrateChannel(channel, config, OrgMigration.receiverNames(config));
            state.getMigratedChannels().add(pair);
            om.saveAlertmanagerConfig(config);
            ledger.setOrgMigrationState(state);
            return pair;
        });
    }

    /**
     * Migrates every channel of the org. Without {@code skipExisting} all earlier migrated channels are removed
     * first; with it, channels already in the ledger are left alone.
     *
     * @throws AlertmanagerConfigException when the resulting configuration does not validate
     */
    public List<ContactPair> migrateAllChannels(long orgId, boolean skipExisting) {
        return inOperation(orgId, () -> {
            var state = ledger.getOrgMigrationState(orgId);
            var om = newOrgMigration(state);
            var config = om.loadAlertmanagerConfig();
            if (!skipExisting) {
                state.getMigratedChannels().forEach(previous -> OrgMigration.removeChannel(config, previous));
                state.getMigratedChannels().clear();
            }

            var receiverNames = OrgMigration.receiverNames(config);
            for (var channel : components.getStore().getNotificationChannels(orgId)) {
                if (skipExisting && state.getContactPair(channel.getId()).isPresent()) {
                    log.debug("Channel {} is already migrated, skipping it", channel.getUid());
                    continue;
                }
                state.getMigratedChannels().add(om.migrateChannel(channel, config, receiverNames));
            }
            om.saveAlertmanagerConfig(config);
            ledger.setOrgMigrationState(state);
            return new ArrayList<>(state.getMigratedChannels());
        });
    }

    /**
     * Migrates every dashboard alert and channel of an org and marks it migrated.
     *
     * @throws OrgAlreadyMigratedException when the org is already marked migrated
     */
    public OrgMigrationState migrateOrg(long orgId) {
        return inOperation(orgId, () -> doMigrateOrg(orgId));
    }

    public void migrateAllOrgs() {
        lock.lock();
        try {
            components.getStore().inTransaction(() -> {
                log.info("Migrating all orgs");
                doMigrateAllOrgs();
                return null;
            });
        } finally {
            lock.unlock();
        }
    }

    /** The stored ledger of the org, empty when the org was never migrated */
    public OrgMigrationState getOrgMigrationSummary(long orgId) {
        return inOperation(orgId, () -> ledger.getOrgMigrationState(orgId));
    }

    /**
     * Deletes everything unified alerting stored for the org, including the folders the migration created,
     * and marks the org not migrated.
     */
    public void revertOrg(long orgId) {
        log.info("Reverting legacy migration for org {}", orgId);
        inOperation(orgId, () -> {
            doRevertOrg(orgId);
            return null;
        });
    }

    public void revertAllOrgs() {
        lock.lock();
        try {
            log.info("Reverting legacy migration for all orgs");
            components.getStore().inTransaction(() -> {
                doRevertAllOrgs();
                return null;
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * Brings the installation in line with the configured alerting mode: migrates every org when unified
     * alerting is enabled and nothing was migrated, or reverts every org when legacy alerting was re-enabled
     * and {@code forceMigration} is set. Does nothing when another process holds the server lock.
     *
     * @throws ForceMigrationRequiredException when a revert is needed but {@code forceMigration} is not set
     */
    public void run() {
        lock.lock();
        try {
            components.getServerLockService().lockExecuteAndRelease(ACTION_NAME, settings.getLockLeaseDuration(),
                () -> components.getStore().inTransaction(() -> {
                    runStateMachine();
                    return null;
                }));
        } catch (ServerLockHeldException e) {
            log.atWarn().setMessage("Server lock for alerting migration already exists").log();
        } catch (ForceMigrationRequiredException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MigrationException("migration failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    public MigrationState getState(long orgId) {
        var transitional = transitionalStates.get(orgId);
        if (transitional != null) {
            return transitional;
        }
        return ledger.isMigrated(orgId) ? MigrationState.MIGRATED : MigrationState.NOT_MIGRATED;
    }

    private void runStateMachine() {
        log.info("Starting");
        var migrated = ledger.isMigrated(MigrationLedgerStore.ANY_ORG);
        if (migrated == settings.isUnifiedAlertingEnabled()) {
            log.info("No migrations to run");
            return;
        }
        if (migrated) {
            if (!settings.isLegacyAlertingEnabled()) {
                log.info("Legacy alerting is disabled, nothing to revert");
                return;
            }
            if (!settings.isForceMigration()) {
                throw new ForceMigrationRequiredException();
            }
            log.info("Reverting legacy migration");
            doRevertAllOrgs();
            log.info("Legacy migration reverted");
            return;
        }
        log.info("Starting legacy migration");
        doMigrateAllOrgs();
        log.info("Completed legacy migration");
    }

    private OrgMigrationState doMigrateOrg(long orgId) {
        if (ledger.isMigrated(orgId)) {
            throw new OrgAlreadyMigratedException(orgId);
        }
        transition(orgId, MigrationState.NOT_MIGRATED, MigrationState.MIGRATING);
        try {
            log.info("Migrating alerts for org {}", orgId);
            // per-item operations may have run before; their rules and channels are replaced, their folders kept
            var state = ledger.getOrgMigrationState(orgId);
            state.getErrors().clear();
            var om = newOrgMigration(state);
            var store = components.getStore();

            state.getMigratedDashboards().forEach(om::deleteMigratedRules);
            state.getMigratedDashboards().clear();
            var dashboardAlerts = store.getDashboardAlerts(orgId);
            log.info("Found alerts of {} dashboards to migrate", dashboardAlerts.size());
            dashboardAlerts.forEach((dashboardId, alerts) ->
                state.getMigratedDashboards().add(om.migrateDashboard(dashboardId, alerts)));
            om.deleteUnusedCreatedFolders();

            var config = om.loadAlertmanagerConfig();
            state.getMigratedChannels().forEach(previous -> OrgMigration.removeChannel(config, previous));
            state.getMigratedChannels().clear();
            var receiverNames = OrgMigration.receiverNames(config);
            for (var channel : store.getNotificationChannels(orgId)) {
                state.getMigratedChannels().add(om.migrateChannel(channel, config, receiverNames));
            }
            try {
                om.saveAlertmanagerConfig(config);
            } catch (AlertmanagerConfigException e) {
                log.atWarn().setMessage("Migrated alertmanager configuration of org {} is invalid, not saving it")
                    .addArgument(orgId)
                    .setCause(e)
                    .log();
                var error = "failed to validate alertmanager configuration: " + e.getMessage();
                state.getMigratedChannels().stream()
                    .filter(pair -> pair.getError() == null)
                    .forEach(pair -> pair.setError(error));
            }

            om.finish();
            ledger.setOrgMigrationState(state);
            ledger.setMigrated(orgId, true);
            transition(orgId, MigrationState.MIGRATING, MigrationState.MIGRATED);
            log.info("Migrated org {} with {} errors", orgId, state.countErrors());
            return state;
        } finally {
            transitionalStates.remove(orgId);
        }
    }

    private void doMigrateAllOrgs() {
        for (var orgId : components.getStore().getAllOrgIds()) {
            try (var ignored = MDC.putCloseable(OrgMigration.MDC_ORG_ID, Long.toString(orgId))) {
                doMigrateOrg(orgId);
            } catch (OrgAlreadyMigratedException e) {
                log.atWarn().setMessage("Skipping org {}, it has already been migrated").addArgument(orgId).log();
            }
        }
        ledger.setMigrated(MigrationLedgerStore.ANY_ORG, true);
    }

    private void doRevertOrg(long orgId) {
        transition(orgId, getState(orgId), MigrationState.REVERTING);
        try {
            var state = ledger.getOrgMigrationState(orgId);
            var store = components.getStore();
            store.deleteAllAlertRules(orgId);

            var identity = ServiceIdentity.folderDeleter();
            for (var folderUid : state.getCreatedFolders()) {
                components.getFolderService().deleteFolder(identity, orgId, folderUid);
            }
            log.info("Deleted {} folders created by the migration of org {}", state.getCreatedFolders().size(),
                orgId);

            store.deleteAlertmanagerData(orgId);
            ledger.deleteOrg(orgId);
            components.getSilenceSink().delete(orgId);
            ledger.setMigrated(orgId, false);
            transition(orgId, MigrationState.REVERTING, MigrationState.NOT_MIGRATED);
        } finally {
            transitionalStates.remove(orgId);
        }
    }

    private void doRevertAllOrgs() {
        for (var orgId : components.getStore().getAllOrgIds()) {
            try (var ignored = MDC.putCloseable(OrgMigration.MDC_ORG_ID, Long.toString(orgId))) {
                doRevertOrg(orgId);
            }
        }
        ledger.setMigrated(MigrationLedgerStore.ANY_ORG, false);
    }

    private void transition(long orgId, MigrationState from, MigrationState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("org " + orgId + " cannot move from " + from + " to " + to);
        }
        if (to == MigrationState.MIGRATING || to == MigrationState.REVERTING) {
            transitionalStates.put(orgId, to);
        } else {
            transitionalStates.remove(orgId);
        }
    }

    private OrgMigration newOrgMigration(OrgMigrationState state) {
        return new OrgMigration(state, settings, components);
    }

    private <T> T inOperation(long orgId, Supplier<T> operation) {
        lock.lock();
        try (var ignored = MDC.putCloseable(OrgMigration.MDC_ORG_ID, Long.toString(orgId))) {
            return components.getStore().inTransaction(operation::get);
        } finally {
            lock.unlock();
        }
    }
}
