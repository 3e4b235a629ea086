package org.alertingupgrade.migrations.service;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.alertingupgrade.migrations.common.MigrationException;
import org.alertingupgrade.migrations.common.ShortUid;
import org.alertingupgrade.migrations.dedup.Deduplicator;
import org.alertingupgrade.migrations.folders.Folder;
import org.alertingupgrade.migrations.folders.FolderResolution;
import org.alertingupgrade.migrations.folders.FolderResolutionException;
import org.alertingupgrade.migrations.folders.FolderResolver;
import org.alertingupgrade.migrations.folders.ServiceIdentity;
import org.alertingupgrade.migrations.ledger.AlertRuleUpgrade;
import org.alertingupgrade.migrations.ledger.ContactPair;
import org.alertingupgrade.migrations.ledger.ContactPointUpgrade;
import org.alertingupgrade.migrations.ledger.DashboardUpgrade;
import org.alertingupgrade.migrations.ledger.LegacyChannelSummary;
import org.alertingupgrade.migrations.ledger.OrgMigrationState;
import org.alertingupgrade.migrations.legacy.Dashboard;
import org.alertingupgrade.migrations.legacy.LegacyAlert;
import org.alertingupgrade.migrations.legacy.LegacyNotificationChannel;
import org.alertingupgrade.migrations.notifier.AlertmanagerConfigs;
import org.alertingupgrade.migrations.notifier.AlertmanagerConfiguration;
import org.alertingupgrade.migrations.notifier.ContactPointException;
import org.alertingupgrade.migrations.rules.AlertRule;
import org.alertingupgrade.migrations.rules.MigratedRule;
import org.alertingupgrade.migrations.silences.proto.MeshSilence;
import org.alertingupgrade.migrations.store.AlertRuleTitleConflictException;
import org.alertingupgrade.migrations.store.MigrationStoreException;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Working state of one operation against one org: the ledger being edited, the folder resolver and its caches,
 * the rule uids and titles handed out so far, and the silences still to be written.
 * <p>
 * Created per operation by {@link MigrationService} and never shared between threads.
 */
@Slf4j
class OrgMigration {
    static final String MDC_ORG_ID = "orgId";
    static final String MDC_DASHBOARD_UID = "dashboardUid";

    private final long orgId;
    @Getter
    private final OrgMigrationState state;
    private final MigrationSettings settings;
    private final MigrationComponents components;

    private final FolderResolver folderResolver;
    private final Deduplicator seenUids;
    private final Map<String, Deduplicator> titleDeduplicators = new HashMap<>();
    private final List<MeshSilence> silences = new ArrayList<>();

    OrgMigration(OrgMigrationState state, MigrationSettings settings, MigrationComponents components) {
        this.orgId = state.getOrgId();
        this.state = state;
        this.settings = settings;
        this.components = components;
        this.folderResolver = new FolderResolver(orgId, components.getFolderService(),
            components.getPermissionService());
        this.seenUids = new Deduplicator(settings.isCaseInsensitiveTitles(), 0);
    }

    /**
     * Migrates the alerts of one dashboard. Problems with the dashboard or single alerts are recorded in the
     * returned entry; store failures propagate.
     */
    DashboardUpgrade migrateDashboard(long dashboardId, List<LegacyAlert> alerts) {
        var du = DashboardUpgrade.forDashboard(dashboardId);
        var dashboard = components.getStore().getDashboard(orgId, dashboardId);
        if (dashboard.isEmpty()) {
            var error = "dashboard with id " + dashboardId + " not found";
            log.atWarn().setMessage("Failed to migrate {} alerts of dashboard {}: {}")
                .addArgument(alerts.size())
                .addArgument(dashboardId)
                .addArgument(error)
                .log();
            du.setErrors(alerts, error);
            return du;
        }

        var dash = dashboard.get();
        du.setDashboardUid(dash.getUid());
        du.setDashboardName(dash.getTitle());
        try (var ignored = MDC.putCloseable(MDC_DASHBOARD_UID, dash.getUid())) {
            migrateDashboard(du, dash, alerts);
        }
        return du;
    }

    private void migrateDashboard(DashboardUpgrade du, Dashboard dash, List<LegacyAlert> alerts) {
        try {
            du.setProvisioned(components.getStore().isProvisioned(orgId, dash.getId()));
        } catch (MigrationStoreException e) {
            log.atWarn().setMessage("Failed to get provisioned status of dashboard {}")
                .addArgument(dash.getUid())
                .setCause(e)
                .log();
            du.getWarnings().add("failed to get provisioned status: " + e.getMessage());
        }

        FolderResolution resolution;
        try {
            resolution = folderResolver.resolve(dash);
        } catch (FolderResolutionException e) {
            log.atWarn().setMessage("Failed to migrate {} alerts of dashboard {}")
                .addArgument(alerts.size())
                .addArgument(dash.getUid())
                .setCause(e)
                .log();
            du.setErrors(alerts, e.getMessage());
            return;
        }
        if (resolution.getLegacyFolder() != null) {
            du.setFolderUid(resolution.getLegacyFolder().getUid());
            du.setFolderName(resolution.getLegacyFolder().getTitle());
        }
        var target = resolution.getTargetFolder();
        du.setNewFolderUid(target.getUid());
        du.setNewFolderName(target.getTitle());
        if (resolution.getWarning() != null) {
            du.getWarnings().add(resolution.getWarning());
        }

        var titles = titleDeduplicator(target.getUid());
        for (var alert : alerts) {
            var pair = du.addAlert(alert);
            try {
                var migrated = migrateAlert(alert, dash, target, titles, du.isProvisioned());
                pair.setAlertRule(AlertRuleUpgrade.from(migrated.getRule()));
            } catch (MigrationException e) {
                log.atWarn().setMessage("Failed to migrate alert '{}' ({}) of dashboard {}")
                    .addArgument(alert.getName())
                    .addArgument(alert.getId())
                    .addArgument(dash.getUid())
                    .setCause(e)
                    .log();
                pair.setError(alertError(alert, e));
            }
        }
        log.info("Migrated {} alerts of dashboard {} into folder {}", alerts.size(), dash.getUid(), target.getUid());
    }

    /**
     * Synthesizes and inserts the rule. A title conflict on insert is retried once with a deduplicated title.
     *
     * @throws MigrationException when the alert cannot be migrated
     */
    MigratedRule migrateAlert(LegacyAlert alert, Dashboard dashboard, Folder folder, Deduplicator titles,
                              boolean provisioned) {
        var migrated = components.getRuleSynthesizer().synthesize(alert, dashboard, folder, newRuleUid(), titles);
        var rule = migrated.getRule();
        try {
            components.getStore().insertAlertRule(rule, provisioned);
        } catch (AlertRuleTitleConflictException e) {
            var retryTitle = titles.deduplicate(rule.getTitle());
            titles.add(retryTitle);
            log.atWarn().setMessage("Alert rule title '{}' conflicts with a stored rule, retrying as '{}'")
                .addArgument(rule.getTitle())
                .addArgument(retryTitle)
                .log();
            rule.setTitle(retryTitle);
            components.getStore().insertAlertRule(rule, provisioned);
        }
        if (migrated.needsSilences()) {
            silences.addAll(components.getSilenceSynthesizer().synthesize(migrated));
        }
        return migrated;
    }

    /** Deletes the rules of a previous migration of the dashboard, and its folder when nothing else uses it */
    void cleanupDashboard(DashboardUpgrade previous) {
        deleteMigratedRules(previous);
        if (!previous.hasNewFolder()) {
            return;
        }
        var folderUid = previous.getNewFolderUid();
        if (!state.getCreatedFolders().contains(folderUid)) {
            log.debug("Keeping folder {}, it was not created by the migration", folderUid);
            return;
        }
        if (state.isFolderInUse(folderUid)) {
            log.debug("Keeping folder {}, other dashboards still use it", folderUid);
            return;
        }
        deleteCreatedFolder(folderUid);
        log.info("Deleted folder {} created by an earlier migration of dashboard {}", folderUid,
            previous.getDashboardUid());
    }

    /** Deletes the rules recorded for a previous migration of the dashboard; folders are left in place */
    void deleteMigratedRules(DashboardUpgrade previous) {
        var ruleUids = new ArrayList<String>();
        for (var pair : previous.getMigratedAlerts()) {
            if (pair.getAlertRule() != null && pair.getAlertRule().getUid() != null) {
                ruleUids.add(pair.getAlertRule().getUid());
            }
        }
        if (!ruleUids.isEmpty()) {
            components.getStore().deleteAlertRules(orgId, ruleUids);
        }
    }

    /** Deletes the folders an earlier migration created that no dashboard entry uses anymore */
    void deleteUnusedCreatedFolders() {
        for (var folderUid : new ArrayList<>(state.getCreatedFolders())) {
            if (!state.isFolderInUse(folderUid)) {
                deleteCreatedFolder(folderUid);
                log.info("Deleted folder {} created by an earlier migration, no dashboard uses it anymore",
                    folderUid);
            }
        }
    }

    private void deleteCreatedFolder(String folderUid) {
        components.getFolderService().deleteFolder(ServiceIdentity.folderDeleter(), orgId, folderUid);
        state.getCreatedFolders().remove(folderUid);
    }

    /** The stored configuration, or a fresh base configuration when the org has none */
    AlertmanagerConfiguration loadAlertmanagerConfig() {
        return components.getStore().getAlertmanagerConfiguration(orgId)
            .map(json -> AlertmanagerConfigs.parse(components.getMapper(), json))
            .orElseGet(AlertmanagerConfigs::baseConfig);
    }

    static Deduplicator receiverNames(AlertmanagerConfiguration config) {
        var names = new Deduplicator(false, 0);
        AlertmanagerConfigs.receiverNames(config).forEach(names::add);
        return names;
    }

    /** Adds the channel's receiver and route to {@code config}; a failing channel is recorded in the pair */
    ContactPair migrateChannel(LegacyNotificationChannel channel,
                               AlertmanagerConfiguration config,
                               Deduplicator receiverNames) {
        var pair = ContactPair.builder().legacyChannel(LegacyChannelSummary.from(channel)).build();
        try {
            var migrated = components.getContactPointSynthesizer().synthesize(channel, receiverNames);
            AlertmanagerConfigs.addChannel(config, migrated);
            pair.setContactPoint(ContactPointUpgrade.from(migrated));
        } catch (ContactPointException e) {
            log.atWarn().setMessage("Failed to migrate notification channel '{}' ({})")
                .addArgument(channel.getName())
                .addArgument(channel.getUid())
                .setCause(e)
                .log();
            pair.setError("failed to migrate notification channel '" + channel.getName() + "': " + e.getMessage());
        }
        return pair;
    }

    static void removeChannel(AlertmanagerConfiguration config, ContactPair previous) {
        if (previous.getContactPoint() != null && previous.getContactPoint().getName() != null) {
            AlertmanagerConfigs.removeChannel(config, previous.getContactPoint().getName());
        }
    }

    /**
     * @throws org.alertingupgrade.migrations.notifier.AlertmanagerConfigException when validation fails; nothing
     *         is saved then
     */
    void saveAlertmanagerConfig(AlertmanagerConfiguration config) {
        components.getNotifierValidator().validate(config);
        var root = config.getAlertmanagerConfig();
        log.info("Writing alertmanager configuration with {} receivers and {} routes", root.getReceivers().size(),
            root.getRoute().getRoutes().size());
        components.getStore().saveAlertmanagerConfiguration(orgId,
            AlertmanagerConfigs.serialize(components.getMapper(), config));
    }

    /** Records created folders and writes pending silences; a silence failure becomes an org error */
    void finish() {
        for (var folder : folderResolver.getCreatedFolders()) {
            if (!state.getCreatedFolders().contains(folder.getUid())) {
                state.getCreatedFolders().add(folder.getUid());
            }
        }
        if (silences.isEmpty()) {
            return;
        }
        try {
            components.getSilenceSink().write(orgId, silences);
            log.info("Wrote {} silences", silences.size());
        } catch (UncheckedIOException e) {
            log.atWarn().setMessage("Failed to write silences").setCause(e).log();
            state.getErrors().add("failed to write silence file: " + e.getMessage());
        }
        silences.clear();
    }

    /** Created lazily per folder and seeded with the titles already stored there */
    Deduplicator titleDeduplicator(String folderUid) {
        return titleDeduplicators.computeIfAbsent(folderUid, uid -> {
            var titles = new Deduplicator(settings.isCaseInsensitiveTitles(), AlertRule.MAX_TITLE_LENGTH);
            components.getStore().getAlertRuleTitles(orgId, uid).forEach(titles::add);
            return titles;
        });
    }

    private String newRuleUid() {
        var uid = ShortUid.generate();
        while (seenUids.contains(uid)) {
            uid = ShortUid.generate();
        }
        seenUids.add(uid);
        return uid;
    }

    static String alertError(LegacyAlert alert, Exception e) {
        return "failed to migrate alert '" + alert.getName() + "': " + e.getMessage();
    }
}
