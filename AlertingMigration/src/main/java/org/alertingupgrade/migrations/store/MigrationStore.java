package org.alertingupgrade.migrations.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.alertingupgrade.migrations.legacy.Dashboard;
import org.alertingupgrade.migrations.legacy.LegacyAlert;
import org.alertingupgrade.migrations.legacy.LegacyNotificationChannel;
import org.alertingupgrade.migrations.rules.AlertRule;

/**
 * Relational reads of legacy alerting data and writes of unified alerting data. Every method joins the
 * transaction opened by {@link #inTransaction} when called inside one.
 * <p>
 * Failures surface as {@link MigrationStoreException}.
 */
public interface MigrationStore {
    <T> T inTransaction(TransactionalWork<T> work);

    List<Long> getAllOrgIds();

    /** Legacy alerts of an org grouped by dashboard id, in dashboard id order */
    Map<Long, List<LegacyAlert>> getDashboardAlerts(long orgId);

    List<LegacyAlert> getDashboardAlerts(long orgId, long dashboardId);

    Optional<LegacyAlert> getDashboardAlert(long orgId, long dashboardId, long panelId);

    List<LegacyNotificationChannel> getNotificationChannels(long orgId);

    Optional<LegacyNotificationChannel> getNotificationChannel(long orgId, long channelId);

    Optional<String> getAlertNotificationUidWithId(long orgId, long channelId);

    Optional<Dashboard> getDashboard(long orgId, long dashboardId);

    boolean isProvisioned(long orgId, long dashboardId);

    Set<String> getAlertRuleTitles(long orgId, String namespaceUid);

    /**
     * Inserts the rule and its first version. Provisioned rules additionally get file provenance.
     *
     * @throws AlertRuleTitleConflictException when the folder already holds a rule with this title
     */
    void insertAlertRule(AlertRule rule, boolean provisioned);

    void deleteAlertRules(long orgId, Collection<String> ruleUids);

    Optional<String> getAlertmanagerConfiguration(long orgId);

    void saveAlertmanagerConfiguration(long orgId, String configuration);

    /** Rules, rule versions and their provenance */
    void deleteAllAlertRules(long orgId);

    /** Alertmanager configuration, ngalert configuration and alert instance state */
    void deleteAlertmanagerData(long orgId);
}
