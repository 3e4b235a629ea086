package org.alertingupgrade.migrations.store;

import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.alertingupgrade.migrations.legacy.Dashboard;
import org.alertingupgrade.migrations.legacy.LegacyAlert;
import org.alertingupgrade.migrations.legacy.LegacyNotificationChannel;
import org.alertingupgrade.migrations.rules.AlertRule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.hash.Hashing;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.util.PSQLException;

@Slf4j
public class JdbcMigrationStore implements MigrationStore {
    static final String UNIQUE_VIOLATION = "23505";
    static final String TITLE_CONSTRAINT = "uqe_alert_rule_org_id_namespace_uid_title";
    static final String PROVENANCE_FILE = "file";
    static final String RULE_RECORD_TYPE = "alertRule";
    static final String CONFIGURATION_VERSION = "v1";

    private static final String ALERT_COLUMNS = "id, org_id, dashboard_id, panel_id, name, message, state, frequency, "
        + "\"for\", settings, silenced, execution_error, new_state_date";
    private static final String CHANNEL_COLUMNS = "id, org_id, uid, name, type, is_default, send_reminder, frequency, "
        + "disable_resolve_message, settings, secure_settings";
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private final DatabaseClient dbClient;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JdbcMigrationStore(DatabaseClient dbClient, ObjectMapper mapper, Clock clock) {
        this.dbClient = dbClient;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public <T> T inTransaction(TransactionalWork<T> work) {
        try {
            return dbClient.executeInBoundTransaction(work);
        } catch (SQLException e) {
            throw new MigrationStoreException("transaction", e);
        }
    }

    @Override
    public List<Long> getAllOrgIds() {
        return query("getAllOrgIds", "SELECT id FROM org ORDER BY id", rs -> {
            var ids = new ArrayList<Long>();
            while (rs.next()) {
                ids.add(rs.getLong("id"));
            }
            return ids;
        });
    }

    @Override
    public Map<Long, List<LegacyAlert>> getDashboardAlerts(long orgId) {
        var alerts = query("getDashboardAlerts",
            "SELECT " + ALERT_COLUMNS + " FROM alert WHERE org_id = ? ORDER BY dashboard_id, panel_id",
            this::readAlerts, orgId);
        var byDashboard = new LinkedHashMap<Long, List<LegacyAlert>>();
        alerts.forEach(a -> byDashboard.computeIfAbsent(a.getDashboardId(), k -> new ArrayList<>()).add(a));
        return byDashboard;
    }

    @Override
    public List<LegacyAlert> getDashboardAlerts(long orgId, long dashboardId) {
        return query("getDashboardAlerts",
            "SELECT " + ALERT_COLUMNS + " FROM alert WHERE org_id = ? AND dashboard_id = ? ORDER BY panel_id",
            this::readAlerts, orgId, dashboardId);
    }

    @Override
    public Optional<LegacyAlert> getDashboardAlert(long orgId, long dashboardId, long panelId) {
        return query("getDashboardAlert",
            "SELECT " + ALERT_COLUMNS + " FROM alert WHERE org_id = ? AND dashboard_id = ? AND panel_id = ?",
            this::readAlerts, orgId, dashboardId, panelId).stream().findFirst();
    }

    @Override
    public List<LegacyNotificationChannel> getNotificationChannels(long orgId) {
        return query("getNotificationChannels",
            "SELECT " + CHANNEL_COLUMNS + " FROM alert_notification WHERE org_id = ? ORDER BY id",
            this::readChannels, orgId);
    }

    @Override
    public Optional<LegacyNotificationChannel> getNotificationChannel(long orgId, long channelId) {
        return query("getNotificationChannel",
            "SELECT " + CHANNEL_COLUMNS + " FROM alert_notification WHERE org_id = ? AND id = ?",
            this::readChannels, orgId, channelId).stream().findFirst();
    }

    @Override
    public Optional<String> getAlertNotificationUidWithId(long orgId, long channelId) {
        return query("getAlertNotificationUidWithId",
            "SELECT uid FROM alert_notification WHERE org_id = ? AND id = ?",
            rs -> rs.next() ? Optional.ofNullable(rs.getString("uid")) : Optional.<String>empty(),
            orgId, channelId);
    }

    @Override
    public Optional<Dashboard> getDashboard(long orgId, long dashboardId) {
        return query("getDashboard",
            "SELECT id, org_id, uid, title, folder_id, has_acl FROM dashboard "
                + "WHERE org_id = ? AND id = ? AND is_folder = FALSE",
            rs -> rs.next()
                ? Optional.of(Dashboard.builder()
                    .id(rs.getLong("id"))
                    .orgId(rs.getLong("org_id"))
                    .uid(rs.getString("uid"))
                    .title(rs.getString("title"))
                    .folderId(rs.getLong("folder_id"))
                    .hasAcl(rs.getBoolean("has_acl"))
                    .build())
                : Optional.<Dashboard>empty(),
            orgId, dashboardId);
    }

    @Override
    public boolean isProvisioned(long orgId, long dashboardId) {
        return query("isProvisioned",
            "SELECT 1 FROM dashboard_provisioning p JOIN dashboard d ON d.id = p.dashboard_id "
                + "WHERE d.org_id = ? AND d.id = ?",
            ResultSet::next, orgId, dashboardId);
    }

    @Override
    public Set<String> getAlertRuleTitles(long orgId, String namespaceUid) {
        return query("getAlertRuleTitles",
            "SELECT title FROM alert_rule WHERE org_id = ? AND namespace_uid = ?",
            rs -> {
                var titles = new HashSet<String>();
                while (rs.next()) {
                    titles.add(rs.getString("title"));
                }
                return titles;
            }, orgId, namespaceUid);
    }

    @Override
    public void insertAlertRule(AlertRule rule, boolean provisioned) {
        String data;
        String annotations;
        String labels;
        try {
            data = mapper.writeValueAsString(rule.getData());
            annotations = mapper.writeValueAsString(rule.getAnnotations());
            labels = mapper.writeValueAsString(rule.getLabels());
        } catch (JsonProcessingException e) {
            throw new MigrationStoreException("insertAlertRule", e);
        }
        var updated = Timestamp.from(rule.getUpdated());
        var forNanos = rule.getForDuration() == null ? 0L : rule.getForDuration().toNanos();

        try {
            dbClient.executeInTransaction(conn -> {
                // a savepoint keeps a unique violation from aborting the surrounding transaction
                var savepoint = conn.getAutoCommit() ? null : conn.setSavepoint();
                try {
                    try (var stmt = conn.prepareStatement("INSERT INTO alert_rule (org_id, uid, title, condition, data, "
                        + "updated, interval_seconds, version, namespace_uid, rule_group, rule_group_idx, no_data_state, "
                        + "exec_err_state, \"for\", annotations, labels, dashboard_uid, panel_id, is_paused) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                        DatabaseClient.bind(stmt, rule.getOrgId(), rule.getUid(), rule.getTitle(), rule.getCondition(),
                            data, updated, rule.getIntervalSeconds(), rule.getVersion(), rule.getNamespaceUid(),
                            rule.getRuleGroup(), rule.getRuleGroupIndex(), rule.getNoDataState().getValue(),
                            rule.getExecErrState().getValue(), forNanos, annotations, labels, rule.getDashboardUid(),
                            rule.getPanelId(), rule.isPaused());
                        stmt.executeUpdate();
                    }
                    try (var stmt = conn.prepareStatement("INSERT INTO alert_rule_version (rule_org_id, rule_uid, "
                        + "rule_namespace_uid, rule_group, rule_group_idx, parent_version, restored_from, version, created, "
                        + "title, condition, data, interval_seconds, no_data_state, exec_err_state, \"for\", annotations, "
                        + "labels, is_paused) VALUES (?, ?, ?, ?, ?, 0, 0, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                        DatabaseClient.bind(stmt, rule.getOrgId(), rule.getUid(), rule.getNamespaceUid(),
                            rule.getRuleGroup(), rule.getRuleGroupIndex(), rule.getVersion(), updated, rule.getTitle(),
                            rule.getCondition(), data, rule.getIntervalSeconds(), rule.getNoDataState().getValue(),
                            rule.getExecErrState().getValue(), forNanos, annotations, labels, rule.isPaused());
                        stmt.executeUpdate();
                    }
                    if (provisioned) {
                        try (var stmt = conn.prepareStatement("INSERT INTO provenance_type (org_id, record_key, "
                            + "record_type, provenance) VALUES (?, ?, ?, ?)")) {
                            DatabaseClient.bind(stmt, rule.getOrgId(), rule.getUid(), RULE_RECORD_TYPE, PROVENANCE_FILE);
                            stmt.executeUpdate();
                        }
                    }
                } catch (SQLException e) {
                    if (savepoint != null) {
                        conn.rollback(savepoint);
                    }
                    throw e;
                }
                if (savepoint != null) {
                    conn.releaseSavepoint(savepoint);
                }
                return null;
            });
        } catch (SQLException e) {
            if (isTitleConflict(e)) {
                throw new AlertRuleTitleConflictException(rule.getTitle(), rule.getNamespaceUid(), e);
            }
            throw new MigrationStoreException("insertAlertRule", e);
        }
    }

    /** Only the (org, folder, title) constraint is a title conflict; uid and provenance clashes are not */
    static boolean isTitleConflict(SQLException e) {
        if (!UNIQUE_VIOLATION.equals(e.getSQLState())) {
            return false;
        }
        if (e instanceof PSQLException) {
            var serverError = ((PSQLException) e).getServerErrorMessage();
            if (serverError != null && serverError.getConstraint() != null) {
                return TITLE_CONSTRAINT.equals(serverError.getConstraint());
            }
        }
        return e.getMessage() != null && e.getMessage().contains(TITLE_CONSTRAINT);
    }

    @Override
    public void deleteAlertRules(long orgId, Collection<String> ruleUids) {
        if (ruleUids.isEmpty()) {
            return;
        }
        var uids = ruleUids.toArray(new String[0]);
        execute("deleteAlertRules", conn -> {
            var uidArray = conn.createArrayOf("varchar", uids);
            for (var sql : List.of(
                "DELETE FROM alert_rule WHERE org_id = ? AND uid = ANY (?)",
                "DELETE FROM alert_rule_version WHERE rule_org_id = ? AND rule_uid = ANY (?)",
                "DELETE FROM provenance_type WHERE org_id = ? AND record_type = '" + RULE_RECORD_TYPE
                    + "' AND record_key = ANY (?)")) {
                try (var stmt = conn.prepareStatement(sql)) {
                    DatabaseClient.bind(stmt, orgId, uidArray);
                    stmt.executeUpdate();
                }
            }
            return null;
        });
    }

    @Override
    public Optional<String> getAlertmanagerConfiguration(long orgId) {
        return query("getAlertmanagerConfiguration",
            "SELECT alertmanager_configuration FROM alert_configuration WHERE org_id = ? ORDER BY id DESC LIMIT 1",
            rs -> rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.<String>empty(),
            orgId);
    }

    @Override
    public void saveAlertmanagerConfiguration(long orgId, String configuration) {
        var hash = Hashing.sha256().hashString(configuration, StandardCharsets.UTF_8).toString();
        var now = clock.instant().getEpochSecond();
        update("saveAlertmanagerConfiguration", "DELETE FROM alert_configuration WHERE org_id = ?", orgId);
        update("saveAlertmanagerConfiguration",
            "INSERT INTO alert_configuration (org_id, alertmanager_configuration, configuration_version, created_at, "
                + "\"default\", configuration_hash) VALUES (?, ?, ?, ?, FALSE, ?)",
            orgId, configuration, CONFIGURATION_VERSION, now, hash);
    }

    @Override
    public void deleteAllAlertRules(long orgId) {
        update("deleteAllAlertRules", "DELETE FROM alert_rule WHERE org_id = ?", orgId);
        update("deleteAllAlertRules", "DELETE FROM alert_rule_version WHERE rule_org_id = ?", orgId);
        update("deleteAllAlertRules",
            "DELETE FROM provenance_type WHERE org_id = ? AND record_type = '" + RULE_RECORD_TYPE + "'", orgId);
    }

    @Override
    public void deleteAlertmanagerData(long orgId) {
        update("deleteAlertmanagerData", "DELETE FROM alert_configuration WHERE org_id = ?", orgId);
        update("deleteAlertmanagerData", "DELETE FROM ngalert_configuration WHERE org_id = ?", orgId);
        update("deleteAlertmanagerData", "DELETE FROM alert_instance WHERE rule_org_id = ?", orgId);
    }

    private List<LegacyAlert> readAlerts(ResultSet rs) throws SQLException {
        var alerts = new ArrayList<LegacyAlert>();
        while (rs.next()) {
            var newStateDate = rs.getTimestamp("new_state_date");
            alerts.add(LegacyAlert.builder()
                .id(rs.getLong("id"))
                .orgId(rs.getLong("org_id"))
                .dashboardId(rs.getLong("dashboard_id"))
                .panelId(rs.getLong("panel_id"))
                .name(rs.getString("name"))
                .message(rs.getString("message"))
                .state(rs.getString("state"))
                .frequency(rs.getLong("frequency"))
                .forDuration(Duration.ofNanos(rs.getLong("for")))
                .settings(readJson(rs.getString("settings")))
                .silenced(rs.getBoolean("silenced"))
                .executionError(rs.getString("execution_error"))
                .newStateDate(newStateDate == null ? null : newStateDate.toInstant())
                .build());
        }
        return alerts;
    }

    private List<LegacyNotificationChannel> readChannels(ResultSet rs) throws SQLException {
        var channels = new ArrayList<LegacyNotificationChannel>();
        while (rs.next()) {
            var settings = readJson(rs.getString("settings"));
            var secureSettingsJson = rs.getString("secure_settings");
            Map<String, String> secureSettings;
            try {
                secureSettings = secureSettingsJson == null || secureSettingsJson.isEmpty()
                    ? Map.of()
                    : mapper.readValue(secureSettingsJson, STRING_MAP);
            } catch (JsonProcessingException e) {
                throw new SQLException("failed to parse secure settings of channel " + rs.getLong("id"), e);
            }
            channels.add(LegacyNotificationChannel.builder()
                .id(rs.getLong("id"))
                .orgId(rs.getLong("org_id"))
                .uid(rs.getString("uid"))
                .name(rs.getString("name"))
                .type(rs.getString("type"))
                .isDefault(rs.getBoolean("is_default"))
                .sendReminder(rs.getBoolean("send_reminder"))
                .frequency(Duration.ofNanos(rs.getLong("frequency")))
                .disableResolveMessage(rs.getBoolean("disable_resolve_message"))
                .settings(settings instanceof ObjectNode ? (ObjectNode) settings : mapper.createObjectNode())
                .secureSettings(secureSettings)
                .build());
        }
        return channels;
    }

    private JsonNode readJson(String text) throws SQLException {
        if (text == null || text.isEmpty()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new SQLException("failed to parse stored JSON", e);
        }
    }

    private <T> T query(String operation, String sql, DatabaseClient.ResultSetMapper<T> rowMapper, Object... params) {
        try {
            return dbClient.executeQuery(sql, rowMapper, params);
        } catch (SQLException e) {
            throw new MigrationStoreException(operation, e);
        }
    }

    private void update(String operation, String sql, Object... params) {
        try {
            var rows = dbClient.executeUpdate(sql, params);
            log.atDebug().setMessage("{} affected {} rows").addArgument(operation).addArgument(rows).log();
        } catch (SQLException e) {
            throw new MigrationStoreException(operation, e);
        }
    }

    private <T> T execute(String operation, DatabaseClient.TransactionFunction<T> work) {
        try {
            return dbClient.executeInTransaction(work);
        } catch (SQLException e) {
            throw new MigrationStoreException(operation, e);
        }
    }
}
