package org.alertingupgrade.migrations.rules;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.alertingupgrade.migrations.dedup.Deduplicator;
import org.alertingupgrade.migrations.folders.Folder;
import org.alertingupgrade.migrations.legacy.Dashboard;
import org.alertingupgrade.migrations.legacy.LegacyAlert;
import org.alertingupgrade.migrations.legacy.LegacyAlertSettings;
import org.alertingupgrade.migrations.store.MigrationStore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Builds the unified rule for one legacy alert */
@Slf4j
@AllArgsConstructor
public class AlertRuleSynthesizer {
    /** Scheduler tick; rule intervals must be a multiple of it */
    static final long BASE_INTERVAL_SECONDS = 10;
    static final int RULE_GROUP_INDEX = 1;
    static final long INITIAL_VERSION = 1;

    private final ConditionTranslator conditionTranslator;
    private final QueryRewriter queryRewriter;
    private final MigrationStore store;
    private final ObjectMapper mapper;
    private final Clock clock;

    /**
     * The title is made unique against {@code titleDeduplicator}, which is updated with the final title.
     *
     * @throws ConditionTranslationException when the settings or conditions cannot be translated
     * @throws QueryRewriteException when a query model cannot be rewritten
     */
    public MigratedRule synthesize(LegacyAlert alert,
                                   Dashboard dashboard,
                                   Folder folder,
                                   String ruleUid,
                                   Deduplicator titleDeduplicator) {
        LegacyAlertSettings settings;
        try {
            settings = LegacyAlertSettings.fromJson(mapper, alert.getSettings());
        } catch (JsonProcessingException e) {
            throw new ConditionTranslationException("failed to parse alert settings", e);
        }

        var translated = conditionTranslator.translate(alert.getOrgId(), settings.getConditions());
        var data = queryRewriter.rewriteQueries(translated.getData());

        var noDataSetting = settings.getNoDataState();
        var execErrSetting = settings.getExecutionErrorState();
        var keepStateOnNoData = MigrationLabels.LEGACY_KEEP_STATE.equals(noDataSetting);
        var keepStateOnError = MigrationLabels.LEGACY_KEEP_STATE.equals(execErrSetting);

        var rule = AlertRule.builder()
            .orgId(alert.getOrgId())
            .uid(ruleUid)
            .title(uniqueTitle(alert.getName(), titleDeduplicator))
            .condition(translated.getCondition())
            .data(data)
            .intervalSeconds(intervalSeconds(alert.getFrequency()))
            .version(INITIAL_VERSION)
            .namespaceUid(folder.getUid())
            .dashboardUid(dashboard.getUid())
            .panelId(alert.getPanelId())
            .ruleGroup(ruleGroupName(dashboard, alert))
            .ruleGroupIndex(RULE_GROUP_INDEX)
            .noDataState(transNoData(noDataSetting))
            .execErrState(transExecErr(execErrSetting))
            .forDuration(alert.getForDuration())
            .updated(clock.instant())
            .annotations(annotations(alert, dashboard))
            .labels(labels(alert, settings))
            .paused(alert.isPaused())
            .build();

        if (keepStateOnNoData || keepStateOnError) {
            rule.getLabels().put(MigrationLabels.RULE_UID_LABEL, ruleUid);
        }

        return MigratedRule.builder()
            .rule(rule)
            .keepStateOnNoData(keepStateOnNoData)
            .keepStateOnError(keepStateOnError)
            .build();
    }

    private String uniqueTitle(String name, Deduplicator titleDeduplicator) {
        var title = truncate(name == null ? "" : name, AlertRule.MAX_TITLE_LENGTH);
        if (titleDeduplicator.contains(title)) {
            var deduplicated = titleDeduplicator.deduplicate(title);
            log.atWarn().setMessage("Alert rule title '{}' is already used in the folder, renaming it to '{}'")
                .addArgument(title)
                .addArgument(deduplicated)
                .log();
            title = deduplicated;
        }
        titleDeduplicator.add(title);
        return title;
    }

    private Map<String, String> annotations(LegacyAlert alert, Dashboard dashboard) {
        var annotations = new LinkedHashMap<String, String>();
        annotations.put(MigrationLabels.DASHBOARD_UID_ANNOTATION, dashboard.getUid());
        annotations.put(MigrationLabels.PANEL_ID_ANNOTATION, Long.toString(alert.getPanelId()));
        annotations.put(MigrationLabels.ALERT_ID_ANNOTATION, Long.toString(alert.getId()));
        var message = MessageTemplateMigrator.migrate(alert.getMessage());
        if (message != null && !message.isEmpty()) {
            annotations.put(MigrationLabels.MESSAGE_ANNOTATION, message);
        }
        return annotations;
    }

    private Map<String, String> labels(LegacyAlert alert, LegacyAlertSettings settings) {
        var labels = settings.tagLabels();
        labels.put(MigrationLabels.USE_LEGACY_CHANNELS_LABEL, "true");
        for (var channelUid : channelUids(alert, settings)) {
            labels.put(MigrationLabels.contactLabel(channelUid), "true");
        }
        return labels;
    }

    private List<String> channelUids(LegacyAlert alert, LegacyAlertSettings settings) {
        var uids = new ArrayList<String>();
        for (var reference : settings.getNotifications()) {
            if (reference.getUid() != null && !reference.getUid().isEmpty()) {
                uids.add(reference.getUid());
            } else if (reference.getId() != null) {
                var uid = store.getAlertNotificationUidWithId(alert.getOrgId(), reference.getId());
                if (uid.isPresent()) {
                    uids.add(uid.get());
                } else {
                    log.atWarn().setMessage("Alert {} references notification channel {} which does not exist, skipping it")
                        .addArgument(alert.getId())
                        .addArgument(reference.getId())
                        .log();
                }
            }
        }
        return uids;
    }

    static String ruleGroupName(Dashboard dashboard, LegacyAlert alert) {
        return dashboard.getTitle() + " - " + alert.getPanelId();
    }

    static long intervalSeconds(long frequencySeconds) {
        if (frequencySeconds <= BASE_INTERVAL_SECONDS) {
            return BASE_INTERVAL_SECONDS;
        }
        return frequencySeconds - frequencySeconds % BASE_INTERVAL_SECONDS;
    }

    static NoDataState transNoData(String legacy) {
        if (legacy == null) {
            return NoDataState.NO_DATA;
        }
        switch (legacy) {
            case "ok":
                return NoDataState.OK;
            case "":
            case "no_data":
                return NoDataState.NO_DATA;
            case "alerting":
                return NoDataState.ALERTING;
            case MigrationLabels.LEGACY_KEEP_STATE:
                return NoDataState.NO_DATA;
            default:
                log.warn("Unable to translate NoData state '{}', using '{}'", legacy,
                    NoDataState.NO_DATA.getValue());
                return NoDataState.NO_DATA;
        }
    }

    static ExecutionErrorState transExecErr(String legacy) {
        if (legacy == null) {
            return ExecutionErrorState.ALERTING;
        }
        switch (legacy) {
            case "":
            case "alerting":
                return ExecutionErrorState.ALERTING;
            case MigrationLabels.LEGACY_KEEP_STATE:
                return ExecutionErrorState.ERROR;
            case "ok":
                return ExecutionErrorState.OK;
            default:
                log.warn("Unable to translate execution error state '{}', using '{}'", legacy,
                    ExecutionErrorState.ERROR.getValue());
                return ExecutionErrorState.ERROR;
        }
    }

    static String truncate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }
}
