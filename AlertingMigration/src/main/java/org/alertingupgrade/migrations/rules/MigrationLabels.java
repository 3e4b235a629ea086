package org.alertingupgrade.migrations.rules;

import lombok.experimental.UtilityClass;

/** Private labels and annotations that tie migrated rules to their routes, silences and legacy origin */
@UtilityClass
public class MigrationLabels {
    /** Routes a rule to the migrated notification channel with the given uid */
    public static final String CONTACT_LABEL_TEMPLATE = "__contacts_%s__";
    /** Sends a rule through the nested legacy route */
    public static final String USE_LEGACY_CHANNELS_LABEL = "__use_legacy_channels__";
    /** Matched by the silences that stand in for "keep last state" */
    public static final String RULE_UID_LABEL = "rule_uid";

    public static final String DASHBOARD_UID_ANNOTATION = "__dashboardUid__";
    public static final String PANEL_ID_ANNOTATION = "__panelId__";
    public static final String ALERT_ID_ANNOTATION = "__alertId__";
    public static final String MESSAGE_ANNOTATION = "message";

    public static final String LEGACY_KEEP_STATE = "keep_state";

    public static String contactLabel(String channelUid) {
        return String.format(CONTACT_LABEL_TEMPLATE, channelUid);
    }
}
