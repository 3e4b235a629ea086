package org.alertingupgrade.migrations.rules;

import lombok.experimental.UtilityClass;

/**
 * Legacy messages could reference {@code ${instance}}, the label values of the firing series. Unified alerting
 * templates see every series at once, so the values are merged first and the placeholder reads from the merge.
 */
@UtilityClass
public class MessageTemplateMigrator {
    static final String INSTANCE_PLACEHOLDER = "${instance}";
    static final String MERGED_LABELS_PREAMBLE = "{{- $mergedLabels := mergeLabelValues $values -}}\n";
    static final String MERGED_INSTANCE_REFERENCE = "{{$mergedLabels.instance}}";

    public static String migrate(String message) {
        if (message == null || !message.contains(INSTANCE_PLACEHOLDER)) {
            return message;
        }
        return MERGED_LABELS_PREAMBLE + message.replace(INSTANCE_PLACEHOLDER, MERGED_INSTANCE_REFERENCE);
    }
}
