package org.alertingupgrade.migrations.legacy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The parts of a legacy alert's settings blob the migration understands. Anything else is kept in
 * {@link #getOtherSettings()} so nothing is silently lost when the blob is re-serialized.
 */
@Data
@NoArgsConstructor
public class LegacyAlertSettings {
    private String noDataState;
    private String executionErrorState;
    private List<LegacyAlertCondition> conditions = new ArrayList<>();
    /** Either an object of tag name to value, or (a legacy quirk) an array, which yields no labels */
    private JsonNode alertRuleTags;
    private List<NotificationReference> notifications = new ArrayList<>();

    private final Map<String, JsonNode> otherSettings = new LinkedHashMap<>();

    @JsonAnySetter
    public void setOtherSetting(String name, JsonNode value) {
        otherSettings.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getOtherSettings() {
        return otherSettings;
    }

    public static LegacyAlertSettings fromJson(ObjectMapper mapper, JsonNode settings) throws JsonProcessingException {
        if (settings == null || settings.isNull()) {
            return new LegacyAlertSettings();
        }
        var parsed = mapper.treeToValue(settings, LegacyAlertSettings.class);
        if (parsed.conditions == null) {
            parsed.conditions = new ArrayList<>();
        }
        if (parsed.notifications == null) {
            parsed.notifications = new ArrayList<>();
        }
        return parsed;
    }

    /** Tag labels; only a JSON object of tags is honoured */
    public Map<String, String> tagLabels() {
        var labels = new LinkedHashMap<String, String>();
        if (alertRuleTags != null && alertRuleTags.isObject()) {
            alertRuleTags.fields().forEachRemaining(e -> labels.put(e.getKey(), e.getValue().asText()));
        }
        return labels;
    }
}
