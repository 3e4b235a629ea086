package org.alertingupgrade.migrations.notifier;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/** The stored per-org Alertmanager configuration document */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class AlertmanagerConfiguration extends JsonWithExtras {
    @JsonProperty("template_files")
    private Map<String, String> templateFiles = new LinkedHashMap<>();

    @JsonProperty("alertmanager_config")
    private AlertingConfig alertmanagerConfig = new AlertingConfig();
}
