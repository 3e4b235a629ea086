package org.alertingupgrade.migrations.ledger;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.alertingupgrade.migrations.common.ModelDuration;
import org.alertingupgrade.migrations.rules.AlertRule;
import org.alertingupgrade.migrations.rules.ExecutionErrorState;
import org.alertingupgrade.migrations.rules.NoDataState;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRuleUpgrade {
    private String uid;
    private String title;
    private String dashboardUid;
    private Long panelId;
    private NoDataState noDataState;
    private ExecutionErrorState execErrState;
    @JsonProperty("for")
    @JsonSerialize(using = ModelDuration.Serializer.class)
    @JsonDeserialize(using = ModelDuration.Deserializer.class)
    private Duration forDuration;
    @Builder.Default
    private Map<String, String> annotations = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, String> labels = new LinkedHashMap<>();
    @JsonProperty("isPaused")
    private boolean paused;

    public static AlertRuleUpgrade from(AlertRule rule) {
        return AlertRuleUpgrade.builder()
            .uid(rule.getUid())
            .title(rule.getTitle())
            .dashboardUid(rule.getDashboardUid())
            .panelId(rule.getPanelId())
            .noDataState(rule.getNoDataState())
            .execErrState(rule.getExecErrState())
            .forDuration(rule.getForDuration() == null ? Duration.ZERO : rule.getForDuration())
            .annotations(new LinkedHashMap<>(rule.getAnnotations()))
            .labels(new LinkedHashMap<>(rule.getLabels()))
            .paused(rule.isPaused())
            .build();
    }
}
