package org.alertingupgrade.migrations.ledger;

import java.time.Duration;

import org.alertingupgrade.migrations.common.ModelDuration;
import org.alertingupgrade.migrations.legacy.LegacyAlert;

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
public class LegacyAlertSummary {
    private long id;
    private long dashboardId;
    private long panelId;
    private String name;
    private boolean paused;
    private boolean silenced;
    private String executionError;
    private long frequency;
    @JsonProperty("for")
    @JsonSerialize(using = ModelDuration.Serializer.class)
    @JsonDeserialize(using = ModelDuration.Deserializer.class)
    private Duration forDuration;

    public static LegacyAlertSummary from(LegacyAlert alert) {
        return LegacyAlertSummary.builder()
            .id(alert.getId())
            .dashboardId(alert.getDashboardId())
            .panelId(alert.getPanelId())
            .name(alert.getName())
            .paused(alert.isPaused())
            .silenced(alert.isSilenced())
            .executionError(alert.getExecutionError())
            .frequency(alert.getFrequency())
            .forDuration(alert.getForDuration() == null ? Duration.ZERO : alert.getForDuration())
            .build();
    }
}
