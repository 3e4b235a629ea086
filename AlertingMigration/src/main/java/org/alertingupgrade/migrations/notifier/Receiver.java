package org.alertingupgrade.migrations.notifier;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/** A contact point: a name and the integrations that deliver to it */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class Receiver extends JsonWithExtras {
    private String name;

    @JsonProperty("grafana_managed_receiver_configs")
    private List<GrafanaIntegration> integrations = new ArrayList<>();

    public Receiver(String name) {
        this.name = name;
    }
}
