package org.alertingupgrade.migrations.notifier;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class AlertingConfig extends JsonWithExtras {
    private Route route;

    private List<String> templates;

    @JsonProperty("receivers")
    private List<Receiver> receivers = new ArrayList<>();
}
