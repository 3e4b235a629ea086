package org.alertingupgrade.migrations.notifier;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class GrafanaIntegration extends JsonWithExtras {
    private String uid;
    private String name;
    private String type;
    private boolean disableResolveMessage;
    private ObjectNode settings;
    /** Key to base64 of the encrypted value */
    private Map<String, String> secureSettings = new LinkedHashMap<>();
}
