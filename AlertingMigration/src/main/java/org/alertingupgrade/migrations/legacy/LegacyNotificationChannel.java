package org.alertingupgrade.migrations.legacy;

import java.time.Duration;
import java.util.Map;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** A row of the legacy {@code alert_notification} table */
@Value
@Builder(toBuilder = true)
public class LegacyNotificationChannel {
    long id;
    long orgId;
    String uid;
    String name;
    String type;
    boolean isDefault;
    boolean sendReminder;
    Duration frequency;
    boolean disableResolveMessage;
    ObjectNode settings;
    /** Key to base64 of the encrypted value */
    @Singular
    Map<String, String> secureSettings;
}
