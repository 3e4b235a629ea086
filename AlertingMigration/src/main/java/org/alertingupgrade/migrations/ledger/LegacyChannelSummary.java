package org.alertingupgrade.migrations.ledger;

import java.time.Duration;

import org.alertingupgrade.migrations.common.ModelDuration;
import org.alertingupgrade.migrations.legacy.LegacyNotificationChannel;

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
public class LegacyChannelSummary {
    private long id;
    private String uid;
    private String name;
    private String type;
    private boolean sendReminder;
    private boolean disableResolveMessage;
    @JsonSerialize(using = ModelDuration.Serializer.class)
    @JsonDeserialize(using = ModelDuration.Deserializer.class)
    private Duration frequency;
    @JsonProperty("isDefault")
    private boolean defaultChannel;

    public static LegacyChannelSummary from(LegacyNotificationChannel channel) {
        return LegacyChannelSummary.builder()
            .id(channel.getId())
            .uid(channel.getUid())
            .name(channel.getName())
            .type(channel.getType())
            .sendReminder(channel.isSendReminder())
            .disableResolveMessage(channel.isDisableResolveMessage())
            .frequency(channel.getFrequency() == null ? Duration.ZERO : channel.getFrequency())
            .defaultChannel(channel.isDefault())
            .build();
    }
}
