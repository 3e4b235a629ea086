package org.alertingupgrade.migrations.ledger;

import org.alertingupgrade.migrations.notifier.MigratedChannel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactPointUpgrade {
    /** Receiver name, which may differ from the channel name after deduplication */
    private String name;
    private String uid;
    private String type;
    private boolean disableResolveMessage;
    private String routeLabel;

    public static ContactPointUpgrade from(MigratedChannel channel) {
        var integration = channel.getReceiver().getIntegrations().get(0);
        return ContactPointUpgrade.builder()
            .name(channel.getReceiver().getName())
            .uid(integration.getUid())
            .type(integration.getType())
            .disableResolveMessage(integration.isDisableResolveMessage())
            .routeLabel(channel.getRouteLabel())
            .build();
    }
}
