package org.alertingupgrade.migrations.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A legacy channel and the contact point it became; {@code contactPoint} is null when the channel failed */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactPair {
    private LegacyChannelSummary legacyChannel;
    private ContactPointUpgrade contactPoint;
    private boolean provisioned;
    private String error;
}
