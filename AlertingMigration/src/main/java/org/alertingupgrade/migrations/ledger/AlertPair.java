package org.alertingupgrade.migrations.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A legacy alert and the rule it became; {@code alertRule} is null when the alert failed */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertPair {
    private LegacyAlertSummary legacyAlert;
    private AlertRuleUpgrade alertRule;
    private String error;
}
