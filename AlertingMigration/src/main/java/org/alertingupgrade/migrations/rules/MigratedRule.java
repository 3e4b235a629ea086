package org.alertingupgrade.migrations.rules;

import lombok.Builder;
import lombok.Value;

/** A synthesized rule plus the legacy "keep last state" settings that still need silences */
@Value
@Builder
public class MigratedRule {
    AlertRule rule;
    boolean keepStateOnNoData;
    boolean keepStateOnError;

    public boolean needsSilences() {
        return keepStateOnNoData || keepStateOnError;
    }
}
