package org.alertingupgrade.migrations.rules;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Seconds before evaluation time at which the queried window starts and ends */
@Value
@Builder
@Jacksonized
public class RelativeTimeRange {
    public static final RelativeTimeRange NONE = RelativeTimeRange.builder().from(0).to(0).build();

    long from;
    long to;

    public static RelativeTimeRange of(Duration from, Duration to) {
        return RelativeTimeRange.builder().from(from.getSeconds()).to(to.getSeconds()).build();
    }
}
