package org.alertingupgrade.migrations.notifier;

import lombok.Builder;
import lombok.Value;

/** The receiver and nested route that replace one legacy channel */
@Value
@Builder
public class MigratedChannel {
    Receiver receiver;
    Route route;

    /** Label the route matches on */
    public String getRouteLabel() {
        return route.getObjectMatchers().isEmpty() ? null : route.getObjectMatchers().get(0).getName();
    }
}
