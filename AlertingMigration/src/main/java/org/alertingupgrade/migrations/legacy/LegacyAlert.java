package org.alertingupgrade.migrations.legacy;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/** One legacy alert attached to a dashboard panel, as stored in the {@code alert} table */
@Value
@Builder
public class LegacyAlert {
    public static final String STATE_PAUSED = "paused";

    long id;
    long orgId;
    long dashboardId;
    long panelId;
    String name;
    String message;
    String state;
    /** Evaluation frequency in seconds */
    long frequency;
    Duration forDuration;
    boolean silenced;
    String executionError;
    Instant newStateDate;
    /** Raw settings blob; parsed with {@link LegacyAlertSettings#fromJson} during migration */
    JsonNode settings;

    public boolean isPaused() {
        return STATE_PAUSED.equals(state);
    }
}
