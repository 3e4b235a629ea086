package org.alertingupgrade.migrations.service;

import java.nio.file.Path;
import java.time.Duration;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MigrationSettings {
    @Builder.Default
    boolean unifiedAlertingEnabled = true;
    @Builder.Default
    boolean legacyAlertingEnabled = false;
    /** Allows rolling back a completed migration, deleting everything unified alerting stored */
    @Builder.Default
    boolean forceMigration = false;
    @Builder.Default
    Path dataPath = Path.of("data");
    /** Set when the database collates rule titles case-insensitively */
    @Builder.Default
    boolean caseInsensitiveTitles = false;
    @Builder.Default
    Duration lockLeaseDuration = Duration.ofMinutes(10);
}
