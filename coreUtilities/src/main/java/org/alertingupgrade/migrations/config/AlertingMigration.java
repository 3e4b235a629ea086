package org.alertingupgrade.migrations.config;

public class AlertingMigration {
    public String data_path;
    public String secret_key;
    public Boolean unified_alerting_enabled;
    public Boolean legacy_alerting_enabled;
    public Boolean force_migration;
    public Boolean case_insensitive_titles;
    public Integer lock_lease_minutes;
}
