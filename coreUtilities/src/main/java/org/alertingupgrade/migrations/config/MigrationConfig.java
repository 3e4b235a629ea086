package org.alertingupgrade.migrations.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Root of the YAML configuration file. Field names mirror the file's snake_case keys.
 */
public class MigrationConfig {
    public Database database;
    public AlertingMigration alerting_migration;

    public static MigrationConfig loadFrom(String path) throws IOException {
        var yaml = new Yaml(new Constructor(MigrationConfig.class, new LoaderOptions()));
        try (var inputStream = new FileInputStream(path)) {
            var loaded = (MigrationConfig) yaml.load(inputStream);
            return loaded == null ? new MigrationConfig() : loaded;
        }
    }

    /**
     * Flattens the file into values keyed by command line flag name (without dashes).
     * Absent entries are left out.
     */
    public Map<String, String> toArgumentValues() {
        var values = new LinkedHashMap<String, String>();
        if (database != null) {
            put(values, "db-url", database.url);
            put(values, "db-username", database.username);
            put(values, "db-password", database.password);
        }
        if (alerting_migration != null) {
            put(values, "data-path", alerting_migration.data_path);
            put(values, "secret-key", alerting_migration.secret_key);
            put(values, "unified-alerting-enabled", alerting_migration.unified_alerting_enabled);
            put(values, "legacy-alerting-enabled", alerting_migration.legacy_alerting_enabled);
            put(values, "force-migration", alerting_migration.force_migration);
            put(values, "case-insensitive-titles", alerting_migration.case_insensitive_titles);
            put(values, "lock-lease-minutes", alerting_migration.lock_lease_minutes);
        }
        return values;
    }

    private static void put(Map<String, String> values, String key, Object value) {
        if (value != null) {
            values.put(key, value.toString());
        }
    }
}
