package org.alertingupgrade.migrations;

import com.beust.jcommander.Parameter;

/** Options shared by every command; unset values fall back to the configuration file, then to defaults */
public class ToolArgs {
    @Parameter(names = {"--help", "-h"}, help = true, description = "Displays information about how to use this tool")
    public boolean help;

    @Parameter(names = { "--config-file", "-c" }, description = "The path to a YAML config file")
    public String configFile;

    @Parameter(names = { "--db-url" }, description = "JDBC url of the Grafana database")
    public String dbUrl;

    @Parameter(names = { "--db-username" }, description = "Database user")
    public String dbUsername;

    @Parameter(names = { "--db-password" }, description = "Database password")
    public String dbPassword;

    @Parameter(names = { "--data-path" }, description = "Grafana data directory; silence files are written below it")
    public String dataPath;

    @Parameter(names = { "--secret-key" }, description = "Key that encrypts notification channel secure settings")
    public String secretKey;

    @Parameter(names = { "--unified-alerting-enabled" }, arity = 1,
        description = "Whether unified alerting is enabled. Default: true")
    public Boolean unifiedAlertingEnabled;

    @Parameter(names = { "--legacy-alerting-enabled" }, arity = 1,
        description = "Whether legacy alerting is enabled. Default: false")
    public Boolean legacyAlertingEnabled;

    @Parameter(names = { "--force-migration" }, arity = 1,
        description = "Allow rolling back to legacy alerting, deleting all unified alerting data. Default: false")
    public Boolean forceMigration;

    @Parameter(names = { "--case-insensitive-titles" }, arity = 1,
        description = "Treat rule titles that differ only in case as equal. Default: false")
    public Boolean caseInsensitiveTitles;

    @Parameter(names = { "--lock-lease-minutes" }, description = "Lease of the server lock taken by 'run'. Default: 10")
    public Integer lockLeaseMinutes;
}
