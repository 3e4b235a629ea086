package org.alertingupgrade.migrations.jcommander;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class EnvVarParameterPullerTest {

    enum Mode { FAST, SAFE }

    static class TestParams {
        @Parameter(names = {"--db-username", "--dbUsername"})
        String dbUsername;

        @Parameter(names = {"--db-password"})
        String dbPassword;

        @Parameter(names = {"--org-id"})
        long orgId = 0L;

        @Parameter(names = {"--lock-lease-minutes"})
        int lockLeaseMinutes = 10;

        @Parameter(names = {"--force-migration"}, arity = 1)
        boolean forceMigration = false;

        @Parameter(names = {"--mode"})
        Mode mode = Mode.SAFE;

        @ParametersDelegate
        NestedParams nestedParams = new NestedParams();
    }

    static class NestedParams {
        @Parameter(names = {"--data-path"})
        String dataPath;
    }

    private EnvVarParameterPuller.EnvVarGetter envOf(Map<String, String> envVars) {
        return envVars::get;
    }

    @Test
    void testInjectsPrefixedVariables() {
        var params = new TestParams();
        var env = new HashMap<String, String>();
        env.put("ALERTING_MIGRATION_DB_USERNAME", "grafana");
        env.put("ALERTING_MIGRATION_ORG_ID", "7");
        env.put("ALERTING_MIGRATION_FORCE_MIGRATION", "true");
        env.put("ALERTING_MIGRATION_MODE", "fast");

        EnvVarParameterPuller.injectFromEnv(params, envOf(env), "ALERTING_MIGRATION_");

        Assertions.assertEquals("grafana", params.dbUsername);
        Assertions.assertEquals(7L, params.orgId);
        Assertions.assertTrue(params.forceMigration);
        Assertions.assertEquals(Mode.FAST, params.mode);
    }

    @Test
    void testNestedParametersDelegateInjection() {
        var params = new TestParams();
        var env = Map.of("ALERTING_MIGRATION_DATA_PATH", "/var/lib/grafana");

        EnvVarParameterPuller.injectFromEnv(params, envOf(env), "ALERTING_MIGRATION_");

        Assertions.assertEquals("/var/lib/grafana", params.nestedParams.dataPath);
    }

    @Test
    void testCredentialsFallBackToUnprefixedName() {
        var params = new TestParams();
        var env = Map.of("DB_PASSWORD", "s3cret");

        EnvVarParameterPuller.injectFromEnv(params, envOf(env), "ALERTING_MIGRATION_");

        Assertions.assertEquals("s3cret", params.dbPassword);
    }

    @Test
    void testPrefixedNameWinsOverUnprefixed() {
        var params = new TestParams();
        var env = Map.of("DB_PASSWORD", "generic", "ALERTING_MIGRATION_DB_PASSWORD", "specific");

        EnvVarParameterPuller.injectFromEnv(params, envOf(env), "ALERTING_MIGRATION_");

        Assertions.assertEquals("specific", params.dbPassword);
    }

    @Test
    void testInvalidNumberKeepsDefault() {
        var params = new TestParams();
        var env = Map.of("ALERTING_MIGRATION_LOCK_LEASE_MINUTES", "ten");

        EnvVarParameterPuller.injectFromEnv(params, envOf(env), "ALERTING_MIGRATION_");

        Assertions.assertEquals(10, params.lockLeaseMinutes);
    }

    @Test
    void testCommandLineOverridesInjectedValues() {
        var params = new TestParams();
        EnvVarParameterPuller.injectFromEnv(params, envOf(Map.of("ALERTING_MIGRATION_ORG_ID", "7")), "ALERTING_MIGRATION_");

        JCommander.newBuilder().addObject(params).build().parse("--org-id", "9");

        Assertions.assertEquals(9L, params.orgId);
    }

    @Test
    void testInjectFromValuesUsesFlagNames() {
        var params = new TestParams();
        var values = new HashMap<String, String>();
        values.put("db-username", "from-file");
        values.put("data-path", "/srv/grafana");

        EnvVarParameterPuller.injectFromValues(params, values);

        Assertions.assertEquals("from-file", params.dbUsername);
        Assertions.assertEquals("/srv/grafana", params.nestedParams.dataPath);
        Assertions.assertNull(params.dbPassword);
    }

    @Test
    void testToEnvVarNames() {
        Assertions.assertEquals(List.of("ALERTING_MIGRATION_ORG_ID"),
            EnvVarParameterPuller.toEnvVarNames("--org-id", "ALERTING_MIGRATION_", ""));
        Assertions.assertEquals(List.of("ALERTING_MIGRATION_DB_PASSWORD", "DB_PASSWORD"),
            EnvVarParameterPuller.toEnvVarNames("--dbPassword", "ALERTING_MIGRATION_", ""));
        Assertions.assertEquals(List.of("SECRET_KEY"),
            EnvVarParameterPuller.toEnvVarNames("--secret-key", "", ""));
    }
}
