package org.alertingupgrade.migrations.arguments;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ArgLogUtilsTest {
    private static final List<String> CENSORED = ArgNameConstants.joinLists(
        ArgNameConstants.CENSORED_DB_ARGS,
        ArgNameConstants.CENSORED_SECRET_ARGS
    );

    @Test
    void testNoCredentialArgs() {
        String[] args = {"migrate-org", "--org-id", "4"};
        List<String> redacted = ArgLogUtils.getRedactedArgs(args, CENSORED);

        Assertions.assertEquals(List.of("migrate-org", "--org-id", "4"), redacted);
    }

    @Test
    void testDbPasswordRedacted() {
        String[] args = {"--db-password", "hunter2", "--db-url", "jdbc:postgresql://db/grafana"};
        List<String> redacted = ArgLogUtils.getRedactedArgs(args, CENSORED);

        Assertions.assertEquals(
            List.of("--db-password", ArgLogUtils.CENSORED_VALUE, "--db-url", "jdbc:postgresql://db/grafana"),
            redacted
        );
    }

    @Test
    void testSecretKeyCamelCaseRedacted() {
        String[] args = {"--secretKey", "SW2YcwTIb9zpOOhoPsMm"};
        List<String> redacted = ArgLogUtils.getRedactedArgs(args, CENSORED);

        Assertions.assertEquals(List.of("--secretKey", ArgLogUtils.CENSORED_VALUE), redacted);
    }

    @Test
    void testEqualsSyntaxRedacted() {
        String[] args = {"--db-password=hunter2", "run"};
        List<String> redacted = ArgLogUtils.getRedactedArgs(args, CENSORED);

        Assertions.assertEquals(List.of("--db-password=" + ArgLogUtils.CENSORED_VALUE, "run"), redacted);
    }

    @Test
    void testFlagAsLastArgument() {
        String[] args = {"run", "--db-password"};
        List<String> redacted = ArgLogUtils.getRedactedArgs(args, CENSORED);

        Assertions.assertEquals(List.of("run", "--db-password"), redacted);
    }
}
